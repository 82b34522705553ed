package com.weavecipher.common;

import java.util.Locale;

public enum TransformDirection {
    ENCODE,   // substitute, then interleave
    DECODE;   // de-interleave, then reverse the substitution

    /** Lower-case tag value used for metrics and log lines. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the command-line selector: "e" / "encode" or "d" / "decode", any case.
     */
    public static TransformDirection fromSelector(String selector) {
        if (selector == null) {
            throw new IllegalArgumentException("Direction selector cannot be null");
        }
        switch (selector.trim().toLowerCase(Locale.ROOT)) {
            case "e":
            case "encode":
                return ENCODE;
            case "d":
            case "decode":
                return DECODE;
            default:
                throw new IllegalArgumentException("Unknown direction selector: " + selector);
        }
    }
}
