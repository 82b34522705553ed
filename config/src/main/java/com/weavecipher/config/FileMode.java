package com.weavecipher.config;

public enum FileMode {
    BUFFERED,    // read the whole file, substitute and interleave
    STREAMING    // per-character substitution only, no interleave
}
