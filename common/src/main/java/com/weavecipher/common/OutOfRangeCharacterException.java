package com.weavecipher.common;

/**
 * Thrown when an input character code falls outside the 7-bit domain.
 */
public class OutOfRangeCharacterException extends TransformException {
    private final long position;
    private final int code;

    public OutOfRangeCharacterException(long position, int code) {
        super(String.format("Character code %d at position %d is outside [0, %d)",
                code, position, CharacterDomain.MODULUS));
        this.position = position;
        this.code = code;
    }

    /** Zero-based offset of the offending character in its input. */
    public long getPosition() {
        return position;
    }

    public int getCode() {
        return code;
    }
}
