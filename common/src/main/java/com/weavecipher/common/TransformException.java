package com.weavecipher.common;

/**
 * Base type for rejected transform input (bad keys, out-of-range characters).
 * Recoverable: the caller may fix the input and retry.
 */
public class TransformException extends IllegalArgumentException {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
