package com.weavecipher.common;

/** Thrown for an empty key or a key holding a code outside [0, 128). */
public class InvalidCipherKeyException extends TransformException {

    public InvalidCipherKeyException(String message) {
        super(message);
    }
}
