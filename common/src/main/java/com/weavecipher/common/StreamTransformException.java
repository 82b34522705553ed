package com.weavecipher.common;

import java.io.IOException;

/**
 * A read or write failed in the middle of a stream transform.
 * Output written before the failure is left in place.
 */
public class StreamTransformException extends IOException {
    private final long bytesTransformed;

    public StreamTransformException(String message, long bytesTransformed, Throwable cause) {
        super(message, cause);
        this.bytesTransformed = bytesTransformed;
    }

    /** Number of bytes fully transformed and written before the failure. */
    public long getBytesTransformed() {
        return bytesTransformed;
    }
}
