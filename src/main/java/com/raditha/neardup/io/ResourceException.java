package com.raditha.neardup.io;

/**
 * A corpus or query resource could not be read or decompressed.
 */
public class ResourceException extends RuntimeException {

    public ResourceException(String message) {
        super(message);
    }

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
