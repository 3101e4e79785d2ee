package com.raditha.neardup.model;

/**
 * Raised when a query or document record cannot be turned into a token sequence.
 * Loaders catch it per record, skip the record and report it by identifier.
 */
public class MalformedInputException extends RuntimeException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
