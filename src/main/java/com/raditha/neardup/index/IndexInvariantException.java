package com.raditha.neardup.index;

/**
 * A query index was built in an inconsistent state. This is a defect, never an input problem.
 */
public class IndexInvariantException extends IllegalStateException {

    public IndexInvariantException(String message) {
        super(message);
    }
}
