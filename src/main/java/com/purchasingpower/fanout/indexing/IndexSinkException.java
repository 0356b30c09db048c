package com.purchasingpower.fanout.indexing;

/**
 * A sink could not write some or all documents of a batch.
 */
public class IndexSinkException extends RuntimeException {

    public IndexSinkException(String message) {
        super(message);
    }

    public IndexSinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
