package com.travel.tripgraph.exception;

/**
 * A single record could not be read from its source. The source stays usable for the following records.
 */
public class RecordReadException extends RuntimeException {

    public RecordReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
