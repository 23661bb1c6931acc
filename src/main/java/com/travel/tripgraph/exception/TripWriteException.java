package com.travel.tripgraph.exception;

/**
 * A step of a trip write did not take effect; the record's transaction is rolled back.
 */
public class TripWriteException extends RuntimeException {

    public TripWriteException(String message) {
        super(message);
    }
}
