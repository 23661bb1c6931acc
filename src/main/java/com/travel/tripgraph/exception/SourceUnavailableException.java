package com.travel.tripgraph.exception;

/**
 * The dataset or the graph store cannot be reached. Fatal to an ingestion run.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
