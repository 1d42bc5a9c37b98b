package com.trelloreport.weekly.exception;

/**
 * The aggregating thread was interrupted; no partial result is returned.
 */
public class AggregationCancelledException extends RuntimeException {

    public AggregationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
