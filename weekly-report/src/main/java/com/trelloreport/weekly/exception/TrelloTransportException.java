package com.trelloreport.weekly.exception;

/**
 * A Trello API call failed at the network or HTTP level (connection failure or non-2xx status).
 */
public class TrelloTransportException extends RuntimeException {

    public TrelloTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
