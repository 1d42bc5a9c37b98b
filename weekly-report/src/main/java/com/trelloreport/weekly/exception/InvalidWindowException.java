package com.trelloreport.weekly.exception;

public class InvalidWindowException extends IllegalArgumentException {

    public InvalidWindowException(String message) {
        super(message);
    }
}
