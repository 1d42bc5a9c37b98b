package com.trelloreport.weekly.output;

public class ReportOutputException extends RuntimeException {

    public ReportOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
