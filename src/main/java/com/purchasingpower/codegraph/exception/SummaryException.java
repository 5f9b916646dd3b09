package com.purchasingpower.codegraph.exception;

public class SummaryException extends RuntimeException {

    public SummaryException(String message, Throwable cause) {
        super(message, cause);
    }
}
