package com.uptimer.service;

public class ReportSerializationException extends RuntimeException {

    public ReportSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
