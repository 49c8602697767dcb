package com.kmg.altbuddy.service;

public class JobValidationException extends IllegalArgumentException {
    public JobValidationException(String message) {
        super(message);
    }
}
