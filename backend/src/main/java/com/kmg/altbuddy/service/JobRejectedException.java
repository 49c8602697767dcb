package com.kmg.altbuddy.service;

public class JobRejectedException extends RuntimeException {
    public JobRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
