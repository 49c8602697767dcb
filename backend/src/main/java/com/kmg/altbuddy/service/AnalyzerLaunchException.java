package com.kmg.altbuddy.service;

public class AnalyzerLaunchException extends RuntimeException {
    public AnalyzerLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
