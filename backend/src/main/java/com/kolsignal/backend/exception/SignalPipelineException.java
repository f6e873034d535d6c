package com.kolsignal.backend.exception;

public class SignalPipelineException extends RuntimeException {
    public SignalPipelineException(String message) {
        super(message);
    }
}
