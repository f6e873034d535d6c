package com.kolsignal.backend.exception;

public class InvalidTokenAddressException extends SignalPipelineException {
    public InvalidTokenAddressException(String tokenAddress) {
        super("Invalid token address: " + tokenAddress);
    }
}
