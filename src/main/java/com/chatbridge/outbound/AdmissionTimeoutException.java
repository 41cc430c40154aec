package com.chatbridge.outbound;

public class AdmissionTimeoutException extends RuntimeException {

    public AdmissionTimeoutException(String message) {
        super(message);
    }
}
