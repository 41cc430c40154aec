package com.chatbridge.shared.model;

public record SendResult(
    boolean success,
    String message
) {
    public static SendResult ok(String message) {
        return new SendResult(true, message);
    }

    public static SendResult failed(String message) {
        return new SendResult(false, message);
    }
}
