package com.chatbridge.shared.config;

public enum ForwardMode {
    OFF,
    FOLDER;

    public static ForwardMode parse(String value) {
        return "folder".equalsIgnoreCase(value == null ? "" : value.trim()) ? FOLDER : OFF;
    }
}
