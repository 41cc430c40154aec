package com.chatbridge.outbound;

public enum OperationClass {
    TEXT,
    MEDIA,
    STATUS
}
