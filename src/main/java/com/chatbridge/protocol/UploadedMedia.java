package com.chatbridge.protocol;

public record UploadedMedia(
    String url,
    String directPath,
    byte[] mediaKey,
    byte[] fileSha256,
    byte[] fileEncSha256,
    long fileLength
) {}
