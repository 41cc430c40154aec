package com.chatbridge.protocol;

/**
 * A media message ready to send: the upload result plus the fields the message itself carries.
 * {@code waveform} and {@code seconds} are only set for voice notes.
 */
public record OutgoingMedia(
    MediaKind kind,
    String mimetype,
    String fileName,
    String caption,
    UploadedMedia uploaded,
    Integer seconds,
    byte[] waveform,
    boolean voiceNote
) {}
