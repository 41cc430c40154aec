package com.chatbridge.protocol;

/**
 * Decoded message body. Any field may be null; a message usually carries exactly one of them.
 */
public record MessageContent(
    String conversation,
    String extendedText,
    MediaPart image,
    MediaPart audio,
    MediaPart video,
    MediaPart document
) {

    public static MessageContent text(String body) {
        return new MessageContent(body, null, null, null, null, null);
    }

    public static MessageContent media(MediaPart part) {
        if (part == null) return new MessageContent(null, null, null, null, null, null);
        switch (part.kind()) {
            case IMAGE:
                return new MessageContent(null, null, part, null, null, null);
            case AUDIO:
                return new MessageContent(null, null, null, part, null, null);
            case VIDEO:
                return new MessageContent(null, null, null, null, part, null);
            default:
                return new MessageContent(null, null, null, null, null, part);
        }
    }

    /** Plain body, then the extended (quoted/linked) body, then the media caption. */
    public String text() {
        if (notBlank(conversation)) return conversation;
        if (notBlank(extendedText)) return extendedText;
        for (var part : new MediaPart[]{image, video, document}) {
            if (part != null && notBlank(part.caption())) return part.caption();
        }
        return "";
    }

    /** First attachment in image, audio, video, document order, or null. */
    public MediaPart mediaPart() {
        if (image != null) return image;
        if (audio != null) return audio;
        if (video != null) return video;
        return document;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
