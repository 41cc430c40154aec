package com.chatbridge.engine;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Random;

/**
 * Voice-note metadata for Ogg/Opus files: duration from the last granule position and a
 * 64-sample placeholder waveform.
 */
public final class OggOpusInspector {

    public static final int DEFAULT_SECONDS = 30;
    public static final int MIN_SECONDS = 1;
    public static final int MAX_SECONDS = 300;
    public static final int WAVEFORM_SAMPLES = 64;

    private static final byte[] CAPTURE = "OggS".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] OPUS_HEAD = "OpusHead".getBytes(StandardCharsets.US_ASCII);
    private static final int HEADER_LEN = 27;
    private static final double SAMPLE_RATE = 48_000;

    private OggOpusInspector() {}

    public static boolean isOgg(byte[] data) {
        return data != null && data.length >= 4 && startsWith(data, 0, CAPTURE);
    }

    /** Whole seconds clamped to 1..300; {@value #DEFAULT_SECONDS} when the stream carries no granule. */
    public static int durationSeconds(byte[] data) {
        if (!isOgg(data)) {
            throw new IllegalArgumentException("not an Ogg stream");
        }
        var buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        long lastGranule = 0;
        int preSkip = 0;
        int i = 0;
        while (i + HEADER_LEN < data.length) {
            if (!startsWith(data, i, CAPTURE)) {
                i++;
                continue;
            }
            long granule = buf.getLong(i + 6);
            int segments = data[i + 26] & 0xff;
            if (i + HEADER_LEN + segments >= data.length) break;
            int pageSize = HEADER_LEN + segments;
            for (int s = 0; s < segments; s++) {
                pageSize += data[i + HEADER_LEN + s] & 0xff;
            }
            int body = i + HEADER_LEN + segments;
            if (preSkip == 0 && body + 12 <= data.length && startsWith(data, body, OPUS_HEAD)) {
                preSkip = buf.getShort(body + 10) & 0xffff;
            }
            // -1 marks a page on which no packet ends
            if (granule > 0) lastGranule = granule;
            i += pageSize;
        }
        if (lastGranule <= 0) return DEFAULT_SECONDS;
        double secs = (lastGranule - preSkip) / SAMPLE_RATE;
        return clamp((int) Math.ceil(secs));
    }

    /** Deterministic for a given duration. Values 0..100. */
    public static byte[] placeholderWaveform(int seconds) {
        var w = new byte[WAVEFORM_SAMPLES];
        var rnd = new Random(seconds);
        double baseAmp = 35.0;
        double freq = Math.min(seconds, 120) / 30.0;
        for (int i = 0; i < w.length; i++) {
            double pos = (double) i / w.length;
            double val = baseAmp * Math.sin(pos * Math.PI * freq * 8)
                    + (baseAmp / 2) * Math.sin(pos * Math.PI * freq * 16);
            val += (rnd.nextDouble() - 0.5) * 15;
            val = val * (0.7 + 0.3 * Math.sin(pos * Math.PI)) + 50;
            w[i] = (byte) Math.max(0, Math.min(100, val));
        }
        return w;
    }

    static int clamp(int seconds) {
        return Math.max(MIN_SECONDS, Math.min(MAX_SECONDS, seconds));
    }

    private static boolean startsWith(byte[] data, int at, byte[] prefix) {
        if (at + prefix.length > data.length) return false;
        for (int k = 0; k < prefix.length; k++) {
            if (data[at + k] != prefix[k]) return false;
        }
        return true;
    }
}
