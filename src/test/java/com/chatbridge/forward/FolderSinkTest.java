package com.chatbridge.forward;

import com.chatbridge.shared.model.Envelope;
import com.chatbridge.shared.model.EventTypes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FolderSinkTest {

    @TempDir
    Path tempDir;

    private static Envelope message(String chat, String sender) {
        return Envelope.builder(EventTypes.MESSAGE).chatId(chat).senderId(sender).build();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void partitionsByConversationKind() {
        var sink = new FolderSink(tempDir, 0, "host-1");

        assertEquals(tempDir.resolve("groups/1203-99_g.us.ndjson"),
                sink.targetFor(message("1203-99@g.us", "5511@s.whatsapp.net")));
        assertEquals(tempDir.resolve("contacts/5511_s.whatsapp.net.ndjson"),
                sink.targetFor(message("5511@s.whatsapp.net", "5511@s.whatsapp.net")));
        assertEquals(tempDir.resolve("contacts/5522_s.whatsapp.net.ndjson"),
                sink.targetFor(message("status@broadcast", "5522@s.whatsapp.net")));
        assertEquals(tempDir.resolve("devices/host-1.ndjson"),
                sink.targetFor(Envelope.builder(EventTypes.CONNECTED).build()));
        assertEquals(tempDir.resolve("system/weird_event.ndjson"),
                sink.targetFor(Envelope.builder("weird/event").build()));
    }

    @Test
    void statusFromDeviceSenderSharesTheContactFile() {
        var sink = new FolderSink(tempDir, 0, "host-1");

        var direct = sink.targetFor(message("5511999@s.whatsapp.net", "5511999@s.whatsapp.net"));
        var status = sink.targetFor(message("status@broadcast", "5511999:3@s.whatsapp.net"));

        assertEquals(tempDir.resolve("contacts/5511999_s.whatsapp.net.ndjson"), status);
        assertEquals(direct, status);
    }

    @Test
    void appendsOneLinePerEnvelope() throws IOException {
        var sink = new FolderSink(tempDir, 0, "h");
        var env = message("5511@s.whatsapp.net", "5511@s.whatsapp.net");

        var first = sink.append(env, bytes("{\"n\":1}"));
        var second = sink.append(env, bytes("{\"n\":2}"));

        assertEquals(first, second);
        assertEquals(List.of("{\"n\":1}", "{\"n\":2}"), Files.readAllLines(first));
    }

    @Test
    void rotatesIntoNumberedPartsInOrder() throws IOException {
        var sink = new FolderSink(tempDir, 20, "h");
        var env = message("5511@s.whatsapp.net", null);
        var base = sink.targetFor(env);

        sink.append(env, bytes("aaaaaaaaa1"));
        sink.append(env, bytes("aaaaaaaaa2"));
        sink.append(env, bytes("aaaaaaaaa3"));

        assertEquals(List.of("aaaaaaaaa1"), Files.readAllLines(base));
        assertEquals(List.of("aaaaaaaaa2"), Files.readAllLines(base.resolveSibling(base.getFileName() + ".part1")));
        assertEquals(List.of("aaaaaaaaa3"), Files.readAllLines(base.resolveSibling(base.getFileName() + ".part2")));
    }

    @Test
    void oversizedSingleLineStillLandsInEmptyFile() throws IOException {
        var sink = new FolderSink(tempDir, 4, "h");
        var path = sink.append(message("1@s.whatsapp.net", null), bytes("longer than four"));
        assertEquals(1, Files.readAllLines(path).size());
    }

    @Test
    void sanitizeReplacesUnsafeCharacters() {
        assertEquals("a_b_c.d-e", FolderSink.sanitize("a/b@c.d-e"));
        assertEquals("unknown", FolderSink.sanitize(""));
    }

    @Test
    void ioFailureSurfacesAsSinkException() throws IOException {
        var blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");
        var sink = new FolderSink(blocker, 0, "h");
        assertThrows(SinkException.class, () -> sink.append(message("1@s.whatsapp.net", null), bytes("{}")));
    }
}
