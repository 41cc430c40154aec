package com.chatbridge.forward;

import com.chatbridge.protocol.ChatIds;
import com.chatbridge.shared.model.Envelope;
import com.chatbridge.shared.model.EventTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only NDJSON files under {@code <base>/<category>/<key>.ndjson}. Groups are filed by group
 * id, private chats and status updates by contact, connection-lifecycle events by host and
 * everything else by event type. With a positive byte ceiling a full file continues in
 * {@code .part1}, {@code .part2}, ... in order.
 */
public class FolderSink {

    private static final Logger log = LoggerFactory.getLogger(FolderSink.class);
    private static final int MAX_PARTS = 1000;
    private static final byte[] NEWLINE = {'\n'};

    public static final String CONTACTS = "contacts";
    public static final String GROUPS = "groups";
    public static final String DEVICES = "devices";
    public static final String SYSTEM = "system";

    private final Path base;
    private final long maxBytes;
    private final String hostId;
    private final ConcurrentHashMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FolderSink(Path base, long maxBytes) {
        this(base, maxBytes, localHost());
    }

    public FolderSink(Path base, long maxBytes, String hostName) {
        this.base = base;
        this.maxBytes = maxBytes;
        this.hostId = sanitize(hostName);
    }

    /** Writes {@code payload} followed by a newline to the file that {@code env} belongs to. */
    public Path append(Envelope env, byte[] payload) {
        var target = targetFor(env);
        var lock = locks.computeIfAbsent(target, k -> new ReentrantLock());
        lock.lock();
        try {
            Files.createDirectories(target.getParent());
            var path = rotate(target, payload.length + 1L);
            var line = new byte[payload.length + 1];
            System.arraycopy(payload, 0, line, 0, payload.length);
            System.arraycopy(NEWLINE, 0, line, payload.length, 1);
            Files.write(path, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE);
            log.debug("sink_append file={} bytes={}", path, line.length);
            return path;
        } catch (IOException e) {
            throw new SinkException("Failed to append to " + target, e);
        } finally {
            lock.unlock();
        }
    }

    public Path targetFor(Envelope env) {
        var chat = env.chatId() == null ? "" : env.chatId();
        var sender = env.senderId() == null ? "" : env.senderId();
        if (ChatIds.isGroup(chat)) {
            return base.resolve(GROUPS).resolve(sanitize(chat) + ".ndjson");
        }
        if (ChatIds.isStatusBroadcast(chat) && !sender.isEmpty()) {
            return base.resolve(CONTACTS).resolve(sanitize(ChatIds.canonical(sender)) + ".ndjson");
        }
        if (!chat.isEmpty()) {
            return base.resolve(CONTACTS).resolve(sanitize(chat) + ".ndjson");
        }
        if (EventTypes.DEVICE_EVENTS.contains(env.eventType())) {
            return base.resolve(DEVICES).resolve(hostId + ".ndjson");
        }
        return base.resolve(SYSTEM).resolve(sanitize(env.eventType()) + ".ndjson");
    }

    /** Keeps {@code [A-Za-z0-9._-]}, replaces everything else with {@code _}; empty becomes "unknown". */
    public static String sanitize(String s) {
        if (s == null || s.isEmpty()) return "unknown";
        var sb = new StringBuilder(s.length());
        s.codePoints().forEach(cp -> {
            boolean keep = (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z')
                    || (cp >= '0' && cp <= '9') || cp == '.' || cp == '_' || cp == '-';
            sb.append(keep ? (char) cp : '_');
        });
        return sb.toString();
    }

    // continue in the newest existing part; open the next one once it is full
    private Path rotate(Path path, long incoming) throws IOException {
        if (maxBytes <= 0) return path;
        int last = 0;
        while (last + 1 < MAX_PARTS && Files.exists(part(path, last + 1))) {
            last++;
        }
        var current = part(path, last);
        if (fits(current, incoming)) return current;
        if (last + 1 >= MAX_PARTS) {
            log.warn("sink_rotation_exhausted file={} parts={}", path, MAX_PARTS);
            return current;
        }
        return part(path, last + 1);
    }

    private static Path part(Path path, int n) {
        return n == 0 ? path : path.resolveSibling(path.getFileName() + ".part" + n);
    }

    private boolean fits(Path file, long incoming) throws IOException {
        if (!Files.exists(file)) return true;
        long size = Files.size(file);
        return size == 0 || size + incoming <= maxBytes;
    }

    private static String localHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            return "localhost";
        }
    }
}
