package com.chatbridge.profiles;

import com.chatbridge.forward.FolderSink;
import com.chatbridge.protocol.ChatIds;
import com.chatbridge.shared.Json;
import com.chatbridge.shared.model.Direction;
import com.chatbridge.shared.model.Envelope;
import com.chatbridge.shared.model.MediaTicket;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One {@link Profile} per canonical chat id. A chat not in memory is rehydrated from
 * {@code <dir>/<sanitized-id>.json} when that file exists. Every mutation is followed by a
 * full snapshot written to a temporary file and renamed into place; the write happens after the
 * chat's lock is released.
 */
public class ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(ProfileStore.class);

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        final ReentrantLock persistLock = new ReentrantLock();
        final Profile profile;
        long version;
        long persisted;

        Entry(Profile profile) {
            this.profile = profile;
        }
    }

    private final Path dir;
    private final Path outbox;
    private final int mediaCap;
    private final ZoneId zone;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public ProfileStore(Path dir, Path outbox, int mediaCap, ZoneId zone) {
        this(dir, outbox, mediaCap, zone, Clock.system(zone));
    }

    public ProfileStore(Path dir, Path outbox, int mediaCap, ZoneId zone, Clock clock) {
        this.dir = dir;
        this.outbox = outbox;
        this.mediaCap = mediaCap;
        this.zone = zone;
        this.clock = clock;
        this.mapper = Json.newMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Records an inbound message: connection time, last chat and text, counters, day streak and
     * the NDJSON paths of the conversation. Keyed by chat id, or the sender when there is none.
     */
    public Profile touchInbound(Envelope e) {
        var key = keyOf(e);
        if (key.isEmpty()) return null;
        var chat = e.chatId() == null ? "" : e.chatId();
        return mutate(key, p -> {
            var now = Instant.now(clock);
            p.touch(now, chat, e.text());
            if (e.chatName() != null && !e.chatName().isBlank()) p.name(e.chatName());
            p.metrics().recordInbound(e.messageId(), now);
            updateStreak(p.metrics(), LocalDate.now(clock.withZone(zone)));
            if (!chat.isEmpty() && !ChatIds.isGroup(chat)) {
                p.tags().put("out.contacts_ndjson", ndjsonPath(FolderSink.CONTACTS, chat));
            }
            if (ChatIds.isGroup(chat)) {
                p.tags().put("out.group." + chat, ndjsonPath(FolderSink.GROUPS, chat));
            }
        });
    }

    public Profile recordOutbound(String chatId) {
        if (chatId == null || chatId.isBlank()) return null;
        return mutate(chatId.trim(), p -> p.metrics().recordOutbound(Instant.now(clock)));
    }

    /** Adds the envelope's media to the chat's history for its direction, keeping the newest {@code mediaCap}. */
    public Profile appendMedia(String chatId, Envelope e) {
        if (chatId == null || chatId.isBlank()) return null;
        var media = e.media();
        if (media == null || !media.hasType()) return null;
        var direction = e.direction() == Direction.OUT ? Direction.OUT : Direction.IN;
        var at = e.at() != null && !e.at().isBlank() ? e.at() : Instant.now(clock).toString();
        var caption = e.text() == null ? null : e.text().trim();
        var entry = normalizeType(media).forHistory(direction, chatId, e.senderId(), e.messageId(), caption, at);
        return mutate(chatId.trim(), p -> {
            var list = direction == Direction.OUT ? p.media().out() : p.media().in();
            list.add(entry);
            trim(list, mediaCap);
        });
    }

    public Optional<Profile> get(String chatId) {
        var entry = entries.get(chatId);
        if (entry == null) return Optional.empty();
        entry.lock.lock();
        try {
            return Optional.of(copy(entry.profile));
        } finally {
            entry.lock.unlock();
        }
    }

    /** Copies of all profiles currently in memory, ordered by chat id. */
    public Map<String, Profile> snapshot() {
        var out = new TreeMap<String, Profile>();
        entries.forEach((k, entry) -> {
            entry.lock.lock();
            try {
                out.put(k, copy(entry.profile));
            } finally {
                entry.lock.unlock();
            }
        });
        return out;
    }

    public Path pathFor(String chatId) {
        return dir.resolve(FolderSink.sanitize(chatId.trim()) + ".json");
    }

    static void updateStreak(Profile.Metrics m, LocalDate today) {
        var day = today.toString();
        if (day.equals(m.streakLastDay())) return;
        if (today.minusDays(1).toString().equals(m.streakLastDay())) {
            m.streak(m.streakDays() + 1, day);
        } else {
            m.streak(1, day);
        }
    }

    private Profile mutate(String key, Consumer<Profile> change) {
        var entry = entryFor(key);
        Profile snapshot;
        long version;
        entry.lock.lock();
        try {
            change.accept(entry.profile);
            version = ++entry.version;
            snapshot = copy(entry.profile);
        } finally {
            entry.lock.unlock();
        }
        persist(key, entry, snapshot, version);
        return snapshot;
    }

    private Entry entryFor(String key) {
        var existing = entries.get(key);
        if (existing != null) return existing;
        var loaded = load(key).orElseGet(() -> Profile.fresh(key, Instant.now(clock)));
        var prior = entries.putIfAbsent(key, new Entry(loaded));
        return prior != null ? prior : entries.get(key);
    }

    private Optional<Profile> load(String key) {
        var path = pathFor(key);
        if (!Files.exists(path)) return Optional.empty();
        try {
            var p = mapper.readValue(path.toFile(), Profile.class);
            log.debug("profile_rehydrated chat={}", key);
            return Optional.of(p);
        } catch (IOException e) {
            log.warn("profile_load_failed chat={} file={}: {}", key, path, e.getMessage());
            return Optional.empty();
        }
    }

    private void persist(String key, Entry entry, Profile snapshot, long version) {
        entry.persistLock.lock();
        try {
            if (version <= entry.persisted) return;
            Files.createDirectories(dir);
            var path = pathFor(key);
            var tmp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            entry.persisted = version;
        } catch (IOException e) {
            log.warn("profile_persist_failed chat={}: {}", key, e.getMessage());
        } finally {
            entry.persistLock.unlock();
        }
    }

    private Profile copy(Profile p) {
        return mapper.convertValue(p, Profile.class);
    }

    private String ndjsonPath(String category, String chat) {
        return outbox.resolve(category).resolve(FolderSink.sanitize(chat) + ".ndjson").toString();
    }

    private static String keyOf(Envelope e) {
        if (e.chatId() != null && !e.chatId().isBlank()) return e.chatId().trim();
        return e.senderId() == null ? "" : e.senderId().trim();
    }

    private static MediaTicket normalizeType(MediaTicket m) {
        var type = m.type().trim().toLowerCase(Locale.ROOT);
        if (type.equals(m.type())) return m;
        return new MediaTicket(m.direction(), m.chatId(), m.senderId(), m.messageId(), type, m.mimetype(),
                m.title(), m.url(), m.caption(), m.at(), m.directPath(), m.mediaKey(), m.fileHash(),
                m.encryptedFileHash(), m.fileLength(), m.seconds());
    }

    private static <T> void trim(List<T> list, int cap) {
        if (cap <= 0) return;
        while (list.size() > cap) list.remove(0);
    }
}
