package com.chatbridge.history;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class JdbcMessageHistoryStore implements MessageHistoryStore {

    private static final String CREATE_CHATS = """
            CREATE TABLE IF NOT EXISTS chats (
                chat_id TEXT PRIMARY KEY,
                name TEXT,
                last_message_time TIMESTAMPTZ
            )""";
    private static final String CREATE_MESSAGES = """
            CREATE TABLE IF NOT EXISTS messages (
                id TEXT NOT NULL,
                chat_id TEXT NOT NULL REFERENCES chats(chat_id),
                sender TEXT,
                content TEXT,
                timestamp TIMESTAMPTZ,
                is_from_me BOOLEAN,
                media_type TEXT,
                filename TEXT,
                url TEXT,
                PRIMARY KEY (id, chat_id)
            )""";

    private final DataSource dataSource;

    public JdbcMessageHistoryStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /** Creates the tables if missing; a failure here means the store cannot be used at all. */
    public void initSchema() {
        try (var conn = dataSource.getConnection();
             var stmt = conn.createStatement()) {
            stmt.execute(CREATE_CHATS);
            stmt.execute(CREATE_MESSAGES);
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to initialise message history schema", e);
        }
    }

    @Override
    public void append(HistoryRecord record) {
        try (var conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                upsertChat(conn, record);
                upsertMessage(conn, record);
                conn.commit();
            } catch (Exception e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to save message: " + record.id(), e);
        }
    }

    @Override
    public List<HistoryRecord> recent(String chatId, int limit) {
        var sql = "SELECT id, sender, content, timestamp, is_from_me, media_type, filename, url "
                + "FROM messages WHERE chat_id = ? ORDER BY timestamp DESC LIMIT ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, chatId);
            ps.setInt(2, limit);
            var out = new ArrayList<HistoryRecord>();
            try (var rs = ps.executeQuery()) {
                while (rs.next()) {
                    var ts = rs.getTimestamp("timestamp");
                    out.add(new HistoryRecord(
                            rs.getString("id"),
                            chatId,
                            rs.getString("sender"),
                            rs.getString("content"),
                            ts == null ? null : ts.toInstant(),
                            rs.getBoolean("is_from_me"),
                            rs.getString("media_type"),
                            rs.getString("filename"),
                            rs.getString("url")));
                }
            }
            Collections.reverse(out);
            return out;
        } catch (SQLException e) {
            throw new HistoryStoreException("Failed to load messages: " + chatId, e);
        }
    }

    private void upsertChat(Connection conn, HistoryRecord record) throws SQLException {
        var sql = "INSERT INTO chats (chat_id, last_message_time) VALUES (?, ?) "
                + "ON CONFLICT (chat_id) DO UPDATE SET last_message_time = "
                + "GREATEST(chats.last_message_time, EXCLUDED.last_message_time)";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.chatId());
            ps.setTimestamp(2, timestamp(record));
            ps.executeUpdate();
        }
    }

    private void upsertMessage(Connection conn, HistoryRecord record) throws SQLException {
        var sql = "INSERT INTO messages (id, chat_id, sender, content, timestamp, is_from_me, media_type, filename, url) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT (id, chat_id) DO UPDATE SET sender = EXCLUDED.sender, content = EXCLUDED.content, "
                + "timestamp = EXCLUDED.timestamp, is_from_me = EXCLUDED.is_from_me, media_type = EXCLUDED.media_type, "
                + "filename = EXCLUDED.filename, url = EXCLUDED.url";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.id());
            ps.setString(2, record.chatId());
            ps.setString(3, record.sender());
            ps.setString(4, record.content());
            ps.setTimestamp(5, timestamp(record));
            ps.setBoolean(6, record.fromMe());
            ps.setString(7, record.mediaType());
            ps.setString(8, record.filename());
            ps.setString(9, record.url());
            ps.executeUpdate();
        }
    }

    private static Timestamp timestamp(HistoryRecord record) {
        return record.timestamp() == null ? null : Timestamp.from(record.timestamp());
    }
}
