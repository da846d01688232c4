package io.github.drompincen.clawwatch.runtime.listener.watcher;

import io.github.drompincen.clawwatch.protocol.event.EventSource;
import io.github.drompincen.clawwatch.protocol.event.ListenerEvent;
import io.github.drompincen.clawwatch.protocol.event.ListenerEventType;
import io.github.drompincen.clawwatch.runtime.listener.WatermarkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads incoming messages from the Messages SQLite store ({@code chat.db}), opened read-only.
 * Rows are selected by {@code ROWID} above the {@code last_row_id} watermark.
 */
public class MessageWatcher implements Watcher {

    private static final Logger log = LoggerFactory.getLogger(MessageWatcher.class);

    public static final String NAME = "messages";
    static final int BATCH_LIMIT = 50;
    static final int SUBJECT_CHARS = 100;
    private static final int BUSY_TIMEOUT_MS = 5000;

    /** Seconds between the Unix epoch and 2001-01-01T00:00:00Z. */
    static final long APPLE_EPOCH_OFFSET = 978_307_200L;
    private static final long NANOSECOND_THRESHOLD = 1_000_000_000_000L;

    private static final String SQL = """
            SELECT m.ROWID, m.text, m.date AS message_date, m.is_from_me,
                   h.id AS handle_id, h.service
            FROM message m
            LEFT JOIN handle h ON m.handle_id = h.ROWID
            WHERE m.ROWID > ?
              AND m.is_from_me = 0
              AND m.text IS NOT NULL
              AND m.text != ''
            ORDER BY m.ROWID ASC
            LIMIT ?
            """;

    private final Path dbPath;

    public MessageWatcher(Path dbPath) {
        this.dbPath = dbPath;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return Files.isRegularFile(dbPath) && Files.isReadable(dbPath);
    }

    @Override
    public List<ListenerEvent> poll(WatermarkStore store) {
        if (!isAvailable()) {
            log.debug("Message store {} is not readable", dbPath);
            return List.of();
        }
        long lastRowId = store.getLong(NAME, "last_row_id", 0L);

        List<ListenerEvent> events = new ArrayList<>();
        long maxRowId = lastRowId;
        try (Connection connection = open();
             PreparedStatement stmt = connection.prepareStatement(SQL)) {
            stmt.setLong(1, lastRowId);
            stmt.setInt(2, BATCH_LIMIT);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    long rowId = rs.getLong("ROWID");
                    String text = rs.getString("text");
                    String handle = rs.getString("handle_id");
                    String service = rs.getString("service");
                    String sender = handle != null ? handle : "Unknown";

                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("service", service != null ? service : "iMessage");
                    metadata.put("handle_id", sender);

                    events.add(new ListenerEvent(
                            EventSource.MESSAGES,
                            ListenerEventType.NEW_MESSAGE,
                            text.length() > SUBJECT_CHARS ? text.substring(0, SUBJECT_CHARS) : text,
                            sender,
                            text,
                            toInstant(rs.getLong("message_date")),
                            String.valueOf(rowId),
                            metadata));
                    maxRowId = Math.max(maxRowId, rowId);
                }
            }
        } catch (SQLException e) {
            log.warn("Message store query failed: {}", e.getMessage());
            return List.of();
        }

        if (!events.isEmpty()) {
            store.set(NAME, "last_row_id", maxRowId);
            store.save();
            log.info("Messages: {} new message(s), watermark now {}", events.size(), maxRowId);
        }
        return events;
    }

    /**
     * Converts a message-store timestamp to an instant. Newer stores count nanoseconds, older
     * ones seconds, both since 2001-01-01.
     */
    static Instant toInstant(long appleTime) {
        long seconds = appleTime > NANOSECOND_THRESHOLD ? appleTime / 1_000_000_000L : appleTime;
        return Instant.ofEpochSecond(APPLE_EPOCH_OFFSET + seconds);
    }

    private Connection open() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath(), config.toProperties());
    }
}
