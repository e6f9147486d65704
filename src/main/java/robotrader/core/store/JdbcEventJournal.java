package robotrader.core.store;

import robotrader.core.error.StoreException;
import robotrader.core.events.DeadLetter;
import robotrader.core.events.Event;
import robotrader.core.events.EventJournal;
import robotrader.core.events.EventType;
import robotrader.core.util.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static robotrader.core.store.JdbcSupport.setTimestamp;
import static robotrader.core.store.JdbcSupport.toInstant;
import static robotrader.core.store.JdbcSupport.truncate;

/**
 * Event journal backed by the {@code events} and {@code dead_letter_events} tables.
 */
public class JdbcEventJournal implements EventJournal {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventJournal.class);

    private final ConnectionSource db;
    private final Clock clock;

    public JdbcEventJournal(ConnectionSource db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public void append(Event event) {
        String sql = """
                    INSERT INTO events (id, event_type, source, data, status, created_at)
                    VALUES (?, ?, ?, ?, 'PENDING', ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, event.id());
            ps.setString(2, event.type().wireName());
            ps.setString(3, event.source());
            ps.setString(4, JsonCodec.toJson(event.data()));
            setTimestamp(ps, 5, event.timestamp());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to journal event: " + event.id(), e);
        }
    }

    @Override
    public void markProcessed(String eventId) {
        String sql = "UPDATE events SET status = 'PROCESSED', processed_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, clock.instant());
            ps.setString(2, eventId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new StoreException("Failed to mark event processed: " + eventId, e);
        }
    }

    @Override
    public void deadLetter(Event event, String handler, Throwable error) {
        String sql = """
                    INSERT INTO dead_letter_events (id, event_id, event_type, handler, error, failed_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, UUID.randomUUID().toString());
            ps.setString(2, event.id());
            ps.setString(3, event.type().wireName());
            ps.setString(4, handler);
            ps.setString(5, truncate(String.valueOf(error)));
            setTimestamp(ps, 6, clock.instant());

            ps.executeUpdate();
            conn.commit();

            log.debug("Dead-lettered event {} for handler {}", event.id(), handler);
        } catch (SQLException e) {
            throw new StoreException("Failed to dead-letter event: " + event.id(), e);
        }
    }

    @Override
    public List<Event> findBetween(Instant from, Instant to) {
        String sql = """
                    SELECT * FROM events
                    WHERE created_at >= ? AND created_at < ?
                    ORDER BY created_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, from);
            setTimestamp(ps, 2, to);
            return readEvents(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to read events between " + from + " and " + to, e);
        }
    }

    @Override
    public List<Event> findPending(int limit) {
        String sql = "SELECT * FROM events WHERE status = 'PENDING' ORDER BY created_at LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return readEvents(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to read pending events", e);
        }
    }

    @Override
    public List<DeadLetter> findDeadLetters(int limit) {
        String sql = "SELECT * FROM dead_letter_events ORDER BY failed_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            List<DeadLetter> letters = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    letters.add(new DeadLetter(
                            rs.getString("event_id"),
                            EventType.fromWireName(rs.getString("event_type")),
                            rs.getString("handler"),
                            rs.getString("error"),
                            toInstant(rs, "failed_at")));
                }
            }
            return letters;
        } catch (SQLException e) {
            throw new StoreException("Failed to read dead letters", e);
        }
    }

    @Override
    public int countDeadLetters() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM dead_letter_events");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count dead letters", e);
        }
    }

    private static List<Event> readEvents(PreparedStatement ps) throws SQLException {
        List<Event> events = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                events.add(new Event(
                        rs.getString("id"),
                        EventType.fromWireName(rs.getString("event_type")),
                        rs.getString("source"),
                        toInstant(rs, "created_at"),
                        JsonCodec.parseObject(rs.getString("data"))));
            }
        }
        return events;
    }
}
