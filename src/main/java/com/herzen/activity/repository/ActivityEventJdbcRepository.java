package com.herzen.activity.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.activity.classification.DerivedStatus;
import com.herzen.activity.exception.InvalidBatchException;
import com.herzen.activity.telemetry.ActivityModels.ClassifiedEvent;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Append-only store for classified learner events. Rows are never updated or deleted.
 */
@Repository
public class ActivityEventJdbcRepository {
    private static final String COLUMNS =
            "event_id, user_id, course_id, module_no, topic_id, event_type, payload, derived_status, status_reason, occurred_at, created_at, client_event_id";

    private static final String INSERT =
            "INSERT INTO learner_activity_events(user_id, course_id, module_no, topic_id, event_type, payload, derived_status, status_reason, occurred_at, created_at, client_event_id) " +
                    "VALUES (?,?,?,?,?,?,?,?,?,?,?)";

    private static final String RECENT_PER_LEARNER =
            "SELECT " + COLUMNS + " FROM (" +
                    "SELECT " + COLUMNS + ", ROW_NUMBER() OVER (PARTITION BY user_id ORDER BY occurred_at DESC, event_id DESC) AS rn " +
                    "FROM learner_activity_events WHERE course_id = :courseId%s" +
                    ") ranked WHERE rn <= :windowSize ORDER BY user_id, occurred_at DESC, event_id DESC";

    private static final int KEYED_INSERT_ATTEMPTS = 20;
    private static final long KEYED_INSERT_BACKOFF_MS = 5;

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ActivityEventJdbcRepository(JdbcTemplate jdbcTemplate,
                                       NamedParameterJdbcTemplate namedJdbcTemplate,
                                       ObjectMapper objectMapper,
                                       Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = namedJdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Inserts the rows that are not already stored under the same (userId, clientEventId).
     * Rows without a client id are written as one batch. When a batch carries client ids, rows are
     * written one by one in input order, and a row losing a race on the unique index to a concurrent
     * batch is skipped rather than failing the others.
     *
     * @return number of rows written
     */
    public int append(List<NewEventRow> rows) {
        if (rows == null || rows.isEmpty()) return 0;
        List<NewEventRow> fresh = withoutKnownClientIds(rows);
        if (fresh.isEmpty()) return 0;

        OffsetDateTime createdAt = toDb(clock.instant());
        if (fresh.stream().allMatch(r -> r.clientEventId() == null)) {
            jdbcTemplate.batchUpdate(INSERT, fresh, fresh.size(), (ps, row) -> bind(ps, row, createdAt));
            return fresh.size();
        }

        int written = 0;
        for (NewEventRow row : fresh) {
            if (row.clientEventId() == null) {
                jdbcTemplate.update(INSERT, ps -> bind(ps, row, createdAt));
                written++;
            } else if (insertKeyed(row, createdAt)) {
                written++;
            }
        }
        return written;
    }

    public List<ClassifiedEvent> queryHistory(String userId, String courseId, int limit, Instant before) {
        return queryHistory(userId, courseId, limit, before, null);
    }

    /**
     * Newest first. The cursor is exclusive: with {@code beforeEventId} set, rows at exactly {@code before}
     * are kept when their id is lower, so a page boundary inside a run of equal timestamps loses nothing.
     */
    public List<ClassifiedEvent> queryHistory(String userId, String courseId, int limit, Instant before, Long beforeEventId) {
        if (before == null) {
            return jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM learner_activity_events WHERE user_id = ? AND course_id = ? " +
                            "ORDER BY occurred_at DESC, event_id DESC LIMIT ?",
                    this::mapEvent,
                    userId, courseId, limit);
        }
        if (beforeEventId == null) {
            return jdbcTemplate.query(
                    "SELECT " + COLUMNS + " FROM learner_activity_events WHERE user_id = ? AND course_id = ? AND occurred_at < ? " +
                            "ORDER BY occurred_at DESC, event_id DESC LIMIT ?",
                    this::mapEvent,
                    userId, courseId, toDb(before), limit);
        }
        OffsetDateTime cursor = toDb(before);
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM learner_activity_events WHERE user_id = ? AND course_id = ? " +
                        "AND (occurred_at < ? OR (occurred_at = ? AND event_id < ?)) " +
                        "ORDER BY occurred_at DESC, event_id DESC LIMIT ?",
                this::mapEvent,
                userId, courseId, cursor, cursor, beforeEventId, limit);
    }

    public Map<String, List<ClassifiedEvent>> queryRecentPerLearner(String courseId, int windowSize) {
        return queryRecentPerLearner(courseId, windowSize, null);
    }

    /**
     * Top {@code windowSize} events per learner in one windowed query, newest first within each learner.
     *
     * @param learnerIds restricts the learners considered; {@code null} means every learner in the course
     */
    public Map<String, List<ClassifiedEvent>> queryRecentPerLearner(String courseId, int windowSize, Set<String> learnerIds) {
        if (learnerIds != null && learnerIds.isEmpty()) return Map.of();

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("courseId", courseId)
                .addValue("windowSize", windowSize);
        String filter = "";
        if (learnerIds != null) {
            filter = " AND user_id IN (:learnerIds)";
            params.addValue("learnerIds", learnerIds);
        }

        List<ClassifiedEvent> rows = namedJdbcTemplate.query(String.format(RECENT_PER_LEARNER, filter), params, this::mapEvent);
        return rows.stream().collect(Collectors.groupingBy(ClassifiedEvent::userId, LinkedHashMap::new, Collectors.toList()));
    }

    private List<NewEventRow> withoutKnownClientIds(List<NewEventRow> rows) {
        Map<String, Set<String>> known = new HashMap<>();
        rows.stream()
                .filter(r -> r.clientEventId() != null)
                .collect(Collectors.groupingBy(NewEventRow::userId, Collectors.mapping(NewEventRow::clientEventId, Collectors.toSet())))
                .forEach((userId, ids) -> known.put(userId, new HashSet<>(loadClientIds(userId, ids))));

        List<NewEventRow> fresh = new ArrayList<>(rows.size());
        for (NewEventRow row : rows) {
            if (row.clientEventId() == null || known.get(row.userId()).add(row.clientEventId())) {
                fresh.add(row);
            }
        }
        return fresh;
    }

    private List<String> loadClientIds(String userId, Set<String> clientEventIds) {
        return namedJdbcTemplate.queryForList(
                "SELECT client_event_id FROM learner_activity_events WHERE user_id = :userId AND client_event_id IN (:ids)",
                new MapSqlParameterSource().addValue("userId", userId).addValue("ids", clientEventIds),
                String.class);
    }

    // false when another batch already holds this (userId, clientEventId)
    private boolean insertKeyed(NewEventRow row, OffsetDateTime createdAt) {
        for (int attempt = 1; ; attempt++) {
            try {
                jdbcTemplate.update(INSERT, ps -> bind(ps, row, createdAt));
                return true;
            } catch (DuplicateKeyException e) {
                return false;
            } catch (ConcurrencyFailureException e) {
                // the same key is held by a transaction that has not committed yet
                if (attempt >= KEYED_INSERT_ATTEMPTS) throw e;
                pause(attempt);
            }
        }
    }

    private void pause(int attempt) {
        try {
            Thread.sleep(KEYED_INSERT_BACKOFF_MS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CannotAcquireLockException("Interrupted while waiting for a concurrent activity batch", e);
        }
    }

    private void bind(PreparedStatement ps, NewEventRow row, OffsetDateTime createdAt) throws SQLException {
        ps.setString(1, row.userId());
        ps.setString(2, row.courseId());
        ps.setObject(3, row.moduleNo(), Types.INTEGER);
        ps.setString(4, row.topicId());
        ps.setString(5, row.eventType());
        ps.setString(6, writePayload(row.payload()));
        ps.setString(7, row.derivedStatus() == null ? null : row.derivedStatus().wireName());
        ps.setString(8, row.statusReason());
        ps.setObject(9, toDb(row.occurredAt()));
        ps.setObject(10, createdAt);
        ps.setString(11, row.clientEventId());
    }

    private ClassifiedEvent mapEvent(ResultSet rs, int n) throws SQLException {
        return new ClassifiedEvent(
                rs.getLong("event_id"),
                rs.getString("user_id"),
                rs.getString("course_id"),
                (Integer) rs.getObject("module_no"),
                rs.getString("topic_id"),
                rs.getString("event_type"),
                readPayload(rs.getString("payload")),
                DerivedStatus.fromWire(rs.getString("derived_status")),
                rs.getString("status_reason"),
                rs.getObject("occurred_at", OffsetDateTime.class).toInstant(),
                rs.getObject("created_at", OffsetDateTime.class).toInstant(),
                rs.getString("client_event_id"));
    }

    private String writePayload(Map<String, Object> payload) {
        if (payload == null) return null;
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidBatchException("Event payload is not serializable as JSON", e);
        }
    }

    private Map<String, Object> readPayload(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Stored payload is not valid JSON", e);
        }
    }

    private static OffsetDateTime toDb(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC);
    }

    public record NewEventRow(String userId,
                              String courseId,
                              Integer moduleNo,
                              String topicId,
                              String eventType,
                              Map<String, Object> payload,
                              DerivedStatus derivedStatus,
                              String statusReason,
                              Instant occurredAt,
                              String clientEventId) {}
}
