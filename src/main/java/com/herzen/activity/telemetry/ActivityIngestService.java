package com.herzen.activity.telemetry;

import com.herzen.activity.classification.EventClassifier;
import com.herzen.activity.config.ActivityProperties;
import com.herzen.activity.exception.InvalidBatchException;
import com.herzen.activity.exception.UnauthenticatedException;
import com.herzen.activity.repository.ActivityEventJdbcRepository;
import com.herzen.activity.repository.ActivityEventJdbcRepository.NewEventRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
public class ActivityIngestService {
    private static final int MAX_CLIENT_EVENT_ID = 128;

    private final EventClassifier classifier;
    private final ActivityEventJdbcRepository repository;
    private final ActivityProperties properties;
    private final Clock clock;

    public ActivityIngestService(EventClassifier classifier,
                                 ActivityEventJdbcRepository repository,
                                 ActivityProperties properties,
                                 Clock clock) {
        this.classifier = classifier;
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Classifies and stores a batch on behalf of {@code userId}. The batch is written as a whole or not at all;
     * storage errors propagate to the caller.
     */
    @Transactional
    public ActivityModels.IngestAck ingest(String userId, ActivityModels.IngestRequest request) {
        if (userId == null || userId.isBlank()) {
            throw new UnauthenticatedException("Learner identity is required to record activity");
        }
        if (request == null || request.events() == null || request.events().isEmpty()) {
            return new ActivityModels.IngestAck(0, 0);
        }
        List<ActivityModels.TelemetryEvent> events = request.events();
        validate(events);

        Instant receivedAt = clock.instant();
        List<NewEventRow> rows = events.stream()
                .map(e -> toRow(userId, e, receivedAt))
                .toList();

        int written = repository.append(rows);
        log.debug("Stored {} of {} activity events for user {}", written, rows.size(), userId);
        return new ActivityModels.IngestAck(written, rows.size() - written);
    }

    private void validate(List<ActivityModels.TelemetryEvent> events) {
        int max = properties.ingest().maxBatchSize();
        if (events.size() > max) {
            throw new InvalidBatchException("Batch holds " + events.size() + " events, at most " + max + " are accepted");
        }
        for (int i = 0; i < events.size(); i++) {
            ActivityModels.TelemetryEvent e = events.get(i);
            if (e == null) throw new InvalidBatchException("events[" + i + "] is null");
            if (e.courseId() == null || e.courseId().isBlank()) {
                throw new InvalidBatchException("events[" + i + "].courseId is required");
            }
            if (e.eventType() == null || e.eventType().isBlank()) {
                throw new InvalidBatchException("events[" + i + "].eventType is required");
            }
            if (e.clientEventId() != null && e.clientEventId().length() > MAX_CLIENT_EVENT_ID) {
                throw new InvalidBatchException("events[" + i + "].clientEventId exceeds " + MAX_CLIENT_EVENT_ID + " characters");
            }
        }
    }

    private NewEventRow toRow(String userId, ActivityModels.TelemetryEvent e, Instant receivedAt) {
        EventClassifier.Classification classification = classifier.classify(e.eventType(), e.payload());
        return new NewEventRow(
                userId,
                e.courseId(),
                e.moduleNo(),
                e.topicId(),
                e.eventType(),
                e.payload(),
                classification.derivedStatus(),
                classification.statusReason(),
                e.occurredAt() == null ? receivedAt : e.occurredAt(),
                blankToNull(e.clientEventId()));
    }

    private String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }
}
