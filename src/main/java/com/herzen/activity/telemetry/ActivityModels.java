package com.herzen.activity.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.herzen.activity.classification.DerivedStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

public class ActivityModels {
    public record TelemetryEvent(@NotBlank String courseId,
                                 Integer moduleNo,
                                 String topicId,
                                 @NotBlank String eventType,
                                 Map<String, Object> payload,
                                 Instant occurredAt,
                                 @Size(max = 128) String clientEventId) {

        public TelemetryEvent withOccurredAt(Instant ts) {
            return new TelemetryEvent(courseId, moduleNo, topicId, eventType, payload, ts, clientEventId);
        }
    }

    public record IngestRequest(@NotNull @Valid List<TelemetryEvent> events) {}

    public record IngestAck(int accepted, int duplicates) {}

    public record ClassifiedEvent(long eventId,
                                  String userId,
                                  String courseId,
                                  Integer moduleNo,
                                  String topicId,
                                  String eventType,
                                  Map<String, Object> payload,
                                  DerivedStatus derivedStatus,
                                  String statusReason,
                                  Instant occurredAt,
                                  Instant createdAt,
                                  String clientEventId) {

        // occurredAt can collide, eventId is assigned in write order
        public static final Comparator<ClassifiedEvent> NEWEST_FIRST = Comparator
                .comparing(ClassifiedEvent::occurredAt, Comparator.reverseOrder())
                .thenComparing(ClassifiedEvent::eventId, Comparator.reverseOrder());
    }

    /**
     * One learner's representative status. {@code derivedStatus == null} means unknown.
     */
    public record AggregatedStatus(String userId,
                                   String courseId,
                                   long eventId,
                                   Integer moduleNo,
                                   String topicId,
                                   String eventType,
                                   DerivedStatus derivedStatus,
                                   String statusReason,
                                   Instant occurredAt,
                                   Instant createdAt) {

        public static AggregatedStatus of(ClassifiedEvent event, DerivedStatus status) {
            return new AggregatedStatus(event.userId(), event.courseId(), event.eventId(), event.moduleNo(),
                    event.topicId(), event.eventType(), status, event.statusReason(), event.occurredAt(), event.createdAt());
        }
    }

    public record StatusSummary(long engaged,
                                @JsonProperty("attention_drift") long attentionDrift,
                                @JsonProperty("content_friction") long contentFriction,
                                long unknown) {
        public static final StatusSummary EMPTY = new StatusSummary(0, 0, 0, 0);
    }

    public record CourseStatusResponse(List<AggregatedStatus> learners, StatusSummary summary) {}

    public record HistoryResponse(List<ClassifiedEvent> events) {}

    public record Signal(String eventType, DerivedStatus derivedStatus, String reason, Instant occurredAt) {}

    public record LearnerSignals(String userId, List<Signal> signals) {}

    public record SignalsResponse(String courseId, List<LearnerSignals> learners) {}
}
