package com.herzen.activity.telemetry;

import com.herzen.activity.aggregation.StatusAggregator;
import com.herzen.activity.config.ActivityProperties;
import com.herzen.activity.repository.ActivityEventJdbcRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read side for dashboards and assistant context builders. Nothing here is cached;
 * every call recomputes from the store.
 */
@Service
public class ActivityQueryService {
    private static final String NO_DETAIL = "No detail";

    private final ActivityEventJdbcRepository repository;
    private final StatusAggregator aggregator;
    private final ActivityProperties properties;

    public ActivityQueryService(ActivityEventJdbcRepository repository,
                                StatusAggregator aggregator,
                                ActivityProperties properties) {
        this.repository = repository;
        this.aggregator = aggregator;
        this.properties = properties;
    }

    public ActivityModels.CourseStatusResponse getCourseLearnerStatuses(String courseId) {
        return getCourseLearnerStatuses(courseId, null);
    }

    /**
     * @param learnerIds learners resolved upstream (e.g. a cohort); {@code null} for the whole course
     */
    public ActivityModels.CourseStatusResponse getCourseLearnerStatuses(String courseId, Set<String> learnerIds) {
        Map<String, List<ActivityModels.ClassifiedEvent>> windows =
                repository.queryRecentPerLearner(courseId, properties.windowSize(), learnerIds);

        List<ActivityModels.AggregatedStatus> statuses = windows.values().stream()
                .map(aggregator::aggregate)
                .flatMap(Optional::stream)
                .sorted(StatusAggregator.BY_SEVERITY)
                .toList();
        return new ActivityModels.CourseStatusResponse(statuses, aggregator.summarize(statuses));
    }

    public ActivityModels.HistoryResponse getLearnerHistory(String userId, String courseId, Integer limit, Instant before) {
        return getLearnerHistory(userId, courseId, limit, before, null);
    }

    /**
     * @param before        exclusive cursor, usually the {@code occurredAt} of the last event on the previous page
     * @param beforeEventId that event's id; ignored without {@code before}
     */
    public ActivityModels.HistoryResponse getLearnerHistory(String userId, String courseId, Integer limit,
                                                            Instant before, Long beforeEventId) {
        return new ActivityModels.HistoryResponse(
                repository.queryHistory(userId, courseId, clampLimit(limit), before, beforeEventId));
    }

    public ActivityModels.SignalsResponse getRecentSignals(String courseId, Integer perLearner) {
        int n = perLearner == null ? properties.signalsPerLearner() : Math.max(1, Math.min(perLearner, properties.windowSize()));
        List<ActivityModels.LearnerSignals> learners = repository.queryRecentPerLearner(courseId, n).entrySet().stream()
                .map(e -> new ActivityModels.LearnerSignals(e.getKey(), e.getValue().stream()
                        .map(ev -> new ActivityModels.Signal(ev.eventType(), ev.derivedStatus(),
                                ev.statusReason() == null ? NO_DETAIL : ev.statusReason(), ev.occurredAt()))
                        .toList()))
                .toList();
        return new ActivityModels.SignalsResponse(courseId, learners);
    }

    private int clampLimit(Integer limit) {
        ActivityProperties.History history = properties.history();
        if (limit == null) return Math.min(history.defaultLimit(), history.maxLimit());
        return Math.max(1, Math.min(limit, history.maxLimit()));
    }
}
