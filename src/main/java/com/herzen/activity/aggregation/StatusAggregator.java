package com.herzen.activity.aggregation;

import com.herzen.activity.classification.DerivedStatus;
import com.herzen.activity.telemetry.ActivityModels.AggregatedStatus;
import com.herzen.activity.telemetry.ActivityModels.ClassifiedEvent;
import com.herzen.activity.telemetry.ActivityModels.StatusSummary;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Collapses a learner's recent events into one representative status.
 * <p>
 * The highest-priority status present in the window wins, and within that status the most
 * recent event is the representative. Recency across statuses is ignored: an old friction
 * event outranks a fresh engaged one. Statuses are never blended or counted.
 */
@Component
public class StatusAggregator {
    public static final List<DerivedStatus> PRIORITY = List.of(
            DerivedStatus.CONTENT_FRICTION,
            DerivedStatus.ATTENTION_DRIFT,
            DerivedStatus.ENGAGED
    );

    /** Most severe first, then most recent; unknown statuses last. */
    public static final Comparator<AggregatedStatus> BY_SEVERITY = Comparator
            .comparingInt((AggregatedStatus s) -> rank(s.derivedStatus()))
            .thenComparing(AggregatedStatus::occurredAt, Comparator.reverseOrder())
            .thenComparing(AggregatedStatus::userId);

    public Optional<AggregatedStatus> aggregate(List<ClassifiedEvent> window) {
        if (window == null || window.isEmpty()) return Optional.empty();
        List<ClassifiedEvent> newestFirst = window.stream().sorted(ClassifiedEvent.NEWEST_FIRST).toList();

        for (DerivedStatus status : PRIORITY) {
            Optional<ClassifiedEvent> representative = newestFirst.stream()
                    .filter(e -> e.derivedStatus() == status)
                    .findFirst();
            if (representative.isPresent()) {
                return Optional.of(AggregatedStatus.of(representative.get(), status));
            }
        }
        return Optional.of(AggregatedStatus.of(newestFirst.get(0), null));
    }

    public StatusSummary summarize(Collection<AggregatedStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) return StatusSummary.EMPTY;
        return new StatusSummary(
                count(statuses, DerivedStatus.ENGAGED),
                count(statuses, DerivedStatus.ATTENTION_DRIFT),
                count(statuses, DerivedStatus.CONTENT_FRICTION),
                count(statuses, null));
    }

    private long count(Collection<AggregatedStatus> statuses, DerivedStatus status) {
        return statuses.stream().filter(s -> s.derivedStatus() == status).count();
    }

    private static int rank(DerivedStatus status) {
        return status == null ? PRIORITY.size() : PRIORITY.indexOf(status);
    }
}
