package com.herzen.activity.classification;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Maps an event type to an engagement status by prefix matching over {@link ActivityEventTypes#GROUPS}.
 * Stateless; the same input always yields the same {@link Classification}.
 */
@Component
public class EventClassifier {

    public Classification classify(String eventType, Map<String, Object> payload) {
        if (eventType == null || eventType.isBlank()) return Classification.UNCLASSIFIED;
        String normalized = eventType.toLowerCase(Locale.ROOT);

        for (ActivityEventTypes.PrefixGroup group : ActivityEventTypes.GROUPS) {
            if (group.matches(normalized)) {
                return new Classification(group.status(), buildReason(eventType, payload, group.fallbackReason()));
            }
        }
        return Classification.UNCLASSIFIED;
    }

    private String buildReason(String eventType, Map<String, Object> payload, String fallback) {
        if (payload != null && payload.get("reason") instanceof String reason && !isBlankText(reason)) {
            return reason;
        }
        return fallback + " (" + eventType + ")";
    }

    // isBlank() misses no-break spaces and the byte order mark
    private static boolean isBlankText(String value) {
        return value.chars().allMatch(c -> Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF');
    }

    public record Classification(DerivedStatus derivedStatus, String statusReason) {
        public static final Classification UNCLASSIFIED = new Classification(null, null);

        public boolean classified() {
            return derivedStatus != null;
        }
    }
}
