package com.herzen.activity.classification;

import java.util.List;

public final class ActivityEventTypes {
    public static final List<String> ATTENTION_DRIFT_PREFIXES = List.of(
            "idle.",
            "video.pause",
            "video.buffer.start",
            "lesson.locked_click"
    );

    public static final List<String> CONTENT_FRICTION_PREFIXES = List.of(
            "quiz.fail",
            "quiz.retry",
            "tutor.prompt",
            "cold_call.star",
            "cold_call.submit",
            "tutor.response_received",
            "content.friction"
    );

    public static final List<String> ENGAGED_PREFIXES = List.of(
            "video.play",
            "video.resume",
            "video.buffer.end",
            "progress.snapshot",
            "persona.",
            "notes.",
            "lesson.",
            "cold_call.",
            "tutor.response"
    );

    // Evaluation order matters: lesson.locked_click must be seen before lesson.
    public static final List<PrefixGroup> GROUPS = List.of(
            new PrefixGroup(DerivedStatus.ATTENTION_DRIFT, ATTENTION_DRIFT_PREFIXES, "Idle or pause pattern detected"),
            new PrefixGroup(DerivedStatus.CONTENT_FRICTION, CONTENT_FRICTION_PREFIXES, "Learner signaled friction"),
            new PrefixGroup(DerivedStatus.ENGAGED, ENGAGED_PREFIXES, "Learner interacting with content")
    );

    public record PrefixGroup(DerivedStatus status, List<String> prefixes, String fallbackReason) {
        public boolean matches(String normalizedEventType) {
            return prefixes.stream().anyMatch(normalizedEventType::startsWith);
        }
    }

    private ActivityEventTypes() {}
}
