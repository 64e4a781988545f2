package com.herzen.activity;

import com.herzen.activity.classification.ActivityEventTypes;
import com.herzen.activity.classification.DerivedStatus;
import com.herzen.activity.classification.EventClassifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventClassifierTest {
    private final EventClassifier classifier = new EventClassifier();

    @ParameterizedTest
    @CsvSource({
            "idle.detected,         attention_drift",
            "video.pause,           attention_drift",
            "video.buffer.start,    attention_drift",
            "lesson.locked_click,   attention_drift",
            "Lesson.Locked_Click,   attention_drift",
            "quiz.fail,             content_friction",
            "quiz.retry.requested,  content_friction",
            "tutor.prompt,          content_friction",
            "cold_call.star,        content_friction",
            "cold_call.submit,      content_friction",
            "tutor.response_received, content_friction",
            "content.friction,      content_friction",
            "video.play,            engaged",
            "VIDEO.RESUME,          engaged",
            "video.buffer.end,      engaged",
            "progress.snapshot,     engaged",
            "persona.selected,      engaged",
            "notes.saved,           engaged",
            "lesson.opened,         engaged",
            "cold_call.opened,      engaged",
            "tutor.response,        engaged"
    })
    void classifiesByFirstMatchingGroup(String eventType, String expected) {
        var result = classifier.classify(eventType, null);
        assertEquals(DerivedStatus.fromWire(expected), result.derivedStatus());
        assertNotNull(result.statusReason());
    }

    @Test
    void everyAttentionDriftPrefixWinsOverLaterGroups() {
        for (String prefix : ActivityEventTypes.ATTENTION_DRIFT_PREFIXES) {
            assertEquals(DerivedStatus.ATTENTION_DRIFT, classifier.classify(prefix + "x", null).derivedStatus(), prefix);
        }
        // lesson.locked_click also starts with the engaged prefix lesson.
        assertTrue(ActivityEventTypes.ENGAGED_PREFIXES.stream().anyMatch("lesson.locked_click"::startsWith));
        assertEquals(DerivedStatus.ATTENTION_DRIFT, classifier.classify("lesson.locked_click", null).derivedStatus());
    }

    @Test
    void frictionPrefixesAreCheckedBeforeBroaderEngagedOnes() {
        assertEquals(DerivedStatus.CONTENT_FRICTION, classifier.classify("cold_call.submit", null).derivedStatus());
        assertEquals(DerivedStatus.CONTENT_FRICTION, classifier.classify("tutor.response_received", null).derivedStatus());
    }

    @Test
    void usesPayloadReasonVerbatim() {
        var result = classifier.classify("quiz.fail", Map.of("reason", "  Failed question 3 twice "));
        assertEquals(DerivedStatus.CONTENT_FRICTION, result.derivedStatus());
        assertEquals("  Failed question 3 twice ", result.statusReason());
    }

    @Test
    void synthesizesReasonFromGroupFallbackAndOriginalEventType() {
        assertEquals("Idle or pause pattern detected (Video.Pause)",
                classifier.classify("Video.Pause", null).statusReason());
        assertEquals("Learner signaled friction (quiz.retry)",
                classifier.classify("quiz.retry", Map.of("attempt", 2)).statusReason());
        assertEquals("Learner interacting with content (notes.saved)",
                classifier.classify("notes.saved", Map.of("reason", "   ")).statusReason());
    }

    @ParameterizedTest
    @ValueSource(strings = {"\u00A0", "\uFEFF", " \u2007\t\u202F ", "\u3000"})
    void reasonOfOnlyUnicodeSpacesFallsBackToGeneratedText(String reason) {
        assertEquals("Learner signaled friction (quiz.fail)",
                classifier.classify("quiz.fail", Map.of("reason", reason)).statusReason());
    }

    @Test
    void reasonWithNoBreakSpacesAroundTextIsKept() {
        assertEquals("\u00A0Stuck on recursion\u00A0",
                classifier.classify("quiz.fail", Map.of("reason", "\u00A0Stuck on recursion\u00A0")).statusReason());
    }

    @Test
    void ignoresNonStringReason() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("reason", 42);
        assertEquals("Learner interacting with content (video.play)", classifier.classify("video.play", payload).statusReason());
    }

    @ParameterizedTest
    @ValueSource(strings = {"page.view", "quiz", "video", "idle", "chat.message", "xlesson.opened"})
    void unmatchedTypesHaveNeitherStatusNorReason(String eventType) {
        var result = classifier.classify(eventType, Map.of("reason", "ignored without a matching rule"));
        assertNull(result.derivedStatus());
        assertNull(result.statusReason());
        assertFalse(result.classified());
    }

    @Test
    void classificationIsRepeatable() {
        Map<String, Object> payload = Map.of("reason", "Rewatched intro");
        var first = classifier.classify("video.pause", payload);
        var second = classifier.classify("video.pause", payload);
        assertEquals(first, second);
        assertEquals(classifier.classify("unknown.type", null), classifier.classify("unknown.type", null));
    }
}
