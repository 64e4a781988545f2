package com.herzen.activity.api;

import com.herzen.activity.telemetry.ActivityIngestService;
import com.herzen.activity.telemetry.ActivityModels;
import com.herzen.activity.telemetry.ActivityQueryService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Set;

/**
 * Learner identity arrives in {@value #USER_HEADER}, set by the authenticating gateway; it is never read from the body.
 * {@link CallerIdentityInterceptor} rejects requests without it before any argument is bound.
 */
@RestController
@RequestMapping("/api/activity")
public class ActivityController {
    public static final String USER_HEADER = "X-User-Id";

    private final ActivityIngestService ingestService;
    private final ActivityQueryService queryService;

    public ActivityController(ActivityIngestService ingestService, ActivityQueryService queryService) {
        this.ingestService = ingestService;
        this.queryService = queryService;
    }

    @PostMapping("/events")
    public ResponseEntity<ActivityModels.IngestAck> ingest(@RequestHeader(USER_HEADER) String userId,
                                                           @Valid @RequestBody ActivityModels.IngestRequest request) {
        return ResponseEntity.ok(ingestService.ingest(userId, request));
    }

    @GetMapping("/learners/{userId}/history")
    public ResponseEntity<ActivityModels.HistoryResponse> history(@PathVariable String userId,
                                                                  @RequestParam String courseId,
                                                                  @RequestParam(required = false) Integer limit,
                                                                  @RequestParam(required = false) Instant before,
                                                                  @RequestParam(required = false) Long beforeEventId) {
        return ResponseEntity.ok(queryService.getLearnerHistory(userId, courseId, limit, before, beforeEventId));
    }

    @GetMapping("/courses/{courseId}/learners")
    public ResponseEntity<ActivityModels.CourseStatusResponse> learnerStatuses(@PathVariable String courseId,
                                                                               @RequestParam(required = false) Set<String> learnerIds) {
        return ResponseEntity.ok(queryService.getCourseLearnerStatuses(courseId, learnerIds));
    }

    @GetMapping("/courses/{courseId}/signals")
    public ResponseEntity<ActivityModels.SignalsResponse> signals(@PathVariable String courseId,
                                                                  @RequestParam(required = false) Integer perLearner) {
        return ResponseEntity.ok(queryService.getRecentSignals(courseId, perLearner));
    }
}
