package com.herzen.activity;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ActivityControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Test
    void ingestWithoutIdentityIsUnauthenticated() throws Exception {
        mockMvc.perform(post("/api/activity/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batch(uniqueCourse(), "video.play")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHENTICATED"));
    }

    @Test
    void ingestWithBlankIdentityIsUnauthenticated() throws Exception {
        mockMvc.perform(post("/api/activity/events")
                        .header("X-User-Id", " ")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batch(uniqueCourse(), "video.play")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void identityIsCheckedBeforeTheBodyIsValidated() throws Exception {
        String invalid = "{\"events\":[{\"courseId\":\"c-1\",\"moduleNo\":1}]}";

        mockMvc.perform(post("/api/activity/events")
                        .header("X-User-Id", " ")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(invalid))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("UNAUTHENTICATED"));

        mockMvc.perform(post("/api/activity/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(invalid))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/activity/events")
                        .header("X-User-Id", "")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\": 42"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void historyAcceptsEventIdCursor() throws Exception {
        String course = uniqueCourse();
        String body = """
                {"events":[
                  {"courseId":"%1$s","eventType":"video.play","occurredAt":"2024-05-01T09:05:00Z"},
                  {"courseId":"%1$s","eventType":"video.pause","occurredAt":"2024-05-01T09:05:00Z"}]}
                """.formatted(course);
        mockMvc.perform(post("/api/activity/events")
                        .header("X-User-Id", "learner-8")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());

        String firstPage = mockMvc.perform(get("/api/activity/learners/learner-8/history")
                        .header("X-User-Id", "tutor-1")
                        .param("courseId", course)
                        .param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[0].eventType").value("video.pause"))
                .andReturn().getResponse().getContentAsString();
        Number lastId = JsonPath.read(firstPage, "$.events[0].eventId");

        mockMvc.perform(get("/api/activity/learners/learner-8/history")
                        .header("X-User-Id", "tutor-1")
                        .param("courseId", course)
                        .param("limit", "1")
                        .param("before", "2024-05-01T09:05:00Z")
                        .param("beforeEventId", lastId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events", hasSize(1)))
                .andExpect(jsonPath("$.events[0].eventType").value("video.play"));
    }

    @Test
    void ingestRejectsEventWithoutType() throws Exception {
        String body = "{\"events\":[{\"courseId\":\"c-1\",\"moduleNo\":1}]}";

        mockMvc.perform(post("/api/activity/events")
                        .header("X-User-Id", "learner-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_BATCH"))
                .andExpect(jsonPath("$.details['events[0].eventType']").exists());
    }

    @Test
    void ingestRejectsMalformedBody() throws Exception {
        mockMvc.perform(post("/api/activity/events")
                        .header("X-User-Id", "learner-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"events\": 42"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_BATCH"));
    }

    @Test
    void ingestThenReadHistoryAndCourseStatuses() throws Exception {
        String course = uniqueCourse();

        mockMvc.perform(post("/api/activity/events")
                        .header("X-User-Id", "learner-7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(batch(course, "video.pause")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(1))
                .andExpect(jsonPath("$.duplicates").value(0));

        mockMvc.perform(get("/api/activity/learners/learner-7/history")
                        .header("X-User-Id", "tutor-1")
                        .param("courseId", course))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events", hasSize(1)))
                .andExpect(jsonPath("$.events[0].eventType").value("video.pause"))
                .andExpect(jsonPath("$.events[0].derivedStatus").value("attention_drift"))
                .andExpect(jsonPath("$.events[0].occurredAt").value("2024-05-01T09:05:00Z"));

        mockMvc.perform(get("/api/activity/courses/{courseId}/learners", course)
                        .header("X-User-Id", "tutor-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.learners", hasSize(1)))
                .andExpect(jsonPath("$.learners[0].userId").value("learner-7"))
                .andExpect(jsonPath("$.learners[0].derivedStatus").value("attention_drift"))
                .andExpect(jsonPath("$.summary.attention_drift").value(1))
                .andExpect(jsonPath("$.summary.content_friction").value(0))
                .andExpect(jsonPath("$.summary.engaged").value(0))
                .andExpect(jsonPath("$.summary.unknown").value(0));

        mockMvc.perform(get("/api/activity/courses/{courseId}/signals", course)
                        .header("X-User-Id", "tutor-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.courseId").value(course))
                .andExpect(jsonPath("$.learners[0].signals[0].reason").value("Idle or pause pattern detected (video.pause)"));
    }

    @Test
    void readsRequireCallerIdentity() throws Exception {
        mockMvc.perform(get("/api/activity/courses/{courseId}/learners", uniqueCourse()))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void historyRequiresCourse() throws Exception {
        mockMvc.perform(get("/api/activity/learners/learner-7/history")
                        .header("X-User-Id", "tutor-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));
    }

    @Test
    void emptyCourseReturnsZeroSummary() throws Exception {
        mockMvc.perform(get("/api/activity/courses/{courseId}/learners", uniqueCourse())
                        .header("X-User-Id", "tutor-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.learners", hasSize(0)))
                .andExpect(jsonPath("$.summary.unknown").value(0));
    }

    private static String batch(String course, String type) {
        return """
                {"events":[{"courseId":"%s","moduleNo":2,"topicId":"loops","eventType":"%s",
                  "payload":{"position":31},"occurredAt":"2024-05-01T09:05:00Z"}]}
                """.formatted(course, type);
    }

    private static String uniqueCourse() {
        return "course-" + UUID.randomUUID();
    }
}
