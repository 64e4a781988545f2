package com.herzen.activity;

import com.herzen.activity.client.TelemetryBuffer;
import com.herzen.activity.client.TelemetryBufferFactory;
import com.herzen.activity.telemetry.ActivityModels.TelemetryEvent;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class TelemetryBufferFactoryTest {
    @Autowired
    private TelemetryBufferFactory factory;

    @Test
    void openedSessionBuffersAndSchedulesFlush() {
        try (TelemetryBuffer buffer = factory.openSession("session-1")) {
            buffer.record(new TelemetryEvent("course-1", 1, "t", "video.play", null, Instant.now(), null));

            assertEquals(1, buffer.pendingEvents());
            assertTrue(buffer.flushScheduled());
        }
    }

    @Test
    void sessionWithoutTokenDropsEvents() {
        try (TelemetryBuffer buffer = factory.openSession(null)) {
            buffer.record(new TelemetryEvent("course-1", 1, "t", "video.play", null, Instant.now(), null));

            assertEquals(0, buffer.pendingEvents());
            assertFalse(buffer.flushScheduled());
        }
    }
}
