package com.herzen.activity.client;

import com.herzen.activity.config.ActivityProperties;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates one {@link TelemetryBuffer} per login session. The session layer owns the returned buffer
 * and closes it at logout.
 */
@Component
public class TelemetryBufferFactory {
    private final TelemetryTransport transport;
    private final ThreadPoolTaskScheduler telemetryFlushScheduler;
    private final ActivityProperties properties;
    private final Clock clock;

    public TelemetryBufferFactory(TelemetryTransport transport,
                                  ThreadPoolTaskScheduler telemetryFlushScheduler,
                                  ActivityProperties properties,
                                  Clock clock) {
        this.transport = transport;
        this.telemetryFlushScheduler = telemetryFlushScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public TelemetryBuffer openSession(String sessionToken) {
        ActivityProperties.Buffer config = properties.buffer();
        TelemetryBuffer buffer = new TelemetryBuffer(transport, telemetryFlushScheduler, telemetryFlushScheduler,
                clock, config.maxSize(), config.flushDelay());
        buffer.setSessionToken(sessionToken);
        return buffer;
    }
}
