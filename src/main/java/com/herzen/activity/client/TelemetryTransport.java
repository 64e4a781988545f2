package com.herzen.activity.client;

import com.herzen.activity.telemetry.ActivityModels.TelemetryEvent;

import java.util.List;

/**
 * Sends one batch to the ingestion endpoint. Implementations throw on any delivery failure.
 */
public interface TelemetryTransport {
    void send(String sessionToken, List<TelemetryEvent> batch);
}
