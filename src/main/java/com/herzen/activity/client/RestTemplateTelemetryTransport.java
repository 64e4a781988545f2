package com.herzen.activity.client;

import com.herzen.activity.config.ActivityProperties;
import com.herzen.activity.telemetry.ActivityModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Posts batches as JSON with the session token as a bearer credential. The gateway in front of the
 * ingestion endpoint turns the token into the learner identity header.
 */
@Slf4j
@Component
public class RestTemplateTelemetryTransport implements TelemetryTransport {
    private final RestTemplate restTemplate;
    private final String endpoint;

    public RestTemplateTelemetryTransport(RestTemplate telemetryRestTemplate, ActivityProperties properties) {
        this.restTemplate = telemetryRestTemplate;
        this.endpoint = properties.buffer().endpoint();
    }

    @Override
    public void send(String sessionToken, List<ActivityModels.TelemetryEvent> batch) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(sessionToken);

        ActivityModels.IngestAck ack = restTemplate.postForObject(
                endpoint,
                new HttpEntity<>(new ActivityModels.IngestRequest(batch), headers),
                ActivityModels.IngestAck.class);
        log.debug("Telemetry batch of {} delivered, ack={}", batch.size(), ack);
    }
}
