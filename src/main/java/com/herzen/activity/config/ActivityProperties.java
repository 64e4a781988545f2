package com.herzen.activity.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings bound from the {@code activity.*} namespace of application.yml.
 */
@Validated
@ConfigurationProperties(prefix = "activity")
public record ActivityProperties(@Min(1) @DefaultValue("20") int windowSize,
                                 @Min(1) @DefaultValue("5") int signalsPerLearner,
                                 @Valid @DefaultValue History history,
                                 @Valid @DefaultValue Ingest ingest,
                                 @Valid @DefaultValue Buffer buffer) {

    public record History(@Min(1) @DefaultValue("40") int defaultLimit,
                          @Min(1) @DefaultValue("100") int maxLimit) {}

    public record Ingest(@Min(1) @DefaultValue("200") int maxBatchSize) {}

    /**
     * Client-side buffering. {@code endpoint} is the ingestion URL behind the authenticating gateway.
     */
    public record Buffer(@Min(1) @DefaultValue("20") int maxSize,
                         @NotNull @DefaultValue("4s") Duration flushDelay,
                         @NotBlank @DefaultValue("http://localhost:8080/api/activity/events") String endpoint,
                         @NotNull @DefaultValue("2s") Duration connectTimeout,
                         @NotNull @DefaultValue("5s") Duration readTimeout) {}

    public static ActivityProperties defaults() {
        return new ActivityProperties(20, 5,
                new History(40, 100),
                new Ingest(200),
                new Buffer(20, Duration.ofSeconds(4), "http://localhost:8080/api/activity/events",
                        Duration.ofSeconds(2), Duration.ofSeconds(5)));
    }
}
