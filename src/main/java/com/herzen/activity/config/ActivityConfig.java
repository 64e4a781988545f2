package com.herzen.activity.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class ActivityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate telemetryRestTemplate(RestTemplateBuilder builder, ActivityProperties properties) {
        return builder
                .setConnectTimeout(properties.buffer().connectTimeout())
                .setReadTimeout(properties.buffer().readTimeout())
                .build();
    }

    // One thread: buffer timers and transmissions run in submission order.
    @Bean
    public ThreadPoolTaskScheduler telemetryFlushScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("telemetry-flush-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
