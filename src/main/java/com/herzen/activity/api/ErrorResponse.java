package com.herzen.activity.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String errorCode, String message, Instant timestamp, Map<String, String> details) {
    public static ErrorResponse of(String errorCode, String message) {
        return new ErrorResponse(errorCode, message, Instant.now(), null);
    }

    public static ErrorResponse of(String errorCode, String message, Map<String, String> details) {
        return new ErrorResponse(errorCode, message, Instant.now(), details);
    }
}
