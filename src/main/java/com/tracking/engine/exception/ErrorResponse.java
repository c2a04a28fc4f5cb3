package com.tracking.engine.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    String errorCode,
    String message,
    List<String> violations,
    int status,
    Instant timestamp,
    String path
) {
}
