package com.fieldpilot.lifecycle.api.dto;

import java.util.List;

/** Body of every 4xx produced by the API. */
public record ErrorResponse(String kind, String message, List<String> details, boolean retryable) {

    public static ErrorResponse of(String kind, String message) {
        return new ErrorResponse(kind, message, List.of(), false);
    }
}
