package com.locplat.translation.dto;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * JSON body returned for every failed request.
 */
public record ApiError(int status, String error, String message, List<String> details, OffsetDateTime timestamp) {

    public static ApiError of(int status, String error, String message) {
        return new ApiError(status, error, message, List.of(), OffsetDateTime.now());
    }

    public static ApiError of(int status, String error, String message, List<String> details) {
        return new ApiError(status, error, message, details, OffsetDateTime.now());
    }
}
