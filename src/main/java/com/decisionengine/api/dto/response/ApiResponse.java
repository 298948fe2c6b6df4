package com.decisionengine.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Envelope for successful responses: {@code {success: true, data, timestamp}}.
 * Applied to every controller return value by {@link com.decisionengine.config.ApiResponseAdvice}.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data) {
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
