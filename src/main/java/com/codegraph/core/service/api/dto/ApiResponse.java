package com.codegraph.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope for every REST response of the service.
 *
 * @param <T> the type of the response data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;

    /**
     * Response data (null on error).
     */
    private T data;

    /**
     * Error information (null on success).
     */
    private ErrorInfo error;

    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> error(String message, String code) {
        return error(ErrorInfo.builder()
                .message(message)
                .code(code)
                .build());
    }

    public static <T> ApiResponse<T> error(String message, String code, String details) {
        return error(ErrorInfo.builder()
                .message(message)
                .code(code)
                .details(details)
                .build());
    }

    /**
     * Error response that names the job or repository the failure refers to.
     */
    public static <T> ApiResponse<T> error(String message, String code, String details, String entityId) {
        return error(ErrorInfo.builder()
                .message(message)
                .code(code)
                .details(details)
                .entityId(entityId)
                .build());
    }

    private static <T> ApiResponse<T> error(ErrorInfo errorInfo) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(errorInfo)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorInfo {
        private String message;
        private String code;
        private String details;
        private String entityId;
    }
}
