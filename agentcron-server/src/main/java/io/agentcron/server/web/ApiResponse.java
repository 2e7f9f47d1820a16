package io.agentcron.server.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope of every API answer. {@code code} is 0 on success, otherwise it mirrors the HTTP status.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(int code, T data, String message) {

    public static final int OK = 0;

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(OK, data, message);
    }

    public static <T> ApiResponse<T> ok(String message) {
        return new ApiResponse<>(OK, null, message);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, null, message);
    }

    public static <T> ApiResponse<T> error(int code, T data, String message) {
        return new ApiResponse<>(code, data, message);
    }
}
