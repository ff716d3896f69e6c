package com.vth.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Envelope of every JSON response
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        String status,
        String message,
        Object data,
        String errorCode,
        Map<String, String> details
) {
    public static ApiResponse success(Object data) {
        return new ApiResponse("success", null, data, null, null);
    }

    public static ApiResponse success(String message, Object data) {
        return new ApiResponse("success", message, data, null, null);
    }

    public static ApiResponse error(String errorCode, String message) {
        return new ApiResponse("error", message, null, errorCode, null);
    }

    public static ApiResponse error(String errorCode, String message, Map<String, String> details) {
        return new ApiResponse("error", message, null, errorCode, details);
    }
}
