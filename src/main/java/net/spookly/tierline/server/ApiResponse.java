package net.spookly.tierline.server;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;

/**
 * JSON response envelope for webhook and reporting endpoints.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ApiResponse {
    public final boolean ok;
    public final String message;
    public final Object data;

    public static ApiResponse ok(String message, Object data) {
        return new ApiResponse(true, message, data);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse(false, message, null);
    }

    public static ApiResponse error(String message, Object data) {
        return new ApiResponse(false, message, data);
    }
}
