package com.example.campuseats.global.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;

@Schema(description = "Envelope for the JSON endpoints (warm-up, session inspection)")
@Getter
public class ApiResponse<T> {

    @Schema(description = "Success flag", example = "true")
    private final boolean success;

    @Schema(description = "Response message", example = "warmed up")
    private final String message;

    @Schema(description = "Payload, e.g. the dialog state of a session")
    private final T data;

    private ApiResponse(boolean success, String message, T data) {
        this.success = success;
        this.message = message;
        this.data = data;
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, "The request was processed successfully.", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data);
    }

    /**
     * A handled failure that is still answered with 200, such as an unreachable model during warm-up.
     */
    public static <T> ApiResponse<T> failure(String message, T data) {
        return new ApiResponse<>(false, message, data);
    }
}
