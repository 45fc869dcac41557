package com.noteshub.gamification.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Envelope of every API response.
 *
 * @param <T> payload type
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonResponse<T> implements Serializable {

    // 200, 400, 404, 500
    private Integer code;

    private String message;

    // payload, null on errors
    private T data;

    // epoch millis
    private Long timestamp;

    public static <T> CommonResponse<T> success(T data) {
        return new CommonResponse<>(
                200,
                "OK",
                data,
                Instant.now().toEpochMilli()
        );
    }

    public static CommonResponse<Void> success() {
        return success(null);
    }

    /**
     * @param code HTTP status mirrored into the body
     */
    public static <T> CommonResponse<T> error(Integer code, String message) {
        return new CommonResponse<>(
                code,
                message,
                null,
                Instant.now().toEpochMilli()
        );
    }
}
