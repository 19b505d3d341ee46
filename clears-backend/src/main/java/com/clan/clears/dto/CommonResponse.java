package com.clan.clears.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 所有 HTTP 响应的统一包装。
 *
 * @param <T> 载荷类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonResponse<T> implements Serializable {

    // 200, 202, 400, 401, 404, 500, 502
    private Integer code;

    private String message;

    private T data;

    // 毫秒时间戳
    private Long timestamp;

    public static <T> CommonResponse<T> success(T data) {
        return new CommonResponse<>(200, "OK", data, Instant.now().toEpochMilli());
    }

    public static CommonResponse<Void> success() {
        return success(null);
    }

    /**
     * 已受理：返回当前可用的最佳数据，后台继续处理。
     */
    public static <T> CommonResponse<T> accepted(T data, String message) {
        return new CommonResponse<>(202, message, data, Instant.now().toEpochMilli());
    }

    public static <T> CommonResponse<T> error(Integer code, String message) {
        return new CommonResponse<>(code, message, null, Instant.now().toEpochMilli());
    }
}
