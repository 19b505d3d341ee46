package com.clan.clears.exception;

import lombok.Getter;

/**
 * 统计 API 调用最终失败：终态状态码，或重试次数耗尽。
 */
@Getter
public class UpstreamException extends RuntimeException {

    // 未收到 HTTP 状态码时为 0
    private final int status;

    private final boolean transientFailure;

    public UpstreamException(String message, int status, boolean transientFailure) {
        super(message);
        this.status = status;
        this.transientFailure = transientFailure;
    }

    public UpstreamException(String message, int status, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.transientFailure = transientFailure;
    }
}
