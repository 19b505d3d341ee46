package com.clan.clears.exception;

import com.clan.clears.dto.CommonResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 把控制器抛出的异常转换为 {@link CommonResponse} 错误响应。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<CommonResponse<Void>> handleNotFound(ResourceNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<CommonResponse<Void>> handleBadRequest(Exception e) {
        log.warn("请求被拒绝: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<CommonResponse<Void>> handleUpstream(UpstreamException e) {
        log.warn("上游调用失败（状态 {}，临时 {}）: {}",
                e.getStatus(), e.isTransientFailure(), e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "Upstream stats API failed: " + e.getMessage());
    }

    @ExceptionHandler(DurableStoreException.class)
    public ResponseEntity<CommonResponse<Void>> handleStore(DurableStoreException e) {
        log.error("持久化存储异常", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Storage failure");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<CommonResponse<Void>> handleUnexpected(Exception e) {
        log.error("未处理的异常", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
    }

    private ResponseEntity<CommonResponse<Void>> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(CommonResponse.error(status.value(), message));
    }
}
