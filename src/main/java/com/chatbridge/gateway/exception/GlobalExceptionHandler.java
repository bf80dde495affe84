package com.chatbridge.gateway.exception;

import com.alibaba.fastjson2.JSONObject;
import com.chatbridge.gateway.translator.ChunkFactory;
import com.chatbridge.gateway.translator.ErrorTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 * <p>
 * 所有错误统一输出 OpenAI 错误格式 {error: {message, type, param, code}}
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorTranslator errorTranslator;

    public GlobalExceptionHandler(ErrorTranslator errorTranslator) {
        this.errorTranslator = errorTranslator;
    }

    @ExceptionHandler(MalformedRequestException.class)
    public ResponseEntity<String> handleMalformed(MalformedRequestException e) {
        log.warn("请求格式错误: {}", e.getMessage());
        return buildErrorResponse(e.getStatusCode(),
                errorTranslator.translate("invalid_request_error", e.getMessage(), e.getStatusCode()));
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<String> handleUpstream(UpstreamException e) {
        log.error("上游 API 异常: status={}, body={}", e.getStatusCode(), e.getErrorBody());
        return buildErrorResponse(e.getStatusCode(), errorTranslator.translate(e.getErrorBody(), e.getStatusCode()));
    }

    @ExceptionHandler(BridgeException.class)
    public ResponseEntity<String> handleBridge(BridgeException e) {
        log.error("网关异常: {}", e.getMessage(), e);
        return buildErrorResponse(e.getStatusCode(),
                errorTranslator.translate("api_error", e.getMessage(), e.getStatusCode()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        String type = switch (statusCode) {
            case 400, 415 -> "invalid_request_error";
            case 401 -> "authentication_error";
            case 403 -> "permission_error";
            default -> "api_error";
        };
        HttpStatus status = HttpStatus.resolve(statusCode);
        String message = e.getReason() != null ? e.getReason() : status != null ? status.getReasonPhrase() : "HTTP " + statusCode;
        return buildErrorResponse(statusCode, errorTranslator.translate(type, message, statusCode));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, errorTranslator.translate("api_error", "服务器内部错误", 500));
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, JSONObject body) {
        return ResponseEntity
                .status(Math.min(statusCode, 599))
                .contentType(MediaType.APPLICATION_JSON)
                .body(ChunkFactory.toJson(body));
    }
}
