package com.chatbridge.gateway.translator;

import com.alibaba.fastjson2.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Anthropic 错误 → OpenAI 错误
 * <p>
 * type 按错误类别查表，code 只由 HTTP 状态码决定
 */
@Component
public class ErrorTranslator {

    private static final String DEFAULT_TYPE = "api_error";
    private static final String DEFAULT_MESSAGE = "An error occurred";

    private static final Map<String, String> ERROR_TYPE_MAP = Map.of(
            "authentication_error", "invalid_api_key",
            "invalid_request_error", "invalid_request_error",
            "rate_limit_error", "rate_limit_exceeded",
            "api_error", "api_error",
            "overloaded_error", "server_error",
            "permission_error", "insufficient_quota"
    );

    /**
     * @param anthropicError {type: "error", error: {type, message}}，可为 null
     * @param statusCode     HTTP 状态码
     * @return {error: {message, type, param: null, code}}
     */
    public JSONObject translate(JSONObject anthropicError, int statusCode) {
        JSONObject error = anthropicError != null ? anthropicError.getJSONObject("error") : null;
        String errorType = error != null && error.getString("type") != null ? error.getString("type") : DEFAULT_TYPE;
        String message = error != null && error.getString("message") != null ? error.getString("message") : DEFAULT_MESSAGE;

        JSONObject body = JSONObject.of(
                "message", message, //
                "type", ERROR_TYPE_MAP.getOrDefault(errorType, DEFAULT_TYPE) //
        );
        body.put("param", null);
        body.put("code", codeFor(statusCode));
        return JSONObject.of("error", body);
    }

    /**
     * 由 Anthropic 错误类别和消息构建，用于网关自身产生的错误
     */
    public JSONObject translate(String anthropicType, String message, int statusCode) {
        return translate(JSONObject.of("type", "error", "error", JSONObject.of("type", anthropicType, "message", message)), statusCode);
    }

    private String codeFor(int statusCode) {
        return switch (statusCode) {
            case 401 -> "invalid_api_key";
            case 429 -> "rate_limit_exceeded";
            case 400 -> "invalid_request_error";
            default -> null;
        };
    }
}
