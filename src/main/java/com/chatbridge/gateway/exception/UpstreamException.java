package com.chatbridge.gateway.exception;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import lombok.Getter;

/**
 * 上游 Anthropic API 返回错误
 * <p>
 * errorBody 始终是 {type: "error", error: {type, message}} 形状
 */
@Getter
public class UpstreamException extends BridgeException {

    private final JSONObject errorBody;

    public UpstreamException(int statusCode, JSONObject errorBody) {
        super("上游 API 错误: " + statusCode + " - " + errorMessage(errorBody), statusCode);
        this.errorBody = errorBody;
    }

    public UpstreamException(int statusCode, String message, Throwable cause) {
        super(message, statusCode, cause);
        this.errorBody = errorObject("api_error", message);
    }

    /**
     * 由原始响应体构造，非 JSON 的响应体包装为 api_error
     */
    public static UpstreamException fromResponseBody(int statusCode, String body) {
        JSONObject parsed = parseOrNull(body);
        if (parsed == null || !(parsed.get("error") instanceof JSONObject)) {
            parsed = errorObject("api_error", body == null || body.isBlank() ? "HTTP " + statusCode : body);
        }
        return new UpstreamException(statusCode, parsed);
    }

    public static JSONObject errorObject(String type, String message) {
        return JSONObject.of(
                "type", "error", //
                "error", JSONObject.of("type", type, "message", message) //
        );
    }

    private static JSONObject parseOrNull(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return JSON.parseObject(body);
        } catch (JSONException e) {
            // 非 JSON 响应体，按纯文本处理
            return null;
        }
    }

    private static String errorMessage(JSONObject errorBody) {
        JSONObject error = errorBody != null ? errorBody.getJSONObject("error") : null;
        return error != null ? error.getString("message") : null;
    }
}
