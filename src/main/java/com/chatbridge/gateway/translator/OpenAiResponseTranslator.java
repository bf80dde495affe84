package com.chatbridge.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages 完整响应 → OpenAI Chat Completion（非流式）
 * <p>
 * 缺失的可选字段按空值 / 0 处理，不抛异常
 */
@Component
public class OpenAiResponseTranslator {

    private static final String ANTHROPIC_ID_PREFIX = "msg_";

    /**
     * @param response        Anthropic 响应体
     * @param model           客户端请求的模型名
     * @param includeThinking 是否以 &lt;thinking&gt; 标记拼入 thinking 内容
     */
    public JSONObject translate(JSONObject response, String model, boolean includeThinking) {
        JSONArray content = response.get("content") instanceof List ? response.getJSONArray("content") : null;
        List<String> textParts = new ArrayList<>();
        JSONArray toolCalls = new JSONArray();

        if (content != null) {
            for (int i = 0; i < content.size(); i++) {
                if (!(content.get(i) instanceof Map)) {
                    continue;
                }
                JSONObject block = content.getJSONObject(i);
                String type = block.getString("type");
                if ("text".equals(type)) {
                    textParts.add(stringOrEmpty(block.getString("text")));
                } else if ("thinking".equals(type) && includeThinking) {
                    textParts.add("<thinking>\n" + stringOrEmpty(block.getString("thinking")) + "\n</thinking>");
                } else if ("tool_use".equals(type)) {
                    Object input = block.get("input");
                    JSONObject toolCall = JSONObject.of(
                            "id", block.getString("id"), //
                            "type", "function", //
                            "function", JSONObject.of( //
                                    "name", block.getString("name"), //
                                    "arguments", JSON.toJSONString(input != null ? input : new JSONObject()) //
                            ), //
                            "index", toolCalls.size() //
                    );
                    toolCalls.add(toolCall);
                }
            }
        }

        JSONObject message = JSONObject.of("role", "assistant");
        message.put("content", textParts.isEmpty() ? null : String.join("\n", textParts));
        if (!toolCalls.isEmpty()) {
            message.put("tool_calls", toolCalls);
        }

        JSONObject choice = JSONObject.of(
                "index", 0, //
                "message", message //
        );
        choice.put("logprobs", null);
        choice.put("finish_reason", FinishReason.fromStopReason(response.getString("stop_reason")).value());

        JSONObject result = new JSONObject();
        result.put("id", completionId(response.getString("id")));
        result.put("object", "chat.completion");
        result.put("created", ChunkFactory.nowSeconds());
        result.put("model", model);
        result.put("choices", JSONArray.of(choice));
        result.put("usage", usage(response.get("usage") instanceof Map ? response.getJSONObject("usage") : null));
        result.put("system_fingerprint", null);
        return result;
    }

    /**
     * prompt_tokens 计入缓存读取的 token
     */
    private JSONObject usage(JSONObject usage) {
        int promptTokens = 0;
        int completionTokens = 0;
        if (usage != null) {
            promptTokens = usage.getIntValue("input_tokens") + usage.getIntValue("cache_read_input_tokens");
            completionTokens = usage.getIntValue("output_tokens");
        }
        return JSONObject.of(
                "prompt_tokens", promptTokens, //
                "completion_tokens", completionTokens, //
                "total_tokens", promptTokens + completionTokens //
        );
    }

    private String completionId(String anthropicId) {
        if (anthropicId == null || anthropicId.isEmpty()) {
            return ChunkFactory.newCompletionId();
        }
        String bare = anthropicId.startsWith(ANTHROPIC_ID_PREFIX)
                ? anthropicId.substring(ANTHROPIC_ID_PREFIX.length())
                : anthropicId;
        return "chatcmpl-" + bare;
    }

    private static String stringOrEmpty(String value) {
        return value != null ? value : "";
    }
}
