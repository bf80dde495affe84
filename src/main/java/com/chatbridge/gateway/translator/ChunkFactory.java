package com.chatbridge.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;

import java.util.UUID;

/**
 * OpenAI chat.completion.chunk 构建与 SSE 帧编码
 */
public final class ChunkFactory {

    public static final String DONE_FRAME = "data: [DONE]\n\n";

    private ChunkFactory() {
    }

    /**
     * 生成 chatcmpl- 前缀的随机 ID
     */
    public static String newCompletionId() {
        return "chatcmpl-" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }

    public static long nowSeconds() {
        return System.currentTimeMillis() / 1000;
    }

    /**
     * 构建单个 choice 的流式 chunk
     *
     * @param state        当前流状态（提供 id / created / model）
     * @param delta        增量内容，结束块为空对象
     * @param finishReason 结束原因，非结束块为 null
     */
    public static JSONObject chunk(StreamState state, JSONObject delta, String finishReason) {
        JSONObject choice = JSONObject.of(
                "index", 0, //
                "delta", delta //
        );
        choice.put("logprobs", null);
        choice.put("finish_reason", finishReason);

        JSONObject chunk = JSONObject.of(
                "id", state.getCompletionId(), //
                "object", "chat.completion.chunk", //
                "created", state.getCreated(), //
                "model", state.getModel(), //
                "choices", JSONArray.of(choice) //
        );
        chunk.put("system_fingerprint", null);
        return chunk;
    }

    public static JSONObject contentChunk(StreamState state, String content) {
        return chunk(state, JSONObject.of("content", content), null);
    }

    public static JSONObject toolCallChunk(StreamState state, JSONObject toolCallDelta) {
        return chunk(state, JSONObject.of("tool_calls", JSONArray.of(toolCallDelta)), null);
    }

    /**
     * 编码为 SSE 数据帧，保留 null 字段
     */
    public static String frame(JSONObject chunk) {
        return "data: " + toJson(chunk) + "\n\n";
    }

    public static String toJson(JSONObject object) {
        return object.toJSONString(JSONWriter.Feature.WriteNulls);
    }
}
