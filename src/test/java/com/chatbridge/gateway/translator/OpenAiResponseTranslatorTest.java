package com.chatbridge.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.chatbridge.gateway.config.AppProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiResponseTranslatorTest {

    private final OpenAiResponseTranslator translator = new OpenAiResponseTranslator();

    @Test
    void shouldMapToolUseResponse() {
        JSONObject response = JSON.parseObject("""
                {"id":"msg_01abc","type":"message","role":"assistant","stop_reason":"tool_use",
                 "content":[
                   {"type":"text","text":"Let me check."},
                   {"type":"tool_use","id":"toolu_1","name":"get_weather","input":{"city":"Paris"}}
                 ],
                 "usage":{"input_tokens":10,"output_tokens":5}}
                """);

        JSONObject result = translator.translate(response, "gpt-4o", false);

        JSONObject choice = result.getJSONArray("choices").getJSONObject(0);
        assertThat(choice.getString("finish_reason")).isEqualTo("tool_calls");
        JSONObject message = choice.getJSONObject("message");
        assertThat(message.getString("role")).isEqualTo("assistant");
        assertThat(message.getString("content")).isEqualTo("Let me check.");

        JSONObject toolCall = message.getJSONArray("tool_calls").getJSONObject(0);
        assertThat(toolCall.getString("id")).isEqualTo("toolu_1");
        assertThat(toolCall.getString("type")).isEqualTo("function");
        assertThat(toolCall.getIntValue("index")).isEqualTo(0);
        assertThat(toolCall.getJSONObject("function").getString("name")).isEqualTo("get_weather");
        assertThat(JSON.parseObject(toolCall.getJSONObject("function").getString("arguments")))
                .isEqualTo(JSONObject.of("city", "Paris"));
    }

    @Test
    void shouldAssignSequentialToolCallIndices() {
        JSONObject response = JSON.parseObject("""
                {"stop_reason":"tool_use","content":[
                   {"type":"tool_use","id":"t1","name":"a","input":{}},
                   {"type":"text","text":"between"},
                   {"type":"tool_use","id":"t2","name":"b"}
                ]}
                """);

        JSONObject message = translator.translate(response, "m", false)
                .getJSONArray("choices").getJSONObject(0).getJSONObject("message");

        assertThat(message.getJSONArray("tool_calls")).hasSize(2);
        assertThat(message.getJSONArray("tool_calls").getJSONObject(1).getIntValue("index")).isEqualTo(1);
        assertThat(message.getJSONArray("tool_calls").getJSONObject(1).getJSONObject("function").getString("arguments"))
                .isEqualTo("{}");
    }

    @Test
    void shouldIncludeThinkingOnlyWhenEnabled() {
        JSONObject response = JSON.parseObject("""
                {"stop_reason":"end_turn","content":[
                   {"type":"thinking","thinking":"ponder","signature":"sig"},
                   {"type":"text","text":"answer"}
                ]}
                """);

        String withThinking = translator.translate(response, "m", true)
                .getJSONArray("choices").getJSONObject(0).getJSONObject("message").getString("content");
        String withoutThinking = translator.translate(response, "m", false)
                .getJSONArray("choices").getJSONObject(0).getJSONObject("message").getString("content");

        assertThat(withThinking).isEqualTo("<thinking>\nponder\n</thinking>\nanswer");
        assertThat(withoutThinking).isEqualTo("answer");
    }

    @Test
    void shouldUseNullContentWhenNoTextProduced() {
        JSONObject response = JSON.parseObject("""
                {"content":[{"type":"thinking","thinking":"hidden"}]}
                """);

        JSONObject result = translator.translate(response, "m", false);
        JSONObject message = result.getJSONArray("choices").getJSONObject(0).getJSONObject("message");

        assertThat(message.containsKey("content")).isTrue();
        assertThat(message.get("content")).isNull();
        assertThat(message.containsKey("tool_calls")).isFalse();
        assertThat(ChunkFactory.toJson(result))
                .contains("\"content\":null")
                .contains("\"logprobs\":null")
                .contains("\"system_fingerprint\":null");
    }

    @Test
    void shouldFoldCacheReadTokensIntoPromptTokens() {
        JSONObject response = JSON.parseObject("""
                {"content":[],"usage":{"input_tokens":12,"cache_read_input_tokens":30,"output_tokens":8}}
                """);

        JSONObject usage = translator.translate(response, "m", false).getJSONObject("usage");

        assertThat(usage.getIntValue("prompt_tokens")).isEqualTo(42);
        assertThat(usage.getIntValue("completion_tokens")).isEqualTo(8);
        assertThat(usage.getIntValue("total_tokens")).isEqualTo(50);
    }

    @Test
    void shouldDefaultMissingFields() {
        JSONObject result = translator.translate(new JSONObject(), "m", false);

        assertThat(result.getString("id")).startsWith("chatcmpl-").hasSize("chatcmpl-".length() + 24);
        assertThat(result.getString("object")).isEqualTo("chat.completion");
        assertThat(result.getString("model")).isEqualTo("m");
        assertThat(result.getJSONObject("usage").getIntValue("total_tokens")).isZero();
        assertThat(result.getJSONArray("choices").getJSONObject(0).getString("finish_reason")).isEqualTo("stop");
    }

    @Test
    void shouldReplaceBackendIdPrefix() {
        JSONObject result = translator.translate(JSON.parseObject("{\"id\":\"msg_01XYZ\"}"), "m", false);

        assertThat(result.getString("id")).isEqualTo("chatcmpl-01XYZ");
    }

    @Test
    void shouldMapStopReasons() {
        assertThat(finishReasonFor("end_turn")).isEqualTo("stop");
        assertThat(finishReasonFor("stop_sequence")).isEqualTo("stop");
        assertThat(finishReasonFor("max_tokens")).isEqualTo("length");
        assertThat(finishReasonFor("tool_use")).isEqualTo("tool_calls");
        assertThat(finishReasonFor("refusal")).isEqualTo("stop");
    }

    private String finishReasonFor(String stopReason) {
        JSONObject response = JSONObject.of("stop_reason", stopReason);
        return translator.translate(response, "m", false)
                .getJSONArray("choices").getJSONObject(0).getString("finish_reason");
    }

    @Test
    void shouldRoundTripSingleTextMessage() {
        AppProperties properties = new AppProperties();
        OpenAiRequestTranslator requestTranslator =
                new OpenAiRequestTranslator(properties, new ReasoningPolicy(properties));

        JSONObject request = requestTranslator.translate(JSON.parseObject("""
                {"model":"claude-sonnet-4-5","messages":[{"role":"user","content":"Say hello"}]}
                """)).request();
        assertThat(request.getJSONArray("messages").getJSONObject(0).getString("content")).isEqualTo("Say hello");

        JSONObject response = JSON.parseObject("""
                {"id":"msg_1","content":[{"type":"text","text":"Hello!"}],"stop_reason":"end_turn"}
                """);
        JSONObject result = translator.translate(response, request.getString("model"), false);

        assertThat(result.getJSONArray("choices").getJSONObject(0).getJSONObject("message").getString("content"))
                .isEqualTo("Hello!");
    }

    @Test
    void shouldTreatMissingBlockTextAsEmpty() {
        JSONObject response = JSON.parseObject("""
                {"content":[{"type":"thinking"},{"type":"text"},{"type":"text","text":"tail"}]}
                """);

        String content = translator.translate(response, "m", true)
                .getJSONArray("choices").getJSONObject(0).getJSONObject("message").getString("content");

        assertThat(content).isEqualTo("<thinking>\n\n</thinking>\n\ntail");
        assertThat(content).doesNotContain("null");
    }

    @Test
    void shouldSkipNonObjectContentEntries() {
        JSONObject response = JSON.parseObject("""
                {"content":["stray",{"type":"text","text":"ok"}],"usage":"n/a"}
                """);

        JSONObject result = translator.translate(response, "m", false);

        assertThat(result.getJSONArray("choices").getJSONObject(0).getJSONObject("message").getString("content"))
                .isEqualTo("ok");
        assertThat(result.getJSONObject("usage").getIntValue("total_tokens")).isZero();
    }
}
