package com.chatbridge.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolResultBufferTest {

    @Test
    void shouldStayIdleWithoutResults() {
        ToolResultBuffer buffer = new ToolResultBuffer();
        JSONArray messages = new JSONArray();

        assertThat(buffer.state()).isEqualTo(ToolResultBuffer.State.IDLE);
        assertThat(buffer.flushTo(messages)).isFalse();
        assertThat(messages).isEmpty();
    }

    @Test
    void shouldMergeResultsIntoSingleUserMessage() {
        ToolResultBuffer buffer = new ToolResultBuffer();
        buffer.add("call_1", "sunny");
        buffer.add("call_2", "12:00");
        assertThat(buffer.state()).isEqualTo(ToolResultBuffer.State.ACCUMULATING);

        JSONArray messages = new JSONArray();
        assertThat(buffer.flushTo(messages)).isTrue();

        assertThat(messages).hasSize(1);
        JSONObject message = messages.getJSONObject(0);
        assertThat(message.getString("role")).isEqualTo("user");
        JSONArray content = message.getJSONArray("content");
        assertThat(content).hasSize(2);
        assertThat(content.getJSONObject(0)).isEqualTo(JSONObject.of(
                "type", "tool_result", "tool_use_id", "call_1", "content", "sunny"));
        assertThat(content.getJSONObject(1).getString("tool_use_id")).isEqualTo("call_2");
        assertThat(buffer.state()).isEqualTo(ToolResultBuffer.State.IDLE);
    }

    @Test
    void shouldStartFreshAfterFlush() {
        ToolResultBuffer buffer = new ToolResultBuffer();
        JSONArray messages = new JSONArray();
        buffer.add("a", "1");
        buffer.flushTo(messages);
        buffer.add("b", "2");
        buffer.flushTo(messages);

        assertThat(messages).hasSize(2);
        assertThat(messages.getJSONObject(0).getJSONArray("content")).hasSize(1);
        assertThat(messages.getJSONObject(1).getJSONArray("content").getJSONObject(0).getString("tool_use_id"))
                .isEqualTo("b");
    }
}
