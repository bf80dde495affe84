package com.chatbridge.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

/**
 * 连续 tool 消息的合并缓冲
 * <p>
 * 两个状态：IDLE / ACCUMULATING。任何非 tool 消息到来前以及消息遍历结束时 flush，
 * 缓冲的 tool_result 合并为一条合成 user 消息
 */
public class ToolResultBuffer {

    public enum State {
        IDLE, ACCUMULATING
    }

    private JSONArray pending = new JSONArray();

    public State state() {
        return pending.isEmpty() ? State.IDLE : State.ACCUMULATING;
    }

    public void add(String toolUseId, String content) {
        pending.add(JSONObject.of(
                "type", "tool_result", //
                "tool_use_id", toolUseId, //
                "content", content //
        ));
    }

    /**
     * 缓冲非空时追加一条 user 消息并回到 IDLE
     *
     * @return 是否追加了消息
     */
    public boolean flushTo(JSONArray messages) {
        if (state() == State.IDLE) {
            return false;
        }
        messages.add(JSONObject.of("role", "user", "content", pending));
        pending = new JSONArray();
        return true;
    }
}
