package com.chatbridge.gateway.translator;

import java.util.Map;

/**
 * OpenAI finish_reason
 * <p>
 * 由 Anthropic stop_reason 固定查表得到，未知值一律视为 stop
 */
public enum FinishReason {

    STOP("stop"),
    LENGTH("length"),
    TOOL_CALLS("tool_calls");

    private static final Map<String, FinishReason> STOP_REASON_MAP = Map.of(
            "end_turn", STOP,
            "stop_sequence", STOP,
            "max_tokens", LENGTH,
            "tool_use", TOOL_CALLS
    );

    private final String value;

    FinishReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static FinishReason fromStopReason(String stopReason) {
        if (stopReason == null) {
            return STOP;
        }
        return STOP_REASON_MAP.getOrDefault(stopReason, STOP);
    }
}
