package com.chatbridge.gateway.proxy;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Anthropic SSE 文本流解析器
 * <p>
 * 逐行输入 event: / data: 字段，空行结束一个事件：
 * - data 可跨多行，按换行拼接
 * - data 中缺少 type 时使用 event 字段补齐
 * - 注释行（: 开头）和无法解析的 data 跳过
 */
public class SseEventParser {

    private static final Logger log = LoggerFactory.getLogger(SseEventParser.class);

    private final Consumer<JSONObject> listener;

    private final StringBuilder dataBuffer = new StringBuilder();
    private String eventName;

    public SseEventParser(Consumer<JSONObject> listener) {
        this.listener = listener;
    }

    /**
     * 输入一行（不含换行符）
     */
    public void feedLine(String line) {
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }

        if (line.isEmpty()) {
            dispatch();
            return;
        }
        if (line.startsWith(":")) {
            return;
        }

        int colon = line.indexOf(':');
        String field = colon >= 0 ? line.substring(0, colon) : line;
        String value = colon >= 0 ? line.substring(colon + 1) : "";
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }

        switch (field) {
            case "event" -> eventName = value;
            case "data" -> {
                if (!dataBuffer.isEmpty()) {
                    dataBuffer.append('\n');
                }
                dataBuffer.append(value);
            }
            default -> log.trace("忽略 SSE 字段: {}", field);
        }
    }

    /**
     * 流结束时处理末尾未以空行结束的事件
     */
    public void finish() {
        dispatch();
    }

    private void dispatch() {
        String data = dataBuffer.toString();
        String name = eventName;
        dataBuffer.setLength(0);
        eventName = null;

        if (data.isEmpty()) {
            return;
        }

        JSONObject event;
        try {
            event = JSON.parseObject(data);
        } catch (JSONException e) {
            log.warn("解析 SSE 事件失败: event={}, error={}", name, e.getMessage());
            return;
        }
        if (event == null) {
            return;
        }
        if (event.getString("type") == null && name != null) {
            event.put("type", name);
        }
        listener.accept(event);
    }
}
