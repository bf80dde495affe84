package com.chatbridge.gateway.translator;

import com.alibaba.fastjson2.JSONObject;
import com.chatbridge.gateway.exception.UpstreamException;
import com.chatbridge.gateway.translator.StreamState.BlockKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Anthropic SSE 事件 → OpenAI chat.completion.chunk
 * <p>
 * 单遍在线转换：每个入站事件产出零或多个 chunk，不缓存整条流、不回溯。
 * 本类不持有状态，流状态由调用方通过 {@link StreamState} 传入
 */
@Component
public class StreamTranslator {

    private static final Logger log = LoggerFactory.getLogger(StreamTranslator.class);

    static final String THINKING_OPEN = "<thinking>\n";
    static final String THINKING_CLOSE = "\n</thinking>\n";

    private final ErrorTranslator errorTranslator;

    public StreamTranslator(ErrorTranslator errorTranslator) {
        this.errorTranslator = errorTranslator;
    }

    /**
     * 将上游事件流转换为 OpenAI SSE 帧
     * <p>
     * 每次订阅使用新的 {@link StreamState}；正常结束时追加结束块和 [DONE]，
     * 遇到 error 事件或上游错误时输出 error chunk 后直接 [DONE]
     *
     * @param events          Anthropic 事件流
     * @param model           客户端请求的模型名
     * @param includeThinking 是否输出 thinking 内容
     * @return "data: ...\n\n" 帧序列
     */
    public Flux<String> translate(Flux<JSONObject> events, String model, boolean includeThinking) {
        return Flux.defer(() -> {
            StreamState state = StreamState.create(model, includeThinking);

            Flux<String> frames = events
                    .takeUntil(StreamTranslator::isErrorEvent)
                    .concatMapIterable(event -> onEvent(state, event))
                    .map(ChunkFactory::frame)
                    .onErrorResume(UpstreamException.class,
                            e -> Flux.just(ChunkFactory.frame(onUpstreamError(state, e))));

            Flux<String> tail = Flux.defer(() -> state.isTerminated()
                    ? Flux.just(ChunkFactory.DONE_FRAME)
                    : Flux.just(ChunkFactory.frame(finish(state)), ChunkFactory.DONE_FRAME));

            return frames.concatWith(tail);
        });
    }

    /**
     * 处理单个入站事件
     *
     * @return 本事件产出的 chunk，按输出顺序排列
     */
    public List<JSONObject> onEvent(StreamState state, JSONObject event) {
        if (state.isTerminated() || state.isFinished()) {
            log.debug("流已结束，忽略事件: {}", event.getString("type"));
            return Collections.emptyList();
        }

        String type = event.getString("type");
        if (type == null) {
            return Collections.emptyList();
        }

        return switch (type) {
            case "message_start" -> onMessageStart(state);
            case "content_block_start" -> onBlockStart(state, objectOrNull(event, "content_block"));
            case "content_block_delta" -> onBlockDelta(state, objectOrNull(event, "delta"));
            case "content_block_stop" -> onBlockStop(state);
            case "message_delta" -> onMessageDelta(state, objectOrNull(event, "delta"));
            case "error" -> onError(state, objectOrNull(event, "error"));
            // message_stop 由 finish() 输出结束块；ping 无对应
            default -> Collections.emptyList();
        };
    }

    /**
     * 输入耗尽后输出唯一的结束块
     */
    public JSONObject finish(StreamState state) {
        if (state.isFinished() || state.isTerminated()) {
            throw new IllegalStateException("结束块已输出: " + state.getCompletionId());
        }
        state.markFinished();
        return ChunkFactory.chunk(state, new JSONObject(), state.effectiveFinishReason().value());
    }

    // ==================== 事件处理 ====================

    private List<JSONObject> onMessageStart(StreamState state) {
        if (state.isInitialChunkSent()) {
            return Collections.emptyList();
        }
        state.markInitialChunkSent();
        return List.of(ChunkFactory.chunk(state, JSONObject.of("role", "assistant", "content", ""), null));
    }

    private List<JSONObject> onBlockStart(StreamState state, JSONObject block) {
        String blockType = block != null ? block.getString("type") : null;
        if ("thinking".equals(blockType)) {
            // 不输出 thinking 时也要记录状态，以便对应的 stop 同样被抑制
            state.openBlock(BlockKind.THINKING);
            return state.isIncludeThinking()
                    ? List.of(ChunkFactory.contentChunk(state, THINKING_OPEN))
                    : Collections.emptyList();
        }
        if ("tool_use".equals(blockType)) {
            int slot = state.nextToolSlot(block.getString("id"));
            JSONObject toolCall = JSONObject.of(
                    "index", slot, //
                    "id", block.getString("id"), //
                    "type", "function", //
                    "function", JSONObject.of("name", block.getString("name"), "arguments", "") //
            );
            return List.of(ChunkFactory.toolCallChunk(state, toolCall));
        }
        if ("text".equals(blockType)) {
            state.openBlock(BlockKind.TEXT);
        }
        return Collections.emptyList();
    }

    private List<JSONObject> onBlockDelta(StreamState state, JSONObject delta) {
        String deltaType = delta != null ? delta.getString("type") : null;
        if (deltaType == null) {
            return Collections.emptyList();
        }

        switch (deltaType) {
            case "thinking_delta" -> {
                if (state.isIncludeThinking() && state.getOpenBlockKind() == BlockKind.THINKING) {
                    return List.of(ChunkFactory.contentChunk(state, stringOrEmpty(delta.getString("thinking"))));
                }
            }
            case "text_delta" -> {
                return List.of(ChunkFactory.contentChunk(state, stringOrEmpty(delta.getString("text"))));
            }
            case "input_json_delta" -> {
                if (state.getToolSlotIndex() >= 0) {
                    // 续传片段不带 id / name，客户端据此追加到当前调用
                    JSONObject toolCall = JSONObject.of(
                            "index", state.getToolSlotIndex(), //
                            "function", JSONObject.of("arguments", stringOrEmpty(delta.getString("partial_json"))) //
                    );
                    return List.of(ChunkFactory.toolCallChunk(state, toolCall));
                }
            }
            // signature_delta 在 OpenAI 侧无对应
            default -> log.trace("忽略 delta 类型: {}", deltaType);
        }
        return Collections.emptyList();
    }

    private List<JSONObject> onBlockStop(StreamState state) {
        boolean closingThinking = state.getOpenBlockKind() == BlockKind.THINKING;
        state.closeBlock();
        if (closingThinking && state.isIncludeThinking()) {
            return List.of(ChunkFactory.contentChunk(state, THINKING_CLOSE));
        }
        return Collections.emptyList();
    }

    private List<JSONObject> onMessageDelta(StreamState state, JSONObject delta) {
        String stopReason = delta != null ? delta.getString("stop_reason") : null;
        if (stopReason != null) {
            state.recordFinishReason(FinishReason.fromStopReason(stopReason));
        }
        return Collections.emptyList();
    }

    private List<JSONObject> onError(StreamState state, JSONObject error) {
        String message = error != null && error.getString("message") != null
                ? error.getString("message")
                : "An error occurred";
        log.warn("上游流返回错误: {}", message);
        return List.of(errorChunk(state, JSONObject.of("message", message, "type", "api_error")));
    }

    private JSONObject onUpstreamError(StreamState state, UpstreamException e) {
        log.error("上游流异常: status={}, message={}", e.getStatusCode(), e.getMessage());
        JSONObject mapped = errorTranslator.translate(e.getErrorBody(), e.getStatusCode()).getJSONObject("error");
        return errorChunk(state, mapped);
    }

    private JSONObject errorChunk(StreamState state, JSONObject error) {
        state.markTerminated();
        JSONObject chunk = ChunkFactory.chunk(state, new JSONObject(), FinishReason.STOP.value());
        chunk.put("error", error);
        return chunk;
    }

    /**
     * 字段不是对象时返回 null，避免畸形事件打断整条流
     */
    private static JSONObject objectOrNull(JSONObject event, String key) {
        return event.get(key) instanceof Map ? event.getJSONObject(key) : null;
    }

    private static boolean isErrorEvent(JSONObject event) {
        return "error".equals(event.getString("type"));
    }

    private static String stringOrEmpty(String value) {
        return value != null ? value : "";
    }
}
