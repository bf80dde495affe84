package com.chatbridge.gateway.translator;

import lombok.Getter;

/**
 * 单条流的翻译状态
 * <p>
 * 由调用方持有并逐事件传入 {@link StreamTranslator}，一条流一个实例，不可跨流共享
 */
@Getter
public class StreamState {

    /**
     * 当前打开的内容块类型
     */
    public enum BlockKind {
        NONE, TEXT, THINKING, TOOL
    }

    private final String completionId;
    private final long created;
    private final String model;
    private final boolean includeThinking;

    private BlockKind openBlockKind = BlockKind.NONE;
    // 最近分配的 OpenAI tool_calls 槽位，-1 表示尚未出现工具调用
    private int toolSlotIndex = -1;
    private String toolInvocationId;
    private boolean initialChunkSent;
    private FinishReason finishReason;
    // 已输出 error chunk，流不再产生结束块
    private boolean terminated;
    private boolean finished;

    public StreamState(String completionId, long created, String model, boolean includeThinking) {
        this.completionId = completionId;
        this.created = created;
        this.model = model;
        this.includeThinking = includeThinking;
    }

    public static StreamState create(String model, boolean includeThinking) {
        return new StreamState(ChunkFactory.newCompletionId(), ChunkFactory.nowSeconds(), model, includeThinking);
    }

    /**
     * 结束块使用的 finish_reason，流中未报告时为 stop
     */
    public FinishReason effectiveFinishReason() {
        return finishReason != null ? finishReason : FinishReason.STOP;
    }

    void openBlock(BlockKind kind) {
        this.openBlockKind = kind;
    }

    void closeBlock() {
        this.openBlockKind = BlockKind.NONE;
        this.toolInvocationId = null;
    }

    int nextToolSlot(String invocationId) {
        this.toolSlotIndex++;
        this.toolInvocationId = invocationId;
        this.openBlockKind = BlockKind.TOOL;
        return toolSlotIndex;
    }

    void markInitialChunkSent() {
        this.initialChunkSent = true;
    }

    void recordFinishReason(FinishReason finishReason) {
        this.finishReason = finishReason;
    }

    void markTerminated() {
        this.terminated = true;
    }

    void markFinished() {
        this.finished = true;
    }
}
