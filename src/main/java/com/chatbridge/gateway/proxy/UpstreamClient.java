package com.chatbridge.gateway.proxy;

import com.alibaba.fastjson2.JSONObject;
import reactor.core.publisher.Flux;

/**
 * 上游 Anthropic Messages API 传输接口
 */
public interface UpstreamClient {

    /**
     * 非流式调用
     *
     * @param request Anthropic 请求体
     * @return 完整响应体
     * @throws com.chatbridge.gateway.exception.UpstreamException 上游返回非 200 或连接失败
     */
    JSONObject complete(JSONObject request);

    /**
     * 流式调用
     * <p>
     * 上游错误以 {@link com.chatbridge.gateway.exception.UpstreamException} 信号结束 Flux
     *
     * @param request Anthropic 请求体（stream=true）
     * @return 按到达顺序排列的 SSE 事件，每个事件含 type 字段
     */
    Flux<JSONObject> stream(JSONObject request);
}
