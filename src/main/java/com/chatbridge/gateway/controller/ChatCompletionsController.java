package com.chatbridge.gateway.controller;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.chatbridge.gateway.config.AppProperties;
import com.chatbridge.gateway.exception.MalformedRequestException;
import com.chatbridge.gateway.proxy.UpstreamClient;
import com.chatbridge.gateway.translator.ChunkFactory;
import com.chatbridge.gateway.translator.OpenAiRequestTranslator;
import com.chatbridge.gateway.translator.OpenAiResponseTranslator;
import com.chatbridge.gateway.translator.StreamTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;

/**
 * OpenAI 兼容 API 端点
 * <p>
 * POST /v1/chat/completions：流式 + 非流式，上游为 Anthropic Messages API
 */
@RestController
@RequestMapping("/v1")
public class ChatCompletionsController {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionsController.class);

    private final UpstreamClient upstreamClient;
    private final OpenAiRequestTranslator requestTranslator;
    private final OpenAiResponseTranslator responseTranslator;
    private final StreamTranslator streamTranslator;
    private final AppProperties properties;

    public ChatCompletionsController(UpstreamClient upstreamClient,
                                     OpenAiRequestTranslator requestTranslator,
                                     OpenAiResponseTranslator responseTranslator,
                                     StreamTranslator streamTranslator,
                                     AppProperties properties) {
        this.upstreamClient = upstreamClient;
        this.requestTranslator = requestTranslator;
        this.responseTranslator = responseTranslator;
        this.streamTranslator = streamTranslator;
        this.properties = properties;
    }

    /**
     * POST /v1/chat/completions
     */
    @PostMapping(value = "/chat/completions")
    public Mono<Void> chatCompletions(@RequestBody String body, ServerWebExchange exchange) {
        JSONObject request = parseBody(body);
        OpenAiRequestTranslator.TranslateResult translated = requestTranslator.translate(request);

        String model = request.getString("model");
        boolean includeThinking = properties.getThinking().isIncludeInOutput();
        if (!translated.ignoredFields().isEmpty()) {
            log.info("请求包含不支持的参数，已忽略: model={}, fields={}", model, translated.ignoredFields());
        }

        DataBufferFactory bufferFactory = exchange.getResponse().bufferFactory();

        if (translated.stream()) {
            exchange.getResponse().getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
            exchange.getResponse().getHeaders().setCacheControl("no-cache");
            exchange.getResponse().getHeaders().set("X-Accel-Buffering", "no");
            Flux<String> frames = streamTranslator.translate(upstreamClient.stream(translated.request()), model, includeThinking);
            return exchange.getResponse().writeAndFlushWith(
                    frames.map(s -> Mono.just(bufferFactory.wrap(s.getBytes(StandardCharsets.UTF_8))))
            );
        }

        // 非流式：直接写 JSON 字节，保留 null 字段
        return Mono.fromCallable(() -> {
                    JSONObject upstreamResponse = upstreamClient.complete(translated.request());
                    return ChunkFactory.toJson(responseTranslator.translate(upstreamResponse, model, includeThinking));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(json -> {
                    exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
                    exchange.getResponse().getHeaders().setContentLength(bytes.length);
                    DataBuffer buffer = bufferFactory.wrap(bytes);
                    return exchange.getResponse().writeWith(Mono.just(buffer));
                });
    }

    private JSONObject parseBody(String body) {
        JSONObject request;
        try {
            request = JSON.parseObject(body);
        } catch (JSONException e) {
            throw new MalformedRequestException("请求体不是合法 JSON: " + e.getMessage(), e);
        }
        if (request == null) {
            throw new MalformedRequestException("请求体不能为空");
        }
        return request;
    }
}
