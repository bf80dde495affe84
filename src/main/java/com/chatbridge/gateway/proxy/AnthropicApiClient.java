package com.chatbridge.gateway.proxy;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.chatbridge.gateway.config.AppProperties;
import com.chatbridge.gateway.exception.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

/**
 * Anthropic Messages API 客户端
 * <p>
 * 本层不做重试，失败统一抛出 {@link UpstreamException}
 */
@Component
public class AnthropicApiClient implements UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicApiClient.class);

    private static final String MESSAGES_PATH = "/v1/messages";

    private final HttpClient httpClient;
    private final AppProperties properties;

    public AnthropicApiClient(HttpClient upstreamHttpClient, AppProperties properties) {
        this.httpClient = upstreamHttpClient;
        this.properties = properties;
    }

    @Override
    public JSONObject complete(JSONObject request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(buildRequest(request, false), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("调用上游 API 异常: {}", endpoint(), e);
            throw new UpstreamException(502, "上游连接失败: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(502, "上游调用被中断", e);
        }

        if (response.statusCode() != 200) {
            log.warn("上游返回错误: status={}", response.statusCode());
            throw UpstreamException.fromResponseBody(response.statusCode(), response.body());
        }

        try {
            JSONObject body = JSON.parseObject(response.body());
            if (body == null) {
                throw new UpstreamException(502, UpstreamException.errorObject("api_error", "上游响应为空"));
            }
            return body;
        } catch (JSONException e) {
            throw new UpstreamException(502, "上游响应不是合法 JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public Flux<JSONObject> stream(JSONObject request) {
        return Flux.<JSONObject>create(sink -> readStream(request, sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void readStream(JSONObject request, FluxSink<JSONObject> sink) {
        try {
            HttpResponse<InputStream> response = httpClient.send(buildRequest(request, true),
                    HttpResponse.BodyHandlers.ofInputStream());

            if (response.statusCode() != 200) {
                String body;
                try (InputStream in = response.body()) {
                    body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
                log.warn("上游流式请求返回错误: status={}", response.statusCode());
                sink.error(UpstreamException.fromResponseBody(response.statusCode(), body));
                return;
            }

            SseEventParser parser = new SseEventParser(sink::next);
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
                String line;
                while (!sink.isCancelled() && (line = reader.readLine()) != null) {
                    parser.feedLine(line);
                }
            }
            if (!sink.isCancelled()) {
                parser.finish();
            }
            sink.complete();
        } catch (IOException e) {
            log.error("读取上游事件流失败: {}", endpoint(), e);
            sink.error(new UpstreamException(502, "上游连接失败: " + e.getMessage(), e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sink.error(new UpstreamException(502, "上游调用被中断", e));
        }
    }

    private HttpRequest buildRequest(JSONObject request, boolean stream) {
        JSONObject body = new JSONObject(request);
        body.put("stream", stream);

        AppProperties.UpstreamConfig upstream = properties.getUpstream();
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(endpoint()))
                .header("Content-Type", "application/json")
                .header("Accept", stream ? "text/event-stream" : "application/json")
                .header("anthropic-version", upstream.getAnthropicVersion())
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString(), StandardCharsets.UTF_8));
        if (upstream.getApiKey() != null && !upstream.getApiKey().isEmpty()) {
            builder.header("x-api-key", upstream.getApiKey());
        } else {
            log.warn("未配置上游 API Key");
        }
        return builder.build();
    }

    private String endpoint() {
        String baseUrl = properties.getUpstream().getBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + MESSAGES_PATH;
    }
}
