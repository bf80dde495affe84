package com.chatbridge.gateway.controller;

import com.chatbridge.gateway.config.AppProperties;
import com.chatbridge.gateway.translator.ChunkFactory;
import com.chatbridge.gateway.translator.ErrorTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * API Key 验证过滤器
 * <p>
 * 对 /v1/ 开头的 API 请求验证 Authorization 头中的 Bearer token
 */
@Component
@Order(10)
public class ApiKeyFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);

    private final AppProperties properties;
    private final ErrorTranslator errorTranslator;

    public ApiKeyFilter(AppProperties properties, ErrorTranslator errorTranslator) {
        this.properties = properties;
        this.errorTranslator = errorTranslator;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        // 仅对 API 路径验证
        if (!path.startsWith("/v1/") || !properties.isRequireApiKey()) {
            return chain.filter(exchange);
        }

        String authHeader = exchange.getRequest().getHeaders().getFirst("Authorization");
        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            return unauthorized(exchange, "缺少 Authorization 头");
        }

        String apiKey = authHeader.substring(7).trim();
        if (apiKey.isEmpty()) {
            return unauthorized(exchange, "API Key 为空");
        }

        if (!apiKey.equals(properties.getApiKey())) {
            log.warn("无效的 API Key: {}***", apiKey.substring(0, Math.min(8, apiKey.length())));
            return unauthorized(exchange, "无效的 API Key");
        }

        return chain.filter(exchange);
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String body = ChunkFactory.toJson(errorTranslator.translate("authentication_error", message, 401));
        return exchange.getResponse().writeWith(
                Mono.just(exchange.getResponse().bufferFactory().wrap(body.getBytes(StandardCharsets.UTF_8)))
        );
    }
}
