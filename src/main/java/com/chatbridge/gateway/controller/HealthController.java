package com.chatbridge.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.chatbridge.gateway.config.AppProperties;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查端点
 */
@RestController
public class HealthController {

    private final AppProperties properties;

    public HealthController(AppProperties properties) {
        this.properties = properties;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        JSONObject result = new JSONObject();
        result.put("status", "ok");
        result.put("version", "1.0.0");
        result.put("upstream", properties.getUpstream().getBaseUrl());
        return Mono.just(result.toJSONString());
    }
}
