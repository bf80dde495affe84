package com.chatbridge.gateway;

import com.chatbridge.gateway.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
public class ChatBridgeApplication {

    private static final Logger log = LoggerFactory.getLogger(ChatBridgeApplication.class);

    private final AppProperties properties;

    public ChatBridgeApplication(AppProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(ChatBridgeApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║           Chat Bridge Gateway v1.0.0              ║");
        log.info("║     OpenAI Compatible → Anthropic Messages        ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("上游地址: {}", properties.getUpstream().getBaseUrl());
        log.info("API 端点:");
        log.info("  POST /v1/chat/completions  (OpenAI)");
        log.info("  GET  /health");
    }
}
