package com.chatbridge.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "bridge")
public class AppProperties {

    private String apiKey = "sk-bridge-default";
    private boolean requireApiKey = false;
    // 目标协议要求 max_tokens 必填，OpenAI 请求未给出时使用
    private int defaultMaxTokens = 4096;
    private UpstreamConfig upstream = new UpstreamConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private ThinkingConfig thinking = new ThinkingConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class UpstreamConfig {
        private String baseUrl = "https://api.anthropic.com";
        private String apiKey = "";
        private String anthropicVersion = "2023-06-01";
        private int connectTimeoutSeconds = 30;
    }

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }

    @Data
    public static class ThinkingConfig {
        // 是否把 thinking 块以 <thinking> 标记拼入 OpenAI 正文
        private boolean includeInOutput = false;
        // 模型名匹配规则 → 推理预算，按顺序取第一条命中
        private List<ReasoningRule> rules = new ArrayList<>(List.of(
                new ReasoningRule("thinking", 10000),
                new ReasoningRule("gemini-3", 10000)
        ));
    }

    @Data
    public static class ReasoningRule {
        private String pattern;
        private int budgetTokens;

        public ReasoningRule() {
        }

        public ReasoningRule(String pattern, int budgetTokens) {
            this.pattern = pattern;
            this.budgetTokens = budgetTokens;
        }
    }
}
