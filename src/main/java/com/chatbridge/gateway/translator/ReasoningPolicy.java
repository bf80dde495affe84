package com.chatbridge.gateway.translator;

import com.chatbridge.gateway.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 按模型名决定是否开启扩展推理
 * <p>
 * 规则来自配置 bridge.thinking.rules，按顺序做子串匹配，第一条命中的规则给出预算
 */
@Component
public class ReasoningPolicy {

    private final List<AppProperties.ReasoningRule> rules;

    @Autowired
    public ReasoningPolicy(AppProperties properties) {
        this(properties.getThinking().getRules());
    }

    public ReasoningPolicy(List<AppProperties.ReasoningRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * @param model 客户端请求的模型名
     * @return 推理 token 预算，不开启时为空
     */
    public Optional<Integer> budgetFor(String model) {
        if (model == null || model.isEmpty()) {
            return Optional.empty();
        }
        for (AppProperties.ReasoningRule rule : rules) {
            if (rule.getPattern() != null && !rule.getPattern().isEmpty() && model.contains(rule.getPattern())) {
                return Optional.of(rule.getBudgetTokens());
            }
        }
        return Optional.empty();
    }
}
