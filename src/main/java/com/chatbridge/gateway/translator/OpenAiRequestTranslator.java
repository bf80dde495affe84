package com.chatbridge.gateway.translator;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.chatbridge.gateway.config.AppProperties;
import com.chatbridge.gateway.exception.MalformedRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OpenAI Chat Completions 请求 → Anthropic Messages 请求
 * <p>
 * 纯函数，无状态、无 I/O
 */
@Component
public class OpenAiRequestTranslator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiRequestTranslator.class);

    private static final Pattern DATA_URI = Pattern.compile("^data:([^;]+);base64,(.+)$");

    private final int defaultMaxTokens;
    private final ReasoningPolicy reasoningPolicy;

    public OpenAiRequestTranslator(AppProperties properties, ReasoningPolicy reasoningPolicy) {
        this.defaultMaxTokens = properties.getDefaultMaxTokens();
        this.reasoningPolicy = reasoningPolicy;
    }

    /**
     * 转换请求
     *
     * @param request OpenAI 请求体
     * @return 转换结果
     * @throws MalformedRequestException messages 缺失或不是数组等必填字段错误
     */
    public TranslateResult translate(JSONObject request) {
        if (request == null) {
            throw new MalformedRequestException("请求体不能为空");
        }
        if (!(request.get("messages") instanceof List)) {
            throw new MalformedRequestException("messages 必须是数组");
        }
        JSONArray messages = request.getJSONArray("messages");
        String model = request.getString("model");

        // 拆分 system 消息和其余消息，各自保持原有顺序
        List<String> systemTexts = new ArrayList<>();
        List<JSONObject> conversation = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            if (!(messages.get(i) instanceof Map)) {
                throw new MalformedRequestException("messages[" + i + "] 必须是对象");
            }
            JSONObject msg = messages.getJSONObject(i);
            String role = msg.getString("role");
            if ("system".equals(role) || "developer".equals(role)) {
                systemTexts.add(extractText(msg.get("content")));
            } else {
                conversation.add(msg);
            }
        }

        JSONObject result = new JSONObject();
        result.put("model", model);
        result.put("messages", convertMessages(conversation));
        result.put("max_tokens", resolveMaxTokens(request));
        result.put("stream", request.getBooleanValue("stream", false));

        String system = String.join("\n\n", systemTexts);
        if (!system.isEmpty()) {
            result.put("system", system);
        }

        if (request.get("temperature") instanceof Number temperature) {
            result.put("temperature", temperature);
        }
        if (request.get("top_p") instanceof Number topP) {
            result.put("top_p", topP);
        }
        JSONArray stopSequences = convertStop(request.get("stop"));
        if (stopSequences != null) {
            result.put("stop_sequences", stopSequences);
        }

        if (request.get("tools") instanceof List<?> tools && !tools.isEmpty()) {
            result.put("tools", convertTools(request.getJSONArray("tools")));
        }
        Object toolChoice = request.get("tool_choice");
        if (isTruthy(toolChoice)) {
            result.put("tool_choice", convertToolChoice(toolChoice));
        }

        reasoningPolicy.budgetFor(model).ifPresent(budget ->
                result.put("thinking", JSONObject.of("type", "enabled", "budget_tokens", budget)));

        return new TranslateResult(result, collectIgnoredFields(request));
    }

    // ==================== 消息转换 ====================

    private JSONArray convertMessages(List<JSONObject> conversation) {
        JSONArray result = new JSONArray();
        ToolResultBuffer toolResults = new ToolResultBuffer();

        for (JSONObject msg : conversation) {
            String role = msg.getString("role");

            if ("tool".equals(role)) {
                String toolCallId = msg.getString("tool_call_id");
                if (toolCallId == null || toolCallId.isEmpty()) {
                    throw new MalformedRequestException("tool 消息缺少 tool_call_id");
                }
                toolResults.add(toolCallId, extractText(msg.get("content")));
                continue;
            }

            // 非 tool 消息到来前先合并之前的 tool 结果
            toolResults.flushTo(result);

            if ("user".equals(role)) {
                result.add(JSONObject.of("role", "user", "content", convertUserContent(msg.get("content"))));
            } else if ("assistant".equals(role)) {
                result.add(JSONObject.of("role", "assistant", "content", convertAssistantContent(msg)));
            } else {
                log.debug("不支持的消息角色，已忽略: {}", role);
            }
        }

        toolResults.flushTo(result);
        return result;
    }

    private Object convertUserContent(Object content) {
        if (content == null) {
            return "";
        }
        if (content instanceof String s) {
            return s;
        }
        if (!(content instanceof List<?> parts)) {
            return String.valueOf(content);
        }

        JSONArray blocks = new JSONArray();
        for (Object raw : parts) {
            if (!(raw instanceof Map)) {
                continue;
            }
            JSONObject part = JSONObject.from(raw);
            String type = part.getString("type");
            if ("text".equals(type)) {
                blocks.add(JSONObject.of("type", "text", "text", part.getString("text")));
            } else if ("image_url".equals(type)) {
                JSONObject image = convertImage(part.get("image_url"));
                if (image != null) {
                    blocks.add(image);
                }
            } else {
                log.debug("不支持的内容类型，已忽略: {}", type);
            }
        }

        return collapseSingleText(blocks);
    }

    /**
     * data URI → base64 图片，其余 URL → url 图片；格式错误的 data URI 直接丢弃
     */
    private JSONObject convertImage(Object imageUrl) {
        String url = null;
        if (imageUrl instanceof String s) {
            url = s;
        } else if (imageUrl instanceof Map) {
            url = JSONObject.from(imageUrl).getString("url");
        }
        if (url == null || url.isEmpty()) {
            log.debug("image_url 缺少 url，已忽略");
            return null;
        }

        if (url.startsWith("data:")) {
            Matcher matcher = DATA_URI.matcher(url);
            if (!matcher.matches()) {
                log.debug("无法解析的 data URI，已忽略");
                return null;
            }
            return JSONObject.of(
                    "type", "image", //
                    "source", JSONObject.of("type", "base64", "media_type", matcher.group(1), "data", matcher.group(2)) //
            );
        }
        return JSONObject.of(
                "type", "image", //
                "source", JSONObject.of("type", "url", "url", url) //
        );
    }

    private Object convertAssistantContent(JSONObject msg) {
        JSONArray blocks = new JSONArray();

        String text = extractText(msg.get("content"));
        if (!text.isEmpty()) {
            blocks.add(JSONObject.of("type", "text", "text", text));
        }

        if (msg.get("tool_calls") instanceof List<?> toolCalls) {
            for (Object raw : toolCalls) {
                if (!(raw instanceof Map)) {
                    continue;
                }
                JSONObject toolCall = JSONObject.from(raw);
                String type = toolCall.getString("type");
                JSONObject function = toolCall.get("function") instanceof Map
                        ? toolCall.getJSONObject("function")
                        : null;
                if ((type != null && !"function".equals(type)) || function == null) {
                    log.debug("不支持的 tool_call 类型，已忽略: {}", type);
                    continue;
                }
                blocks.add(JSONObject.of(
                        "type", "tool_use", //
                        "id", toolCall.getString("id"), //
                        "name", function.getString("name"), //
                        "input", parseArguments(function.getString("arguments")) //
                ));
            }
        }

        if (blocks.isEmpty()) {
            return "";
        }
        return collapseSingleText(blocks);
    }

    /**
     * 解析 tool_call.arguments，非法 JSON 或非对象时返回空对象
     */
    JSONObject parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return new JSONObject();
        }
        try {
            Object parsed = JSON.parse(arguments);
            if (parsed instanceof JSONObject object) {
                return object;
            }
            log.warn("tool_call 参数不是 JSON 对象，使用空对象: {}", arguments);
        } catch (JSONException e) {
            log.warn("tool_call 参数解析失败，使用空对象: {}", e.getMessage());
        }
        return new JSONObject();
    }

    // ==================== 参数转换 ====================

    private int resolveMaxTokens(JSONObject request) {
        Integer maxCompletionTokens = positiveInt("max_completion_tokens", request.get("max_completion_tokens"));
        if (maxCompletionTokens != null) {
            return maxCompletionTokens;
        }
        Integer maxTokens = positiveInt("max_tokens", request.get("max_tokens"));
        return maxTokens != null ? maxTokens : defaultMaxTokens;
    }

    private JSONArray convertStop(Object stop) {
        if (stop instanceof String s && !s.isEmpty()) {
            return JSONArray.of(s);
        }
        if (stop instanceof List<?> list && !list.isEmpty()) {
            return new JSONArray(list);
        }
        return null;
    }

    private JSONArray convertTools(JSONArray tools) {
        JSONArray result = new JSONArray();
        for (int i = 0; i < tools.size(); i++) {
            if (!(tools.get(i) instanceof Map)) {
                throw new MalformedRequestException("tools[" + i + "] 必须是对象");
            }
            JSONObject tool = tools.getJSONObject(i);
            JSONObject function = tool.get("function") instanceof Map ? tool.getJSONObject("function") : null;

            String name;
            String description;
            JSONObject schema;
            if ("function".equals(tool.getString("type")) && function != null) {
                name = function.getString("name");
                description = function.getString("description");
                schema = objectOrNull(function.get("parameters"));
            } else {
                // 兼容扁平的旧式定义
                name = firstNonEmpty(tool.getString("name"), function != null ? function.getString("name") : null);
                description = firstNonEmpty(tool.getString("description"),
                        function != null ? function.getString("description") : null);
                schema = objectOrNull(tool.get("parameters"));
                if (schema == null && function != null) {
                    schema = objectOrNull(function.get("parameters"));
                }
            }

            if (name == null || name.isEmpty()) {
                throw new MalformedRequestException("tools[" + i + "] 缺少工具名");
            }
            result.add(JSONObject.of(
                    "name", name, //
                    "description", description != null ? description : "", //
                    "input_schema", schema != null ? schema : JSONObject.of("type", "object") //
            ));
        }
        return result;
    }

    private JSONObject convertToolChoice(Object toolChoice) {
        if (toolChoice instanceof String choice) {
            switch (choice) {
                case "auto", "none" -> {
                    return JSONObject.of("type", choice);
                }
                case "required" -> {
                    return JSONObject.of("type", "any");
                }
                default -> {
                    return JSONObject.of("type", "auto");
                }
            }
        }
        if (toolChoice instanceof Map) {
            JSONObject choice = JSONObject.from(toolChoice);
            JSONObject function = choice.get("function") instanceof Map ? choice.getJSONObject("function") : null;
            if ("function".equals(choice.getString("type")) && function != null && function.getString("name") != null) {
                return JSONObject.of("type", "tool", "name", function.getString("name"));
            }
        }
        return JSONObject.of("type", "auto");
    }

    /**
     * 记录无法映射的参数，每个字段一条诊断日志
     */
    private List<String> collectIgnoredFields(JSONObject request) {
        List<String> ignored = new ArrayList<>();
        if (request.get("n") instanceof Number n && n.intValue() > 1) {
            log.debug("n > 1 不支持，按 n=1 处理");
            ignored.add("n");
        }
        if (isTruthy(request.get("logprobs")) || isTruthy(request.get("top_logprobs"))) {
            log.debug("logprobs 不支持，已忽略");
            ignored.add("logprobs");
        }
        if (isTruthy(request.get("frequency_penalty"))) {
            log.debug("frequency_penalty 不支持，已忽略");
            ignored.add("frequency_penalty");
        }
        if (isTruthy(request.get("presence_penalty"))) {
            log.debug("presence_penalty 不支持，已忽略");
            ignored.add("presence_penalty");
        }
        if (isTruthy(request.get("response_format"))) {
            log.debug("response_format 不支持，已忽略");
            ignored.add("response_format");
        }
        return Collections.unmodifiableList(ignored);
    }

    // ==================== 辅助方法 ====================

    /**
     * 提取文本：字符串原样返回，数组拼接其中的 text 部分
     */
    static String extractText(Object content) {
        if (content == null) {
            return "";
        }
        if (content instanceof String s) {
            return s;
        }
        if (content instanceof List<?> parts) {
            StringBuilder sb = new StringBuilder();
            for (Object raw : parts) {
                if (raw instanceof Map) {
                    JSONObject part = JSONObject.from(raw);
                    if ("text".equals(part.getString("type")) && part.getString("text") != null) {
                        sb.append(part.getString("text"));
                    }
                }
            }
            return sb.toString();
        }
        return String.valueOf(content);
    }

    private static Object collapseSingleText(JSONArray blocks) {
        if (blocks.size() == 1 && "text".equals(blocks.getJSONObject(0).getString("type"))) {
            return blocks.getJSONObject(0).getString("text");
        }
        return blocks;
    }

    private static Integer positiveInt(String field, Object value) {
        if (!(value instanceof Number n) || n.longValue() <= 0) {
            return null;
        }
        if (n.longValue() > Integer.MAX_VALUE) {
            throw new MalformedRequestException(field + " 超出范围: " + n);
        }
        return n.intValue();
    }

    private static JSONObject objectOrNull(Object value) {
        return value instanceof Map ? JSONObject.from(value) : null;
    }

    private static String firstNonEmpty(String first, String second) {
        return first != null && !first.isEmpty() ? first : second;
    }

    private static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    /**
     * 转换结果
     *
     * @param request       Anthropic 请求体
     * @param ignoredFields 无法映射、已被忽略的 OpenAI 字段
     */
    public record TranslateResult(JSONObject request, List<String> ignoredFields) {

        public boolean stream() {
            return request.getBooleanValue("stream", false);
        }
    }
}
