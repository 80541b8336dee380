package com.initialone.jconstify.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.initialone.jconstify.model.RewriteOutcome;
import com.initialone.jconstify.model.RewriteRequest;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Chat 接口客户端（OpenAI 兼容 / ollama）。
 *
 * 特点：
 * - 每次 rewrite() 只发一次请求，超时按请求设置（OkHttp callTimeout）
 * - 失败分类：网络异常 / 超时 / 5xx / 429 => TRANSIENT；其余 4xx、响应解析失败、空内容 => FATAL
 * - 内容外层的 ```java fenced``` 会被去掉
 * - 过滤不可打印控制字符，避免请求体 JSON 违法
 */
public class ChatCompletionsClient implements RewriteClient {
    private static final Logger log = LoggerFactory.getLogger(ChatCompletionsClient.class);
    private static final MediaType MEDIA_JSON = MediaType.parse("application/json");

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();

    private final String endpoint;
    private final String apiType;     // "openai" | "ollama"
    private final String apiKey;
    private final double temperature;
    private final int maxTokens;

    public ChatCompletionsClient(String endpoint, String apiType, String apiKey,
                                 double temperature, int maxTokens, Duration timeout) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint is missing");
        }
        this.endpoint = endpoint;
        this.apiType = (apiType == null || apiType.isBlank()) ? "openai" : apiType.toLowerCase();
        if (!this.apiType.equals("openai") && !this.apiType.equals("ollama")) {
            throw new IllegalArgumentException("Unsupported api: " + apiType);
        }
        this.apiKey = apiKey;
        this.temperature = temperature;
        this.maxTokens = Math.max(1, maxTokens);

        long timeoutMs = Math.max(1, timeout.toMillis());
        // 真正的每次尝试上限是 callTimeout；其余几项只是防止单个阶段卡死
        this.http = new OkHttpClient.Builder()
                .connectTimeout(Math.min(timeoutMs, 20_000), TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false) // 重试由流水线负责
                .build();
    }

    public static ChatCompletionsClient fromOptions(LlmOptions o) {
        Duration timeout = Duration.ofMillis((long) (o.timeoutSec * 1000));
        return new ChatCompletionsClient(o.endpoint, o.api, o.apiKey, o.temperature, o.maxTokens, timeout);
    }

    @Override
    public RewriteOutcome rewrite(RewriteRequest request) {
        Request req;
        try {
            req = buildRequest(request);
        } catch (JsonProcessingException e) {
            return RewriteOutcome.fatal("cannot encode request: " + e.getOriginalMessage());
        }

        Call call = http.newCall(req);
        if (request.timeout() != null && !request.timeout().isZero()) {
            call.timeout().timeout(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        }

        String body;
        int code;
        try (Response resp = call.execute()) {
            ResponseBody rb = resp.body();
            body = rb != null ? rb.string() : "";
            code = resp.code();
        } catch (InterruptedIOException e) {
            // OkHttp 的超时都是 InterruptedIOException
            return RewriteOutcome.transientFailure("timeout: " + e.getMessage());
        } catch (IOException e) {
            return RewriteOutcome.transientFailure("network error: " + e);
        }

        if (code < 200 || code >= 300) {
            String cause = "HTTP " + code + ": " + safeTrim(body);
            if (code == 429 || code >= 500) {
                return RewriteOutcome.transientFailure(cause, code);
            }
            return RewriteOutcome.fatal(cause, code);
        }

        String content;
        try {
            content = extractMessageContent(body);
        } catch (JsonProcessingException e) {
            return RewriteOutcome.fatal("unparseable response: " + safeTrim(body), code);
        }
        if (content == null) {
            return RewriteOutcome.fatal("unexpected response schema: " + safeTrim(body), code);
        }
        String rewritten = stripFence(content);
        if (rewritten.isBlank()) {
            return RewriteOutcome.fatal("empty content in response", code);
        }
        log.debug("{} rewritten: {} -> {} chars", request.path(), request.source().length(), rewritten.length());
        return RewriteOutcome.success(rewritten);
    }

    private Request buildRequest(RewriteRequest request) throws JsonProcessingException {
        Map<String, Object> sysMsg = Map.of(
                "role", "system",
                "content", PromptFactory.systemPrompt()
        );
        Map<String, Object> userMsg = Map.of(
                "role", "user",
                "content", sanitizeForJson(request.source())
        );

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", List.of(sysMsg, userMsg));
        if (apiType.equals("ollama")) {
            payload.put("options", Map.of("temperature", temperature));
            payload.put("stream", false);
        } else {
            payload.put("temperature", temperature);
            payload.put("max_tokens", maxTokens);
        }
        String json = om.writeValueAsString(payload);

        Request.Builder rb = new Request.Builder()
                .url(endpoint)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .post(RequestBody.create(json, MEDIA_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            rb.header("Authorization", "Bearer " + apiKey);
        }
        return rb.build();
    }

    /** choices[0].message.content（openai）或 message.content（ollama）；都没有返回 null */
    private String extractMessageContent(String body) throws JsonProcessingException {
        JsonNode root = om.readTree(body);
        if (root == null || !root.isObject()) return null;
        JsonNode x = root.path("choices").path(0).path("message").path("content");
        if (x.isTextual()) return x.asText();
        x = root.path("message").path("content");
        if (x.isTextual()) return x.asText();
        return null;
    }

    /** 去掉整体包裹的 ```java ... ```；内容中间的 ``` 不处理 */
    static String stripFence(String content) {
        String t = content.strip();
        if (!t.startsWith("```")) return content;
        int firstNl = t.indexOf('\n');
        int close = t.lastIndexOf("```");
        if (firstNl < 0 || close <= firstNl) return content;
        String inner = t.substring(firstNl + 1, close);
        return inner.endsWith("\n") ? inner : inner + "\n";
    }

    /** 错误信息截断，避免日志刷屏 */
    private static String safeTrim(String s) {
        s = (s == null ? "" : s.replaceAll("\\s+", " "));
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }

    /** 清理控制字符（保留 \n \r \t） */
    private static String sanitizeForJson(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int idx = 0; idx < s.length(); idx++) {
            char c = s.charAt(idx);
            if (c == '\n' || c == '\r' || c == '\t') {
                sb.append(c);
            } else if (c < 0x20) {
                sb.append(' ');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
