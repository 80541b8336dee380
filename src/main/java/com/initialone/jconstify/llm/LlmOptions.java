package com.initialone.jconstify.llm;

import picocli.CommandLine;

// 与命令类共用的 LLM 选项（@Mixin）
public class LlmOptions {

    @CommandLine.Option(names = "--endpoint",
            defaultValue = "http://localhost:8000/v1/chat/completions",
            description = "Full URL of the chat endpoint (default: ${DEFAULT-VALUE})")
    public String endpoint;

    @CommandLine.Option(names = "--api", defaultValue = "openai",
            description = "Request format: openai | ollama (default: ${DEFAULT-VALUE})")
    public String api;

    @CommandLine.Option(names = "--model", defaultValue = "gpt-4",
            description = "Model name (default: ${DEFAULT-VALUE})")
    public String model;

    @CommandLine.Option(names = "--api-key", defaultValue = "${env:API_KEY}",
            description = "Bearer token for the LLM API (default: $API_KEY)")
    public String apiKey; // 不配置则不发 Authorization

    @CommandLine.Option(names = "--timeout", defaultValue = "300",
            description = "Per-request timeout in seconds (default: ${DEFAULT-VALUE})")
    public double timeoutSec;

    @CommandLine.Option(names = "--temperature", defaultValue = "0.0",
            description = "Sampling temperature (default: ${DEFAULT-VALUE})")
    public double temperature;

    @CommandLine.Option(names = "--max-tokens", defaultValue = "4096",
            description = "max_tokens sent with each request (default: ${DEFAULT-VALUE})")
    public int maxTokens;
}
