package com.initialone.jconstify.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/** 一次改写请求：每个合格文件构造一次。 */
public final class RewriteRequest {
    private final Path path;
    private final String source;
    private final String model;
    private final Duration timeout;

    public RewriteRequest(Path path, String source, String model, Duration timeout) {
        this.path = Objects.requireNonNull(path, "path");
        this.source = Objects.requireNonNull(source, "source");
        this.model = model;
        this.timeout = timeout;
    }

    public Path path() { return path; }

    public String source() { return source; }

    public String model() { return model; }

    public Duration timeout() { return timeout; }

    @Override
    public String toString() {
        return "RewriteRequest{" + path + ", " + source.length() + " chars, model=" + model + "}";
    }
}
