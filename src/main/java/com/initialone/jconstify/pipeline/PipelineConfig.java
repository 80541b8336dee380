package com.initialone.jconstify.pipeline;

import com.initialone.jconstify.model.CommitPolicy;

import java.time.Duration;

/** 启动后只读的运行配置，worker 间无锁共享。 */
public final class PipelineConfig {
    private final int workers;
    private final String model;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final CommitPolicy commitPolicy;
    private final ValidationPolicy validationPolicy;

    private PipelineConfig(Builder b) {
        this.workers = Math.max(1, b.workers);
        this.model = b.model;
        this.timeout = b.timeout;
        this.retryPolicy = b.retryPolicy;
        this.commitPolicy = b.commitPolicy;
        this.validationPolicy = b.validationPolicy;
    }

    public static Builder builder() { return new Builder(); }

    public int workers() { return workers; }

    public String model() { return model; }

    public Duration timeout() { return timeout; }

    public RetryPolicy retryPolicy() { return retryPolicy; }

    public CommitPolicy commitPolicy() { return commitPolicy; }

    public ValidationPolicy validationPolicy() { return validationPolicy; }

    @Override
    public String toString() {
        return "PipelineConfig{workers=" + workers + ", model=" + model + ", timeout=" + timeout
                + ", " + retryPolicy + ", commit=" + commitPolicy + ", validate=" + validationPolicy + "}";
    }

    public static final class Builder {
        private int workers = 4;
        private String model = "gpt-4";
        private Duration timeout = Duration.ofSeconds(300);
        private RetryPolicy retryPolicy = new RetryPolicy(3, 1000, 60_000);
        private CommitPolicy commitPolicy = CommitPolicy.OVERWRITE;
        private ValidationPolicy validationPolicy = ValidationPolicy.WARN;

        public Builder workers(int workers) { this.workers = workers; return this; }

        public Builder model(String model) { this.model = model; return this; }

        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }

        public Builder retryPolicy(RetryPolicy retryPolicy) { this.retryPolicy = retryPolicy; return this; }

        public Builder commitPolicy(CommitPolicy commitPolicy) { this.commitPolicy = commitPolicy; return this; }

        public Builder validationPolicy(ValidationPolicy policy) { this.validationPolicy = policy; return this; }

        public PipelineConfig build() { return new PipelineConfig(this); }
    }
}
