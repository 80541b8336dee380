package com.initialone.jconstify.model;

/**
 * 单次改写调用的结果：成功 / 可重试失败 / 不可重试失败。
 * 客户端只负责分类，重试由流水线决定。
 */
public final class RewriteOutcome {

    public enum Kind { SUCCESS, TRANSIENT, FATAL }

    private final Kind kind;
    private final String text;
    private final String cause;
    private final int httpStatus;

    private RewriteOutcome(Kind kind, String text, String cause, int httpStatus) {
        this.kind = kind;
        this.text = text;
        this.cause = cause;
        this.httpStatus = httpStatus;
    }

    public static RewriteOutcome success(String text) {
        return new RewriteOutcome(Kind.SUCCESS, text, null, 200);
    }

    public static RewriteOutcome transientFailure(String cause) {
        return transientFailure(cause, -1);
    }

    public static RewriteOutcome transientFailure(String cause, int httpStatus) {
        return new RewriteOutcome(Kind.TRANSIENT, null, cause, httpStatus);
    }

    public static RewriteOutcome fatal(String cause) {
        return fatal(cause, -1);
    }

    public static RewriteOutcome fatal(String cause, int httpStatus) {
        return new RewriteOutcome(Kind.FATAL, null, cause, httpStatus);
    }

    public Kind kind() { return kind; }

    public boolean isSuccess() { return kind == Kind.SUCCESS; }

    public boolean isTransient() { return kind == Kind.TRANSIENT; }

    /** 仅 SUCCESS 时非空 */
    public String text() { return text; }

    public String cause() { return cause; }

    /** 没有 HTTP 响应（网络错误 / 超时）时为 -1 */
    public int httpStatus() { return httpStatus; }

    @Override
    public String toString() {
        return switch (kind) {
            case SUCCESS -> "SUCCESS(" + text.length() + " chars)";
            case TRANSIENT -> "TRANSIENT(" + cause + ")";
            case FATAL -> "FATAL(" + cause + ")";
        };
    }
}
