package com.initialone.jconstify.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;

/** 每个候选文件恰好一条处理结果；也用于 --report 输出。 */
public class TaskResult {

    public enum Status { SKIPPED, WRITTEN, FAILED }

    public String path;
    public Status status;
    /** FAILED 时的原因；其它情况可为空 */
    public String reason;
    /** 实际发出的改写请求次数 */
    public int attempts;
    /** 实际写入的文件（dry-run 时是 *.new） */
    public String target;

    public TaskResult() {}

    private TaskResult(Path path, Status status, String reason, int attempts, Path target) {
        this.path = path.toString();
        this.status = status;
        this.reason = reason;
        this.attempts = attempts;
        this.target = target == null ? null : target.toString();
    }

    public static TaskResult skipped(Path path, String reason) {
        return new TaskResult(path, Status.SKIPPED, reason, 0, null);
    }

    public static TaskResult written(Path path, Path target, int attempts) {
        return new TaskResult(path, Status.WRITTEN, null, attempts, target);
    }

    public static TaskResult failed(Path path, String reason, int attempts) {
        return new TaskResult(path, Status.FAILED, reason, attempts, null);
    }

    @JsonIgnore
    public boolean isFailed() { return status == Status.FAILED; }

    @Override
    public String toString() {
        String s = status + " " + path;
        if (reason != null) s += " (" + reason + ")";
        return s;
    }
}
