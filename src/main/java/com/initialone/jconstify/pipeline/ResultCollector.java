package com.initialone.jconstify.pipeline;

import com.initialone.jconstify.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 只追加的结果收集器，worker 之间唯一共享的可变状态。
 * 同一路径只接受一条结果。
 */
public class ResultCollector {
    private static final Logger log = LoggerFactory.getLogger(ResultCollector.class);

    private final ConcurrentLinkedQueue<TaskResult> results = new ConcurrentLinkedQueue<>();
    private final Set<Path> seen = ConcurrentHashMap.newKeySet();
    private final AtomicInteger failed = new AtomicInteger();
    private final Consumer<TaskResult> listener;

    /** listener 在追加后、于 worker 线程上回调（进度输出用） */
    public ResultCollector(Consumer<TaskResult> listener) {
        this.listener = listener == null ? r -> {} : listener;
    }

    /** 文件身份：规范化后的绝对路径，a/../B.java 与 B.java 视为同一文件 */
    public static Path identity(Path p) {
        return p.toAbsolutePath().normalize();
    }

    /** 重复路径返回 false 并丢弃 */
    public boolean add(TaskResult r) {
        if (!seen.add(identity(Path.of(r.path)))) {
            log.error("duplicate result for {} dropped: {}", r.path, r);
            return false;
        }
        results.add(r);
        if (r.isFailed()) failed.incrementAndGet();
        listener.accept(r);
        return true;
    }

    public boolean contains(Path path) {
        return seen.contains(identity(path));
    }

    public boolean hasFailures() { return failed.get() > 0; }

    public List<TaskResult> snapshot() {
        return new ArrayList<>(results);
    }
}
