package com.initialone.jconstify.pipeline;

import com.initialone.jconstify.ast.RewriteValidator;
import com.initialone.jconstify.llm.RewriteClient;
import com.initialone.jconstify.model.TaskResult;
import com.initialone.jconstify.scan.LiteralScanner;
import com.initialone.jconstify.util.CommitWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 固定大小的 worker 池：每个文件一个 {@link FileTask}，从线程池的 FIFO 队列里取。
 *
 * 保证：
 * - 每个输入文件恰好一条结果（成功 / 跳过 / 失败）
 * - 单个文件失败不影响其它文件
 * - run() 在所有文件都有结果后才返回
 *
 * {@link #requestStop()} 只拦截尚未开始的文件（记为失败），正在处理的文件照常完成或超时。
 */
public class FileTaskPipeline {
    private static final Logger log = LoggerFactory.getLogger(FileTaskPipeline.class);

    private final PipelineConfig cfg;
    private final RewriteClient client;
    private final LiteralScanner scanner;
    private final RewriteValidator validator;
    private final CommitWriter writer;
    private final Sleeper sleeper;

    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public FileTaskPipeline(PipelineConfig cfg, RewriteClient client) {
        this(cfg, client, new LiteralScanner(), new RewriteValidator(), new CommitWriter(), Sleeper.SYSTEM);
    }

    public FileTaskPipeline(PipelineConfig cfg, RewriteClient client, LiteralScanner scanner,
                            RewriteValidator validator, CommitWriter writer, Sleeper sleeper) {
        this.cfg = cfg;
        this.client = client;
        this.scanner = scanner;
        this.validator = validator;
        this.writer = writer;
        this.sleeper = sleeper;
    }

    public List<TaskResult> run(List<Path> files) {
        return run(files, r -> {});
    }

    public List<TaskResult> run(List<Path> candidates, Consumer<TaskResult> onResult) {
        // 同一文件只处理一次：按规范化的绝对路径去重，保留第一次出现的写法
        Map<Path, Path> unique = new LinkedHashMap<>();
        for (Path p : candidates) unique.putIfAbsent(ResultCollector.identity(p), p);
        List<Path> files = new ArrayList<>(unique.values());
        if (files.size() != candidates.size()) {
            log.warn("ignored {} duplicate paths", candidates.size() - files.size());
        }
        ResultCollector collector = new ResultCollector(onResult);
        log.info("processing {} files with {} workers ({})", files.size(), cfg.workers(), cfg);

        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "jconstify-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService pool = Executors.newFixedThreadPool(cfg.workers(), tf);
        try {
            Map<Path, Future<?>> futures = new LinkedHashMap<>();
            for (Path p : files) {
                futures.put(p, pool.submit(() -> collector.add(runOne(p))));
            }
            boolean interrupted = false;
            for (Map.Entry<Path, Future<?>> e : futures.entrySet()) {
                while (true) {
                    try {
                        e.getValue().get();
                        break;
                    } catch (InterruptedException ie) {
                        // 不强杀正在进行的请求，只是不再派发新文件
                        interrupted = true;
                        requestStop();
                    } catch (ExecutionException ee) {
                        String key = e.getKey().toString();
                        if (!collector.contains(e.getKey())) {
                            collector.add(TaskResult.failed(e.getKey(), "worker crashed: " + ee.getCause(), 0));
                        } else {
                            log.error("{} listener failed", key, ee.getCause());
                        }
                        break;
                    }
                }
            }
            if (interrupted) Thread.currentThread().interrupt();
        } finally {
            pool.shutdown();
        }

        List<TaskResult> results = collector.snapshot();
        log.info("done: {} results, failures={}", results.size(), collector.hasFailures());
        return results;
    }

    private TaskResult runOne(Path p) {
        if (stopping.get()) {
            return TaskResult.failed(p, "cancelled before dispatch", 0);
        }
        return new FileTask(p, cfg, client, scanner, validator, writer, sleeper).run();
    }

    /** 之后出队的文件不再处理 */
    public void requestStop() {
        if (stopping.compareAndSet(false, true)) {
            log.warn("stop requested; pending files will be marked as cancelled");
        }
    }

    /** 退出码：有任何失败就非零 */
    public static int exitCode(List<TaskResult> results) {
        return results.stream().anyMatch(TaskResult::isFailed) ? 1 : 0;
    }
}
