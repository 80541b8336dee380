package com.initialone.jconstify.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.initialone.jconstify.llm.ChatCompletionsClient;
import com.initialone.jconstify.llm.LlmOptions;
import com.initialone.jconstify.model.CommitPolicy;
import com.initialone.jconstify.model.TaskResult;
import com.initialone.jconstify.pipeline.FileTaskPipeline;
import com.initialone.jconstify.pipeline.PipelineConfig;
import com.initialone.jconstify.pipeline.RetryPolicy;
import com.initialone.jconstify.pipeline.ValidationPolicy;
import com.initialone.jconstify.util.SourceWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 主流程：收集文件 → 字面量检查 → 并发请求 LLM（带重试）→ 按策略落盘。
 *
 * 用法：
 *   java -jar jconstify.jar refactor --root src/main/java \
 *     --endpoint http://localhost:8000/v1/chat/completions --model gpt-4 \
 *     --workers 4 --retries 3 --backoff 1.0 --backup
 */
@CommandLine.Command(
        name = "refactor",
        description = "Refactor string literals into constants via an LLM, file by file, in parallel"
)
public class RefactorCmd implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RefactorCmd.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    LlmOptions llm;

    @CommandLine.Option(names = "--root", required = true, description = "Codebase root")
    Path root;

    @CommandLine.Option(names = "--exclude", split = ",",
            defaultValue = ".git,target,build,.idea",
            description = "Directory names to skip (default: ${DEFAULT-VALUE})")
    List<String> excludes;

    @CommandLine.Option(names = "--extensions", split = ",", defaultValue = ".java",
            description = "Comma-separated file extensions to process (default: ${DEFAULT-VALUE})")
    List<String> exts;

    @CommandLine.Option(names = "--dry-run",
            description = "Do not overwrite originals; write <file>.new instead")
    boolean dryRun;

    @CommandLine.Option(names = "--backup",
            description = "When not dry-run, back up originals as <file>.bak")
    boolean backup;

    @CommandLine.Option(names = "--workers", defaultValue = "4",
            description = "Number of parallel workers (default: ${DEFAULT-VALUE})")
    int workers;

    @CommandLine.Option(names = "--retries", defaultValue = "3",
            description = "Total attempts per file on transient errors (default: ${DEFAULT-VALUE})")
    int retries;

    @CommandLine.Option(names = "--backoff", defaultValue = "1.0",
            description = "Initial retry backoff in seconds, doubled per attempt (default: ${DEFAULT-VALUE})")
    double backoffSec;

    @CommandLine.Option(names = "--max-backoff", defaultValue = "60",
            description = "Upper bound for a single backoff in seconds (default: ${DEFAULT-VALUE})")
    double maxBackoffSec;

    @CommandLine.Option(names = "--validate", defaultValue = "WARN",
            description = "Check rewritten output: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    ValidationPolicy validation;

    @CommandLine.Option(names = "--report", description = "Write per-file results as JSON to this file")
    Path report;

    @Override
    public Integer call() throws Exception {
        if (!Files.isDirectory(root)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "root is not a directory: " + root.toAbsolutePath());
        }
        if (workers < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--workers must be >= 1");
        }
        if (retries < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--retries must be >= 1");
        }
        if (!(llm.timeoutSec > 0)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--timeout must be > 0");
        }

        ChatCompletionsClient client;
        try {
            client = ChatCompletionsClient.fromOptions(llm);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        PrintWriter out = spec.commandLine().getOut();
        List<Path> files = new SourceWalker(excludes, exts).walk(root);
        log.info("Found {} files under {}", files.size(), root);

        PipelineConfig cfg = PipelineConfig.builder()
                .workers(workers)
                .model(llm.model)
                .timeout(Duration.ofMillis((long) (llm.timeoutSec * 1000)))
                .retryPolicy(RetryPolicy.ofSeconds(retries, backoffSec, maxBackoffSec))
                .commitPolicy(CommitPolicy.of(dryRun, backup))
                .validationPolicy(validation)
                .build();
        FileTaskPipeline pipeline = new FileTaskPipeline(cfg, client);

        // Ctrl-C：不再派发新文件，等正在处理的文件完成、汇总和报告写完（最多一个请求超时）
        CountDownLatch reported = new CountDownLatch(1);
        Thread hook = shutdownHook(pipeline, reported, (long) (llm.timeoutSec * 1000) + 5_000);
        Runtime.getRuntime().addShutdownHook(hook);

        List<TaskResult> results;
        AtomicInteger done = new AtomicInteger();
        try {
            results = pipeline.run(files, r -> {
                synchronized (out) {
                    out.printf("[refactor] %d/%d %s %s%n", done.incrementAndGet(), files.size(), r.status, r.path);
                    out.flush();
                }
            });
            printSummary(out, results);
            if (report != null) writeReport(results);
        } finally {
            reported.countDown();
            removeHook(hook);
        }

        return FileTaskPipeline.exitCode(results);
    }

    private void printSummary(PrintWriter out, List<TaskResult> results) {
        Map<TaskResult.Status, Integer> counts = new EnumMap<>(TaskResult.Status.class);
        for (TaskResult.Status s : TaskResult.Status.values()) counts.put(s, 0);
        results.forEach(r -> counts.merge(r.status, 1, Integer::sum));

        out.printf("[refactor] DONE. written=%d, skipped=%d, failed=%d%s%n",
                counts.get(TaskResult.Status.WRITTEN),
                counts.get(TaskResult.Status.SKIPPED),
                counts.get(TaskResult.Status.FAILED),
                dryRun ? " (dry-run)" : "");
        for (TaskResult r : results) {
            if (r.isFailed()) out.printf("[refactor]   FAILED %s: %s%n", r.path, r.reason);
        }
        out.flush();
    }

    private void writeReport(List<TaskResult> results) throws IOException {
        Path parent = report.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        om.writeValue(report.toFile(), results);
        log.info("report -> {}", report);
    }

    /** 钩子线程：请求停止后阻塞到 reported 计数归零或超时 */
    static Thread shutdownHook(FileTaskPipeline pipeline, CountDownLatch reported, long graceMs) {
        return new Thread(() -> {
            pipeline.requestStop();
            try {
                if (!reported.await(graceMs, TimeUnit.MILLISECONDS)) {
                    log.warn("gave up waiting for in-flight files after {} ms", graceMs);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "jconstify-shutdown");
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM 已在退出，钩子会自己跑完
            log.debug("shutdown in progress, hook stays registered");
        }
    }
}
