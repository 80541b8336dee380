package com.initialone.jconstify.pipeline;

import com.initialone.jconstify.ast.RewriteValidator;
import com.initialone.jconstify.llm.RewriteClient;
import com.initialone.jconstify.model.RewriteOutcome;
import com.initialone.jconstify.model.RewriteRequest;
import com.initialone.jconstify.model.TaskResult;
import com.initialone.jconstify.scan.LiteralScanner;
import com.initialone.jconstify.util.CommitWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 单个文件的处理过程（一个 worker 从头做到尾）：
 * PENDING → SCANNING → CALLING ⇄ RETRYING → VALIDATING → COMMITTING → DONE | FAILED
 *
 * 所有错误都在这里收敛成一条 {@link TaskResult}，不会影响其它文件。
 */
class FileTask {
    private static final Logger log = LoggerFactory.getLogger(FileTask.class);

    enum State { PENDING, SCANNING, CALLING, RETRYING, VALIDATING, COMMITTING, DONE, FAILED }

    private final Path path;
    private final PipelineConfig cfg;
    private final RewriteClient client;
    private final LiteralScanner scanner;
    private final RewriteValidator validator;
    private final CommitWriter writer;
    private final Sleeper sleeper;

    private State state = State.PENDING;
    private int attempts;

    FileTask(Path path, PipelineConfig cfg, RewriteClient client, LiteralScanner scanner,
             RewriteValidator validator, CommitWriter writer, Sleeper sleeper) {
        this.path = path;
        this.cfg = cfg;
        this.client = client;
        this.scanner = scanner;
        this.validator = validator;
        this.writer = writer;
        this.sleeper = sleeper;
    }

    State state() { return state; }

    TaskResult run() {
        try {
            return process();
        } catch (RuntimeException e) {
            log.error("{} unexpected error in state {}", path, state, e);
            return fail("unexpected error: " + e);
        }
    }

    private TaskResult process() {
        moveTo(State.SCANNING);
        String src;
        try {
            src = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return fail("read failed: " + e);
        }
        if (!scanner.hasLiteral(src)) {
            moveTo(State.DONE);
            return TaskResult.skipped(path, "no literals outside comments");
        }

        RewriteRequest req = new RewriteRequest(path, src, cfg.model(), cfg.timeout());
        RetryPolicy retry = cfg.retryPolicy();
        RewriteOutcome outcome;
        while (true) {
            moveTo(State.CALLING);
            attempts++;
            outcome = client.rewrite(req);
            if (outcome == null) {
                outcome = RewriteOutcome.fatal("client returned no outcome");
            }
            if (!outcome.isTransient()) break;

            if (attempts >= retry.maxAttempts()) {
                return fail("gave up after " + attempts + " attempts: " + outcome.cause());
            }
            long delay = retry.delayAfter(attempts);
            moveTo(State.RETRYING);
            log.warn("{} attempt {}/{} failed: {}; backoff {}ms",
                    path, attempts, retry.maxAttempts(), outcome.cause(), delay);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return fail("interrupted while backing off");
            }
        }
        if (!outcome.isSuccess()) {
            return fail(outcome.cause());
        }

        String rewritten = outcome.text();
        if (cfg.validationPolicy() != ValidationPolicy.OFF) {
            moveTo(State.VALIDATING);
            List<String> problems = validator.validate(path, src, rewritten);
            if (!problems.isEmpty()) {
                String msg = String.join("; ", problems);
                if (cfg.validationPolicy() == ValidationPolicy.FAIL) {
                    return fail("validation failed: " + msg);
                }
                log.warn("{} accepted with warnings: {}", path, msg);
            }
        }

        moveTo(State.COMMITTING);
        try {
            Path target = writer.commit(path, rewritten, cfg.commitPolicy());
            moveTo(State.DONE);
            return TaskResult.written(path, target, attempts);
        } catch (IOException e) {
            return fail("commit failed: " + e);
        }
    }

    private TaskResult fail(String reason) {
        moveTo(State.FAILED);
        log.error("{} failed: {}", path, reason);
        return TaskResult.failed(path, reason, attempts);
    }

    private void moveTo(State next) {
        log.debug("{} {} -> {}", path, state, next);
        state = next;
    }
}
