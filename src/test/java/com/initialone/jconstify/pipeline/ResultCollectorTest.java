package com.initialone.jconstify.pipeline;

import com.initialone.jconstify.model.TaskResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResultCollectorTest {

    @Mock
    private Consumer<TaskResult> listener;

    private ResultCollector collector;

    @BeforeEach
    void setUp() {
        collector = new ResultCollector(listener);
    }

    @Test
    @DisplayName("second result for the same file is dropped and not reported")
    void rejectsDuplicate() {
        Path a = Path.of("src", "A.java");
        TaskResult first = TaskResult.written(a, a, 1);

        assertTrue(collector.add(first));
        assertFalse(collector.add(TaskResult.failed(Path.of("src", "x", "..", "A.java"), "late", 2)));

        assertEquals(List.of(first), collector.snapshot());
        assertTrue(collector.contains(a.toAbsolutePath()));
        assertFalse(collector.hasFailures());
        verify(listener, times(1)).accept(first);
    }

    @Test
    @DisplayName("concurrent appends keep every distinct result exactly once")
    void concurrentAppends() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                Path p = Path.of("F" + (i % 100) + ".java");
                TaskResult r = (i % 2 == 0) ? TaskResult.skipped(p, "no literals outside comments")
                        : TaskResult.failed(p, "HTTP 400", 1);
                futures.add(pool.submit(() -> collector.add(r)));
            }
            int accepted = 0;
            for (Future<Boolean> f : futures) {
                if (f.get()) accepted++;
            }
            assertEquals(100, accepted);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100, collector.snapshot().size());
        verify(listener, times(100)).accept(any());
    }
}
