package com.initialone.jconstify.util;

import com.initialone.jconstify.model.CommitPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CommitWriterTest {

    private static final String ORIGINAL = "class A { String s = \"hi\"; }\n";
    private static final String REWRITTEN = "class A { static final String HI = \"hi\"; String s = HI; }\n";

    @TempDir
    Path dir;

    private final CommitWriter writer = new CommitWriter();

    private Path original() throws IOException {
        Path p = dir.resolve("A.java");
        Files.writeString(p, ORIGINAL);
        return p;
    }

    private List<String> listNames() throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Test
    @DisplayName("dry run writes a .new sibling and leaves the original untouched")
    void dryRun() throws IOException {
        Path p = original();
        Path target = writer.commit(p, REWRITTEN, CommitPolicy.DRY_RUN);

        assertEquals(dir.resolve("A.java.new"), target);
        assertEquals(REWRITTEN, Files.readString(target));
        assertEquals(ORIGINAL, Files.readString(p));
        assertEquals(List.of("A.java", "A.java.new"), listNames());
    }

    @Test
    @DisplayName("dry run .new file takes the original's permissions")
    void dryRunKeepsOriginalPermissions() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path p = original();
        Set<PosixFilePermission> perms = PosixFilePermissions.fromString("rw-r--r--");
        Files.setPosixFilePermissions(p, perms);

        Path target = writer.commit(p, REWRITTEN, CommitPolicy.DRY_RUN);

        assertEquals(perms, Files.getPosixFilePermissions(target));
    }

    @Test
    @DisplayName("overwrite replaces content and leaves no temp files")
    void overwrite() throws IOException {
        Path p = original();
        Path target = writer.commit(p, REWRITTEN, CommitPolicy.OVERWRITE);

        assertEquals(p, target);
        assertEquals(REWRITTEN, Files.readString(p));
        assertEquals(List.of("A.java"), listNames());
    }

    @Test
    @DisplayName("committing the same text twice is the same as committing once")
    void overwriteIsIdempotent() throws IOException {
        Path p = original();
        writer.commit(p, REWRITTEN, CommitPolicy.OVERWRITE);
        byte[] once = Files.readAllBytes(p);
        writer.commit(p, REWRITTEN, CommitPolicy.OVERWRITE);

        assertArrayEquals(once, Files.readAllBytes(p));
        assertEquals(List.of("A.java"), listNames());
    }

    @Test
    @DisplayName("backup copies the original to .bak before overwriting")
    void overwriteWithBackup() throws IOException {
        Path p = original();
        writer.commit(p, REWRITTEN, CommitPolicy.OVERWRITE_WITH_BACKUP);

        assertEquals(REWRITTEN, Files.readString(p));
        assertEquals(ORIGINAL, Files.readString(dir.resolve("A.java.bak")));
        assertEquals(List.of("A.java", "A.java.bak"), listNames());
    }

    @Test
    @DisplayName("failed backup aborts before touching the original")
    void backupFailureAborts() throws IOException {
        Path p = original();
        // 在 .bak 位置放一个非空目录，让备份复制失败
        Path blocker = Files.createDirectories(dir.resolve("A.java.bak"));
        Files.writeString(blocker.resolve("keep"), "x");

        assertThrows(IOException.class, () -> writer.commit(p, REWRITTEN, CommitPolicy.OVERWRITE_WITH_BACKUP));
        assertEquals(ORIGINAL, Files.readString(p));
        assertEquals(List.of("A.java", "A.java.bak"), listNames());
    }

    @Test
    @DisplayName("failure after temp write but before rename keeps the original intact")
    void crashBeforeRename() throws IOException {
        Path p = original();
        byte[] before = Files.readAllBytes(p);
        CommitWriter crashing = new CommitWriter() {
            @Override
            protected void moveIntoPlace(Path tmp, Path target) throws IOException {
                assertTrue(Files.exists(tmp), "temp file should be fully written before rename");
                assertEquals(REWRITTEN, Files.readString(tmp));
                throw new IOException("simulated crash before rename");
            }
        };

        IOException e = assertThrows(IOException.class,
                () -> crashing.commit(p, REWRITTEN, CommitPolicy.OVERWRITE));
        assertEquals("simulated crash before rename", e.getMessage());
        assertArrayEquals(before, Files.readAllBytes(p));
        assertEquals(List.of("A.java"), listNames(), "temp file must be cleaned up");
    }

    @Test
    @DisplayName("writes UTF-8 content verbatim")
    void utf8() throws IOException {
        Path p = original();
        String text = "class A { static final String GREETING = \"你好, ü\"; }\n";
        writer.commit(p, text, CommitPolicy.OVERWRITE);
        assertEquals(text, Files.readString(p));
    }
}
