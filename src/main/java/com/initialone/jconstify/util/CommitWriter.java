package com.initialone.jconstify.util;

import com.initialone.jconstify.model.CommitPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 改写结果落盘。
 *
 * 所有写入都是「同目录临时文件 + rename」，从不原地截断重写：
 * 任何一步失败时，目标文件要么是原内容，要么是完整的新内容。
 * 备份失败时直接放弃，不碰原文件。
 */
public class CommitWriter {
    private static final Logger log = LoggerFactory.getLogger(CommitWriter.class);

    public static final String DRY_RUN_SUFFIX = ".new";
    public static final String BACKUP_SUFFIX = ".bak";
    public static final String TEMP_SUFFIX = ".tmp";

    /** 返回实际写入的路径（dry-run 时是 *.new） */
    public Path commit(Path original, String text, CommitPolicy policy) throws IOException {
        return switch (policy) {
            case DRY_RUN -> {
                Path out = sibling(original, DRY_RUN_SUFFIX);
                writeAtomically(out, text, original);
                log.info("[DRY RUN] wrote {}", out);
                yield out;
            }
            case OVERWRITE -> {
                writeAtomically(original, text, original);
                log.info("Wrote {}", original);
                yield original;
            }
            case OVERWRITE_WITH_BACKUP -> {
                Path bak = backup(original);
                log.info("Backed up {} -> {}", original, bak);
                writeAtomically(original, text, original);
                log.info("Wrote {}", original);
                yield original;
            }
        };
    }

    public static Path sibling(Path p, String suffix) {
        return p.resolveSibling(p.getFileName().toString() + suffix);
    }

    protected Path backup(Path original) throws IOException {
        Path bak = sibling(original, BACKUP_SUFFIX);
        Files.copy(original, bak, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return bak;
    }

    /** permsFrom：新文件沿用其权限（dry-run 时是原文件，而不是尚不存在的 *.new） */
    protected void writeAtomically(Path target, String text, Path permsFrom) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, target.getFileName().toString() + ".", TEMP_SUFFIX);
        try {
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            keepPermissions(permsFrom, tmp);
            moveIntoPlace(tmp, target);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /** 临时文件默认 0600，替换前沿用原文件权限 */
    private static void keepPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from)) return;
        try {
            Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
        } catch (UnsupportedOperationException e) {
            log.debug("no POSIX permissions on {}, keeping defaults", to);
        }
    }

    protected void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
