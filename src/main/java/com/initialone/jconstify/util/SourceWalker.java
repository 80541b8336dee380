package com.initialone.jconstify.util;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * 收集 root 下待处理的源文件。
 * - 按扩展名过滤（默认 .java）
 * - 路径中任一段在排除列表里就跳过（.git / target / build / .idea）
 * - 本工具自己产生的 *.new / *.bak / *.tmp 不算
 */
public class SourceWalker {
    public static final List<String> DEFAULT_EXCLUDES = List.of(".git", "target", "build", ".idea");

    private final Set<String> excludes;
    private final List<String> extensions;

    public SourceWalker(Collection<String> excludes, Collection<String> extensions) {
        this.excludes = new HashSet<>(excludes == null ? DEFAULT_EXCLUDES : excludes);
        this.extensions = (extensions == null || extensions.isEmpty())
                ? List.of(".java") : List.copyOf(extensions);
    }

    /** 结果按路径排序；root 不是目录时抛 NoSuchFileException */
    public List<Path> walk(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NoSuchFileException(root.toAbsolutePath().toString(), null, "not a directory");
        }
        List<Path> out = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && excludes.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && accept(file)) out.add(file);
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(out);
        return out;
    }

    private boolean accept(Path file) {
        String name = file.getFileName().toString();
        if (excludes.contains(name)) return false;
        if (name.endsWith(CommitWriter.DRY_RUN_SUFFIX)
                || name.endsWith(CommitWriter.BACKUP_SUFFIX)
                || name.endsWith(CommitWriter.TEMP_SUFFIX)) {
            return false;
        }
        for (String ext : extensions) {
            if (name.endsWith(ext)) return true;
        }
        return false;
    }
}
