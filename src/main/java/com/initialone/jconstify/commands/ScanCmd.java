package com.initialone.jconstify.commands;

import com.initialone.jconstify.scan.LiteralScanner;
import com.initialone.jconstify.util.SourceWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 只扫描不改写：列出注释之外含有字面量的文件及字面量个数。
 * 不发请求，不写文件。
 */
@CommandLine.Command(
        name = "scan",
        description = "List files that contain string/char literals outside comments (no LLM calls, no writes)"
)
public class ScanCmd implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ScanCmd.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--root", required = true, description = "Codebase root")
    Path root;

    @CommandLine.Option(names = "--exclude", split = ",",
            defaultValue = ".git,target,build,.idea",
            description = "Directory names to skip (default: ${DEFAULT-VALUE})")
    List<String> excludes;

    @CommandLine.Option(names = "--extensions", split = ",", defaultValue = ".java",
            description = "Comma-separated file extensions to process (default: ${DEFAULT-VALUE})")
    List<String> exts;

    @Override
    public Integer call() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "root is not a directory: " + root.toAbsolutePath());
        }
        PrintWriter out = spec.commandLine().getOut();
        List<Path> files = new SourceWalker(excludes, exts).walk(root);

        LiteralScanner scanner = new LiteralScanner();
        List<String> unreadable = new ArrayList<>();
        int eligible = 0;
        for (Path p : files) {
            String src;
            try {
                src = Files.readString(p, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("cannot read {}: {}", p, e.toString());
                unreadable.add(p.toString());
                continue;
            }
            int n = scanner.countLiterals(src);
            if (n > 0) {
                eligible++;
                out.printf("%6d  %s%n", n, root.relativize(p));
            }
        }
        out.printf("[scan] files=%d, with literals=%d, unreadable=%d%n", files.size(), eligible, unreadable.size());
        out.flush();
        return unreadable.isEmpty() ? 0 : 1;
    }
}
