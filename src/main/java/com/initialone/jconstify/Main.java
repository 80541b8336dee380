package com.initialone.jconstify;

import com.initialone.jconstify.commands.*;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jconstify",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Extract hard-coded string literals into constants with an LLM. Typical flow:",
                "  scan → refactor --dry-run → refactor --backup",
                "",
                "Endpoint: any OpenAI-compatible chat completions URL, or ollama /api/chat with --api ollama",
                "Env: API_KEY (bearer token)",
                "Exit code: 0 = no failures, 1 = some files failed, 2 = bad arguments"
        },
        subcommands = {
                ScanCmd.class, RefactorCmd.class
        }
)
public class Main implements Runnable {
    public void run() { System.out.println("Use a subcommand. Try --help."); }

    public static void main(String[] args) {
        int code = new CommandLine(new Main()).execute(args);
        System.exit(code);
    }
}
