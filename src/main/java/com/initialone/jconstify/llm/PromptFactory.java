package com.initialone.jconstify.llm;

public class PromptFactory {

    public static String systemPrompt() {
        return """
                You are a Java refactoring assistant. \
                Extract every string literal into a `public static final String` constant \
                declared at the top (after package+imports), \
                and replace usages accordingly. \
                Return ONLY the full, compilable refactored source code.""";
    }
}
