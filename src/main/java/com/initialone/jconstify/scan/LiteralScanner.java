package com.initialone.jconstify.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单遍词法扫描：找出注释之外的字符串 / 字符字面量。
 *
 * 不是语法分析器，只区分五种状态：代码、行注释、块注释、字符串、字符。
 * - 注释起始符只在代码状态下识别，所以字面量里的 "//"、"/*" 不会开启注释
 * - 转义总是成对消费（反斜杠 + 下一个字符），结尾孤立的反斜杠忽略
 * - 字面量遇到换行视为残缺：不计数，回到代码状态
 * - 块注释不嵌套；输入结尾未闭合的字面量 / 注释同样不计数
 *
 * 线程安全：无状态，可以在多个 worker 间共享。
 */
public class LiteralScanner {

    private enum State { CODE, LINE_COMMENT, BLOCK_COMMENT, STRING, CHAR }

    /** 返回所有正常闭合的字面量（空字面量也算） */
    public List<LiteralSpan> scan(String src) {
        if (src == null || src.isEmpty()) return Collections.emptyList();

        List<LiteralSpan> spans = new ArrayList<>();
        State state = State.CODE;
        int start = -1;
        int n = src.length();
        int i = 0;
        while (i < n) {
            char c = src.charAt(i);
            char next = i + 1 < n ? src.charAt(i + 1) : '\0';
            switch (state) {
                case CODE -> {
                    if (c == '/' && next == '/') {
                        state = State.LINE_COMMENT;
                        i += 2;
                    } else if (c == '/' && next == '*') {
                        state = State.BLOCK_COMMENT;
                        i += 2;
                    } else if (c == '"') {
                        state = State.STRING;
                        start = i++;
                    } else if (c == '\'') {
                        state = State.CHAR;
                        start = i++;
                    } else {
                        i++;
                    }
                }
                case LINE_COMMENT -> {
                    if (c == '\n') state = State.CODE;
                    i++;
                }
                case BLOCK_COMMENT -> {
                    if (c == '*' && next == '/') {
                        state = State.CODE;
                        i += 2;
                    } else {
                        i++;
                    }
                }
                case STRING, CHAR -> {
                    char quote = state == State.STRING ? '"' : '\'';
                    if (c == '\\') {
                        // 成对消费；结尾孤立的反斜杠只前进一格，循环随即结束
                        i += (i + 1 < n) ? 2 : 1;
                    } else if (c == quote) {
                        spans.add(new LiteralSpan(start, i + 1,
                                state == State.STRING ? LiteralSpan.Kind.STRING : LiteralSpan.Kind.CHAR));
                        state = State.CODE;
                        i++;
                    } else if (c == '\n' || c == '\r') {
                        // 残缺字面量，不计数
                        state = State.CODE;
                        i++;
                    } else {
                        i++;
                    }
                }
            }
        }
        return spans;
    }

    public int countLiterals(String src) {
        return scan(src).size();
    }

    /** 资格判断：注释之外至少一个字面量 */
    public boolean hasLiteral(String src) {
        return countLiterals(src) > 0;
    }
}
