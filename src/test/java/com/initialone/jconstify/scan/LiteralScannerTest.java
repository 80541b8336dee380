package com.initialone.jconstify.scan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiteralScannerTest {

    private final LiteralScanner scanner = new LiteralScanner();

    // ── Gate ─────────────────────────────────────────────────────────

    @Nested
    class Gate {

        @Test
        @DisplayName("source without quotes is not eligible")
        void noQuotes() {
            String src = "class A { int x = 1 + 2; }\n";
            assertFalse(scanner.hasLiteral(src));
            assertEquals(0, scanner.countLiterals(src));
        }

        @Test
        @DisplayName("null and empty input are not eligible")
        void emptyInput() {
            assertFalse(scanner.hasLiteral(""));
            assertFalse(scanner.hasLiteral(null));
        }

        @Test
        @DisplayName("literals only inside comments do not count")
        void onlyCommentedLiterals() {
            String src = "// \"a\"\n/* \"b\" 'c' */\nclass A {}\n";
            assertFalse(scanner.hasLiteral(src));
        }

        @Test
        @DisplayName("one real literal next to commented ones")
        void scenarioA() {
            String src = "String s = \"hi\"; // \"not a literal\"\n/* \"also not\" */\n";
            List<LiteralSpan> spans = scanner.scan(src);
            assertEquals(1, spans.size());
            LiteralSpan span = spans.get(0);
            assertEquals(LiteralSpan.Kind.STRING, span.kind());
            assertEquals("hi", span.text(src));
            assertEquals(src.indexOf('"'), span.start());
        }

        @Test
        @DisplayName("empty string and char literals count")
        void emptyLiterals() {
            String src = "String s = \"\"; char c = '';";
            assertEquals(2, scanner.countLiterals(src));
        }
    }

    // ── Comment openers inside literals ──────────────────────────────

    @Nested
    class CommentOpenersInsideLiterals {

        @Test
        @DisplayName("// inside a string does not start a line comment")
        void lineCommentOpenerInString() {
            String src = "String url = \"http://example.com\"; String t = \"x\";";
            List<LiteralSpan> spans = scanner.scan(src);
            assertEquals(2, spans.size());
            assertEquals("http://example.com", spans.get(0).text(src));
            assertEquals("x", spans.get(1).text(src));
        }

        @Test
        @DisplayName("/* inside a string does not start a block comment")
        void blockCommentOpenerInString() {
            String src = "String g = \"/*\"; String h = \"*/\"; int i = 0;";
            List<LiteralSpan> spans = scanner.scan(src);
            assertEquals(2, spans.size());
            assertEquals("/*", spans.get(0).text(src));
            assertEquals("*/", spans.get(1).text(src));
        }

        @Test
        @DisplayName("comment openers inside a char literal are ignored")
        void openerInChar() {
            String src = "char a = '/'; char b = '*'; String s = \"ok\";";
            assertEquals(3, scanner.countLiterals(src));
        }

        @Test
        @DisplayName("a double quote inside a char literal does not open a string")
        void quoteInChar() {
            String src = "char q = '\"'; int x = 1;";
            List<LiteralSpan> spans = scanner.scan(src);
            assertEquals(1, spans.size());
            assertEquals(LiteralSpan.Kind.CHAR, spans.get(0).kind());
        }
    }

    // ── Escapes ──────────────────────────────────────────────────────

    @Nested
    class Escapes {

        @Test
        @DisplayName("escaped quote does not close the string early")
        void escapedQuote() {
            String src = "String s = \"say \\\"hi\\\" // not comment\"; int x;";
            List<LiteralSpan> spans = scanner.scan(src);
            assertEquals(1, spans.size());
            assertEquals("say \\\"hi\\\" // not comment", spans.get(0).text(src));
        }

        @Test
        @DisplayName("escaped backslash followed by the real closing quote")
        void escapedBackslashThenQuote() {
            String src = "String p = \"C:\\\\\"; String q = \"next\";";
            List<LiteralSpan> spans = scanner.scan(src);
            assertEquals(2, spans.size());
            assertEquals("C:\\\\", spans.get(0).text(src));
            assertEquals("next", spans.get(1).text(src));
        }

        @Test
        @DisplayName("escaped single quote in a char literal")
        void escapedCharQuote() {
            String src = "char c = '\\''; char d = '\\\\';";
            assertEquals(2, scanner.countLiterals(src));
        }

        @Test
        @DisplayName("trailing lone backslash at end of input does not fail")
        void trailingBackslash() {
            String src = "String s = \"abc\\";
            assertDoesNotThrow(() -> scanner.scan(src));
            assertEquals(0, scanner.countLiterals(src));
        }
    }

    // ── Malformed input ──────────────────────────────────────────────

    @Nested
    class Malformed {

        @Test
        @DisplayName("string broken by a newline gets no credit and scanning resumes")
        void unterminatedAtNewline() {
            String src = "String s = \"oops\nString t = \"fine\";\n";
            List<LiteralSpan> spans = scanner.scan(src);
            assertEquals(1, spans.size());
            assertEquals("fine", spans.get(0).text(src));
        }

        @Test
        @DisplayName("unterminated string at end of input gets no credit")
        void unterminatedAtEof() {
            assertEquals(0, scanner.countLiterals("String s = \"never closed"));
        }

        @Test
        @DisplayName("unterminated block comment swallows the rest")
        void unterminatedBlockComment() {
            assertEquals(0, scanner.countLiterals("/* open \"x\" forever"));
        }

        @Test
        @DisplayName("block comments do not nest")
        void noNesting() {
            String src = "/* outer /* inner */ String s = \"visible\"; */";
            assertEquals(1, scanner.countLiterals(src));
        }

        @Test
        @DisplayName("line comment at end of input without newline")
        void lineCommentAtEof() {
            assertEquals(1, scanner.countLiterals("String s = \"a\"; // \"b\""));
        }

        @Test
        @DisplayName("CRLF line endings end a line comment")
        void crlf() {
            String src = "// \"c\"\r\nString s = \"a\";\r\n";
            assertEquals(1, scanner.countLiterals(src));
        }
    }
}
