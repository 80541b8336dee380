package com.initialone.jconstify.scan;

/** 源码中一个字符串/字符字面量的位置：[start, end)，包含两侧引号。 */
public final class LiteralSpan {

    public enum Kind { STRING, CHAR }

    private final int start;
    private final int end;
    private final Kind kind;

    public LiteralSpan(int start, int end, Kind kind) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("bad span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.kind = kind;
    }

    public int start() { return start; }

    public int end() { return end; }

    public Kind kind() { return kind; }

    /** 引号之间的内容（原样，不做转义还原） */
    public String text(CharSequence source) {
        return source.subSequence(start + 1, end - 1).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralSpan)) return false;
        LiteralSpan that = (LiteralSpan) o;
        return start == that.start && end == that.end && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return (31 * start + end) * 31 + kind.hashCode();
    }

    @Override
    public String toString() {
        return kind + "[" + start + ", " + end + ")";
    }
}
