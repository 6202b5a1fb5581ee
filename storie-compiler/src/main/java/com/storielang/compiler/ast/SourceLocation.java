package com.storielang.compiler.ast;

import java.util.Objects;

/**
 * 源码位置：文件名、行列号（从 1 开始）、字符偏移和所覆盖的长度
 */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int length;

    public SourceLocation(String file, int line, int column, int offset, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.length = length;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLength() {
        return length;
    }

    /** 行号未知（合成节点）时为 false */
    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && offset == that.offset
                && length == that.length && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line, column, offset, length);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
