package com.astmark.core.ast;

import com.astmark.core.lexer.Token;

/**
 * 节点的起始位置（行列从 1 开始）
 *
 * <p>token 标记只用行列反查起始 token；偏移区间供诊断输出。</p>
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int offset;
    private final int endOffset;

    public SourceLocation(String file, int line, int column, int offset, int endOffset) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.endOffset = endOffset;
    }

    /**
     * 以 token 的起止作为位置
     */
    public static SourceLocation of(String file, Token token) {
        return new SourceLocation(file, token.getLine(), token.getColumn(), token.getOffset(), token.getEndOffset());
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

    /** 起始字符偏移（含） */
    public int getOffset() {
        return offset;
    }

    /** 起始 token 的结束偏移（不含） */
    public int getEndOffset() {
        return endOffset;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
