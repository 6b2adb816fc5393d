package com.astmark.core.lexer;

/**
 * 词法单元
 *
 * <p>不可变；{@code index} 是它在 token 流中的序号，token 之间按序号全序。</p>
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;
    private final int offset;
    private final int index;

    public Token(TokenType type, String text, int line, int column, int offset, int index) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.index = index;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
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

    /** 结束字符偏移（不含） */
    public int getEndOffset() {
        return offset + text.length();
    }

    public int getIndex() {
        return index;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    /**
     * 类型相同且（text 为 null 或）文本相同
     */
    public boolean matches(TokenType type, String text) {
        return this.type == type && (text == null || this.text.equals(text));
    }

    public boolean isOp(String symbol) {
        return matches(TokenType.OP, symbol);
    }

    public boolean isKeyword(String keyword) {
        return matches(TokenType.NAME, keyword);
    }

    @Override
    public String toString() {
        return String.format("%s(%s) at %d:%d", type, describe(text), line, column);
    }

    /**
     * 带引号的文本，换行转义为 \n
     */
    public static String describe(String text) {
        return "'" + text.replace("\n", "\\n").replace("\r", "\\r") + "'";
    }
}
