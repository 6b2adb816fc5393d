package com.astmark.core.parser;

import com.astmark.core.lexer.Token;

/**
 * 语法错误：出错的 token 与期望的内容
 *
 * <p>消息中的 token 带类型，NEWLINE 等空白 token 的文本会转义，消息始终是单行。</p>
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, String expected) {
        super(message);
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    /** 出错 token 的行号；没有 token 时为 0 */
    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine())
              .append(", column ").append(token.getColumn())
              .append(" (found ").append(token.getType()).append(' ')
              .append(Token.describe(token.getText())).append(')');
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
