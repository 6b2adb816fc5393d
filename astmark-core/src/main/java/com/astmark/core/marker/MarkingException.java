package com.astmark.core.marker;

import com.astmark.core.lexer.Token;

/**
 * token 标记异常：token 流与语法树不一致时抛出，中止整棵树的标记
 */
public class MarkingException extends RuntimeException {

    /**
     * 失败原因
     */
    public enum Reason {
        /** 期望的 token 不在预期位置 */
        MALFORMED_INPUT,
        /** 越过 token 流的首尾 */
        STREAM_BOUNDARY
    }

    private final Reason reason;
    private final Token token;
    private final String expected;
    private final String nodeKind;

    public MarkingException(Reason reason, String message, Token token, String expected) {
        super(message);
        this.reason = reason;
        this.token = token;
        this.expected = expected;
        this.nodeKind = null;
    }

    /**
     * 附加出错节点的类型
     */
    public MarkingException(MarkingException cause, String nodeKind) {
        super(cause.getRawMessage(), cause);
        this.reason = cause.reason;
        this.token = cause.token;
        this.expected = cause.expected;
        this.nodeKind = nodeKind;
    }

    public Reason getReason() {
        return reason;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    public String getNodeKind() {
        return nodeKind;
    }

    String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found ").append(Token.describe(token.getText())).append(')');
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        if (nodeKind != null) {
            sb.append(" [node: ").append(nodeKind).append(']');
        }
        return sb.toString();
    }
}
