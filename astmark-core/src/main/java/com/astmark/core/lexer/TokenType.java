package com.astmark.core.lexer;

/**
 * 词法单元类型
 *
 * <p>分类方式与 Python tokenize 一致：关键词也是 NAME，所有操作符与分隔符都是 OP，
 * 具体是哪个符号由 token 文本区分。</p>
 */
public enum TokenType {
    // === 有语法意义的 token ===
    NAME,
    NUMBER,
    STRING,
    OP,

    // === 行结构 ===
    NEWLINE,        // 逻辑行结束
    NL,             // 空行或括号内的换行
    INDENT,
    DEDENT,

    // === 其他 ===
    COMMENT,
    ENDMARKER,
    ERRORTOKEN;

    /**
     * 是否为附加 token（注释、非逻辑换行），默认遍历时跳过
     */
    public boolean isExtra() {
        return this == NL || this == COMMENT;
    }

    /**
     * 是否会让当前逻辑行变为非空
     */
    public boolean isSignificant() {
        switch (this) {
            case NAME:
            case NUMBER:
            case STRING:
            case OP:
            case ERRORTOKEN:
                return true;
            default:
                return false;
        }
    }
}
