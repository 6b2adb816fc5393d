package com.astmark.core.ast.expr;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 字面量表达式
 *
 * <p>带符号的数值（如 -1）由解析器折叠为一个字面量，位置指向符号。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public boolean isNumeric() {
        return kind.isNumeric();
    }

    @Override
    public List<AstNode> children() {
        return Collections.emptyList();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        COMPLEX,
        STRING,
        BOOLEAN,
        NONE;

        /** 是否为数值字面量类型 */
        public boolean isNumeric() {
            return this == INT || this == FLOAT || this == COMPLEX;
        }
    }
}
