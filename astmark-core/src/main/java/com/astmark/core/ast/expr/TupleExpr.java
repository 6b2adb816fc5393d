package com.astmark.core.ast.expr;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;

import java.util.List;

/**
 * 元组表达式；区间不含外层括号，但包含末尾逗号
 */
public class TupleExpr extends Expression {
    private final List<Expression> elements;

    public TupleExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public List<AstNode> children() {
        return childList(elements);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleExpr(this, context);
    }
}
