package com.astmark.core.ast.expr;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;

import java.util.List;

/**
 * 推导式子句 for target in iterable [if cond]...（无自身位置）
 */
public class ComprehensionClause extends AstNode {
    private final Expression target;
    private final Expression iterable;
    private final List<Expression> conditions;

    public ComprehensionClause(Expression target, Expression iterable, List<Expression> conditions) {
        super(null);
        this.target = target;
        this.iterable = iterable;
        this.conditions = conditions;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Expression> getConditions() {
        return conditions;
    }

    @Override
    public List<AstNode> children() {
        return childList(target, iterable, conditions);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehensionClause(this, context);
    }
}
