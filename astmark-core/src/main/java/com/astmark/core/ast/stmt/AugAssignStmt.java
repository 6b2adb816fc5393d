package com.astmark.core.ast.stmt;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.BinaryExpr;
import com.astmark.core.ast.expr.Expression;

import java.util.List;

/**
 * 复合赋值语句（如 x += 1）
 */
public class AugAssignStmt extends Statement {
    private final Expression target;
    private final BinaryExpr.BinaryOp operator;
    private final Expression value;

    public AugAssignStmt(SourceLocation location, Expression target, BinaryExpr.BinaryOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryExpr.BinaryOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<AstNode> children() {
        return childList(target, value);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAugAssignStmt(this, context);
    }
}
