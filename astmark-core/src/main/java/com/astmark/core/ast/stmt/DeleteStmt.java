package com.astmark.core.ast.stmt;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.Expression;

import java.util.List;

/**
 * del 语句
 */
public class DeleteStmt extends Statement {
    private final List<Expression> targets;

    public DeleteStmt(SourceLocation location, List<Expression> targets) {
        super(location);
        this.targets = targets;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    @Override
    public List<AstNode> children() {
        return childList(targets);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeleteStmt(this, context);
    }
}
