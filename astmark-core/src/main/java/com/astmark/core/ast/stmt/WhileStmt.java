package com.astmark.core.ast.stmt;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.Expression;

import java.util.List;

/**
 * while 语句
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final List<Statement> body;
    private final List<Statement> elseBody;

    public WhileStmt(SourceLocation location, Expression condition, List<Statement> body, List<Statement> elseBody) {
        super(location);
        this.condition = condition;
        this.body = body;
        this.elseBody = elseBody;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getElseBody() {
        return elseBody;
    }

    @Override
    public List<AstNode> children() {
        return childList(condition, body, elseBody);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWhileStmt(this, context);
    }
}
