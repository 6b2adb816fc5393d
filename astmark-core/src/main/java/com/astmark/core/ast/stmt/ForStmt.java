package com.astmark.core.ast.stmt;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.Expression;

import java.util.List;

/**
 * for-in 语句
 */
public class ForStmt extends Statement {
    private final Expression target;
    private final Expression iterable;
    private final List<Statement> body;
    private final List<Statement> elseBody;

    public ForStmt(SourceLocation location, Expression target, Expression iterable,
                   List<Statement> body, List<Statement> elseBody) {
        super(location);
        this.target = target;
        this.iterable = iterable;
        this.body = body;
        this.elseBody = elseBody;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getElseBody() {
        return elseBody;
    }

    @Override
    public List<AstNode> children() {
        return childList(target, iterable, body, elseBody);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
