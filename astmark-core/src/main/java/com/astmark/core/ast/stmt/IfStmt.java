package com.astmark.core.ast.stmt;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.Expression;

import java.util.List;

/**
 * if 语句；elif 分支表示为 else 分支中唯一的嵌套 IfStmt
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final List<Statement> thenBody;
    private final List<Statement> elseBody;  // 可为空列表

    public IfStmt(SourceLocation location, Expression condition, List<Statement> thenBody, List<Statement> elseBody) {
        super(location);
        this.condition = condition;
        this.thenBody = thenBody;
        this.elseBody = elseBody;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getThenBody() {
        return thenBody;
    }

    public List<Statement> getElseBody() {
        return elseBody;
    }

    @Override
    public List<AstNode> children() {
        return childList(condition, thenBody, elseBody);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
