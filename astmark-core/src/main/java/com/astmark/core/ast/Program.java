package com.astmark.core.ast;

import com.astmark.core.ast.stmt.Statement;

import java.util.List;

/**
 * 程序（AST 根节点）
 *
 * <p>位置是第一个语句的起始 token，开头的注释与空行不属于程序；空程序定位到 ENDMARKER。</p>
 */
public class Program extends AstNode {
    private final List<Statement> body;

    public Program(SourceLocation location, List<Statement> body) {
        super(location);
        this.body = body;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public List<AstNode> children() {
        return childList(body);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
