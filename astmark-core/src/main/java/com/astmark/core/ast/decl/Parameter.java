package com.astmark.core.ast.decl;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.Expression;

import java.util.List;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final Expression annotation;  // 可选

    public Parameter(SourceLocation location, String name, Expression annotation) {
        super(location);
        this.name = name;
        this.annotation = annotation;
    }

    public String getName() {
        return name;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    @Override
    public List<AstNode> children() {
        return childList(annotation);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
