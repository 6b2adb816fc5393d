package com.astmark.core.ast.expr;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;

import java.util.List;

/**
 * 调用表达式，位置指向 '('
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> args;
    private final List<Keyword> keywords;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args, List<Keyword> keywords) {
        super(location);
        this.callee = callee;
        this.args = args;
        this.keywords = keywords;
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public List<Keyword> getKeywords() {
        return keywords;
    }

    @Override
    public List<AstNode> children() {
        return childList(callee, args, keywords);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }

    /**
     * 关键字参数 name=value，或 name 为 null 的 **value 展开（无自身位置）
     */
    public static final class Keyword extends AstNode {
        private final String name;
        private final Expression value;

        public Keyword(String name, Expression value) {
            super(null);
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public boolean isNamed() {
            return name != null;
        }

        public Expression getValue() {
            return value;
        }

        @Override
        public List<AstNode> children() {
            return childList(value);
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return visitor.visitKeyword(this, context);
        }
    }
}
