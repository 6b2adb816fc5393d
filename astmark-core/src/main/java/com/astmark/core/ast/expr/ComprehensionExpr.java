package com.astmark.core.ast.expr;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;

import java.util.List;

/**
 * 推导式（[x for ...], {x for ...}, {k: v for ...}）
 *
 * <p>列表推导式的位置指向元素表达式而非 '['；集合/字典推导式在当前语法中指向 '{'，
 * 在旧语法中同样指向元素表达式。</p>
 */
public class ComprehensionExpr extends Expression {
    private final ComprehensionKind kind;
    private final Expression element;       // DICT 时为键
    private final Expression value;         // 仅 DICT
    private final List<ComprehensionClause> clauses;

    public ComprehensionExpr(SourceLocation location, ComprehensionKind kind, Expression element,
                             Expression value, List<ComprehensionClause> clauses) {
        super(location);
        this.kind = kind;
        this.element = element;
        this.value = value;
        this.clauses = clauses;
    }

    public ComprehensionKind getKind() {
        return kind;
    }

    public Expression getElement() {
        return element;
    }

    public Expression getValue() {
        return value;
    }

    public List<ComprehensionClause> getClauses() {
        return clauses;
    }

    @Override
    public List<AstNode> children() {
        return childList(element, value, clauses);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComprehensionExpr(this, context);
    }

    /**
     * 推导式类型
     */
    public enum ComprehensionKind {
        LIST("["),
        SET("{"),
        DICT("{");

        private final String openBracket;

        ComprehensionKind(String openBracket) {
            this.openBracket = openBracket;
        }

        public String getOpenBracket() {
            return openBracket;
        }
    }
}
