package com.astmark.core.ast.expr;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;

import java.util.List;

/**
 * 成员访问表达式（如 obj.property），位置指向 '.'
 */
public class MemberExpr extends Expression {
    private final Expression target;
    private final String member;
    /** 成员名标识符的精确位置（不含 '.'） */
    private SourceLocation memberLocation;

    public MemberExpr(SourceLocation location, Expression target, String member) {
        super(location);
        this.target = target;
        this.member = member;
    }

    public Expression getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    public SourceLocation getMemberLocation() {
        return memberLocation;
    }

    public void setMemberLocation(SourceLocation loc) {
        this.memberLocation = loc;
    }

    @Override
    public List<AstNode> children() {
        return childList(target);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMemberExpr(this, context);
    }
}
