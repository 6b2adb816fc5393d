package com.astmark.core.ast.decl;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.Expression;
import com.astmark.core.ast.stmt.Statement;

import java.util.List;

/**
 * 函数定义（def name(params) -> returnType: body）
 *
 * <p>子节点顺序为 参数、函数体、返回类型注解，返回类型在源码中位于函数体之前。</p>
 */
public class FunctionDef extends Statement {
    private final String name;
    private final Arguments params;
    private final List<Statement> body;
    private final Expression returnType;  // 可选
    /** 函数名标识符的精确位置 */
    private SourceLocation nameLocation;

    public FunctionDef(SourceLocation location, String name, Arguments params,
                       List<Statement> body, Expression returnType) {
        super(location);
        this.name = name;
        this.params = params;
        this.body = body;
        this.returnType = returnType;
    }

    public String getName() {
        return name;
    }

    public Arguments getParams() {
        return params;
    }

    public List<Statement> getBody() {
        return body;
    }

    public Expression getReturnType() {
        return returnType;
    }

    public SourceLocation getNameLocation() {
        return nameLocation;
    }

    public void setNameLocation(SourceLocation nameLocation) {
        this.nameLocation = nameLocation;
    }

    @Override
    public List<AstNode> children() {
        return childList(params, body, returnType);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDef(this, context);
    }
}
