package com.astmark.core.ast.decl;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.expr.Expression;

import java.util.List;

/**
 * 形参列表（无自身位置）
 *
 * <p>默认值与参数分开存放：defaults 对应最后 defaults.size() 个参数。</p>
 */
public class Arguments extends AstNode {
    private final List<Parameter> params;
    private final List<Expression> defaults;

    public Arguments(List<Parameter> params, List<Expression> defaults) {
        super(null);
        this.params = params;
        this.defaults = defaults;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public List<Expression> getDefaults() {
        return defaults;
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    @Override
    public List<AstNode> children() {
        return childList(params, defaults);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArguments(this, context);
    }
}
