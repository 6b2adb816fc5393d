package com.astmark.core.ast.stmt;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.SourceLocation;

/**
 * 语句基类
 *
 * <p>语句的 token 区间会延伸到所在逻辑行的末尾。</p>
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
