package com.astmark.core.ast;

import com.astmark.core.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 *
 * <p>{@code location} 为 null 表示节点没有自身位置（合成节点，如调用的关键字参数）。
 * {@code firstToken}/{@code lastToken} 由 token 标记填充，标记前为 null。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    // token 标记后填充
    private Token firstToken;
    private Token lastToken;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean hasLocation() {
        return location != null;
    }

    public Token getFirstToken() {
        return firstToken;
    }

    public void setFirstToken(Token firstToken) {
        this.firstToken = firstToken;
    }

    public Token getLastToken() {
        return lastToken;
    }

    public void setLastToken(Token lastToken) {
        this.lastToken = lastToken;
    }

    public boolean isMarked() {
        return firstToken != null && lastToken != null;
    }

    /** 节点类型名（诊断信息用） */
    public String getNodeName() {
        return getClass().getSimpleName();
    }

    /**
     * 直接子节点，按构造顺序排列（不保证与源码顺序一致）
     */
    public abstract List<AstNode> children();

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    /**
     * 拼接子节点列表：参数可以是节点、节点列表或 null（跳过）
     */
    protected static List<AstNode> childList(Object... parts) {
        List<AstNode> result = new ArrayList<AstNode>();
        for (Object part : parts) {
            if (part instanceof AstNode) {
                result.add((AstNode) part);
            } else if (part instanceof List) {
                for (Object item : (List<?>) part) {
                    if (item != null) {
                        result.add((AstNode) item);
                    }
                }
            }
        }
        return result.isEmpty() ? Collections.<AstNode>emptyList() : result;
    }
}
