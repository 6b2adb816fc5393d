package com.astmark.core;

import com.astmark.core.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试用的语法树查找工具
 */
public final class TestTrees {

    private TestTrees() {
    }

    /** 先序列出所有节点 */
    public static List<AstNode> allNodes(AstNode root) {
        List<AstNode> result = new ArrayList<>();
        collect(root, result);
        return result;
    }

    private static void collect(AstNode node, List<AstNode> result) {
        result.add(node);
        for (AstNode child : node.children()) {
            collect(child, result);
        }
    }

    /** 先序查找给定类型的所有节点 */
    public static <T extends AstNode> List<T> findAll(AstNode root, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (AstNode node : allNodes(root)) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }

    /** 先序第一个给定类型的节点 */
    public static <T extends AstNode> T findFirst(AstNode root, Class<T> type) {
        List<T> all = findAll(root, type);
        if (all.isEmpty()) {
            throw new AssertionError("No " + type.getSimpleName() + " in tree");
        }
        return all.get(0);
    }
}
