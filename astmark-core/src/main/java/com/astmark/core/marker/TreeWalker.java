package com.astmark.core.marker;

import com.astmark.core.ast.AstNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 语法树遍历器：显式栈实现的深度优先遍历，不受递归深度限制
 *
 * <p>每个节点到达时调用 {@link Callbacks#before}，其返回的 {@code forChildren} 原样传给每个直接子节点；
 * 所有子节点处理完后调用 {@link Callbacks#after}，传入 {@code forSelf}。</p>
 */
public final class TreeWalker {

    private TreeWalker() {
    }

    /**
     * 遍历回调
     *
     * @param <T> 沿父子关系向下传递的值
     */
    public interface Callbacks<T> {

        Relay<T> before(AstNode node, T inherited);

        void after(AstNode node, T inherited, T own);
    }

    /**
     * before 回调的结果：传给子节点的值与留给 after 的值
     */
    public static final class Relay<T> {
        private final T forChildren;
        private final T forSelf;

        public Relay(T forChildren, T forSelf) {
            this.forChildren = forChildren;
            this.forSelf = forSelf;
        }

        public T getForChildren() {
            return forChildren;
        }

        public T getForSelf() {
            return forSelf;
        }
    }

    private static final class Frame<T> {
        final AstNode node;
        final T inherited;
        final boolean visited;
        final T own;

        Frame(AstNode node, T inherited, boolean visited, T own) {
            this.node = node;
            this.inherited = inherited;
            this.visited = visited;
            this.own = own;
        }
    }

    public static <T> void walk(AstNode root, Callbacks<T> callbacks) {
        Deque<Frame<T>> stack = new ArrayDeque<Frame<T>>();
        stack.push(new Frame<T>(root, null, false, null));

        while (!stack.isEmpty()) {
            Frame<T> frame = stack.pop();
            if (frame.visited) {
                callbacks.after(frame.node, frame.inherited, frame.own);
                continue;
            }

            Relay<T> relay = callbacks.before(frame.node, frame.inherited);
            stack.push(new Frame<T>(frame.node, frame.inherited, true, relay.getForSelf()));
            // 逆序压栈，子节点按 children() 顺序出栈
            List<AstNode> children = frame.node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame<T>(children.get(i), relay.getForChildren(), false, null));
            }
        }
    }
}
