package com.astmark.core.marker;

import com.astmark.core.AstTokens;
import com.astmark.core.TestTrees;
import com.astmark.core.ast.AstNode;
import com.astmark.core.lexer.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 对整棵树成立的性质：区间包含、括号平衡、整体文本、重复标记结果不变
 */
class MarkingPropertiesTest {

    private static final String[] SOURCES = {
            "foo(bar)\n",
            "x = (1, 2)\ny = [a for (a, b) in c if a for d in b]\n",
            "def f(a, b: int = 2) -> str:\n    return a\n",
            "if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n",
            "d = {'a': 1, 'b': f(x=-2.5, **kw)}\n",
            "for i in range(3): print(i)\nwhile x:\n    x -= 1\nelse:\n    pass\n",
            "(a + b) * c\n(f)(x)\n(a).b\n",
            "foo(a,\n    b)\n",
            "s = {x for x in y}\nt = {k: v for k, v in items}\n",
            "del a[1], b.c\nz = x if not y else -1\n",
    };

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9})
    @DisplayName("子节点区间包含于父节点区间")
    void testChildrenContained(int sample) {
        AstTokens atok = AstTokens.parse(SOURCES[sample], "<test>");
        for (AstNode node : TestTrees.allNodes(atok.getTree())) {
            assertTrue(node.isMarked(), node.getNodeName());
            assertThat(node.getFirstToken().getIndex()).isLessThanOrEqualTo(node.getLastToken().getIndex());
            for (AstNode child : node.children()) {
                assertThat(child.getFirstToken().getIndex())
                        .as("%s in %s", child.getNodeName(), node.getNodeName())
                        .isGreaterThanOrEqualTo(node.getFirstToken().getIndex());
                assertThat(child.getLastToken().getIndex())
                        .as("%s in %s", child.getNodeName(), node.getNodeName())
                        .isLessThanOrEqualTo(node.getLastToken().getIndex());
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9})
    @DisplayName("每个节点的文本括号平衡")
    void testBracketsBalanced(int sample) {
        AstTokens atok = AstTokens.parse(SOURCES[sample], "<test>");
        for (AstNode node : TestTrees.allNodes(atok.getTree())) {
            assertTrue(isBalanced(atok.getTokens(node, false)),
                    node.getNodeName() + ": " + atok.getText(node));
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9})
    @DisplayName("程序的文本是去掉末尾换行的源码")
    void testProgramText(int sample) {
        AstTokens atok = AstTokens.parse(SOURCES[sample], "<test>");
        assertEquals(SOURCES[sample].trim(), atok.getText(atok.getTree()));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9})
    @DisplayName("重复标记、清空后重新标记，结果不变")
    void testIdempotent(int sample) {
        AstTokens atok = AstTokens.parse(SOURCES[sample], "<test>");
        List<AstNode> nodes = TestTrees.allNodes(atok.getTree());
        List<TokenRange> before = ranges(nodes);

        atok.markTokens(atok.getTree());
        assertEquals(before, ranges(nodes));

        for (AstNode node : nodes) {
            node.setFirstToken(null);
            node.setLastToken(null);
        }
        atok.markTokens(atok.getTree());
        assertEquals(before, ranges(nodes));
    }

    private static List<TokenRange> ranges(List<AstNode> nodes) {
        List<TokenRange> result = new ArrayList<TokenRange>();
        for (AstNode node : nodes) {
            result.add(new TokenRange(node.getFirstToken(), node.getLastToken()));
        }
        return result;
    }

    private static boolean isBalanced(List<Token> tokens) {
        Deque<String> pending = new ArrayDeque<String>();
        for (Token token : tokens) {
            String closer = BracketMatcher.closerOf(token);
            if (closer != null) {
                pending.push(closer);
            } else if (BracketMatcher.openerOf(token) != null) {
                if (pending.isEmpty() || !token.isOp(pending.pop())) {
                    return false;
                }
            }
        }
        return pending.isEmpty();
    }
}
