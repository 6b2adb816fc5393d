package com.astmark.core.marker;

import com.astmark.core.ast.AstNode;
import com.astmark.core.lexer.Token;
import com.astmark.core.lexer.TokenStream;
import com.astmark.core.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * 括号修复：扫描区间内不属于任何子节点的 token，把未配对的 ()、[]、{} 向外补齐
 */
public class BracketMatcher {

    private static final Comparator<AstNode> BY_FIRST_TOKEN = new Comparator<AstNode>() {
        @Override
        public int compare(AstNode a, AstNode b) {
            return Integer.compare(a.getFirstToken().getIndex(), b.getFirstToken().getIndex());
        }
    };

    private final TokenStream stream;
    private final boolean skipTrailingComma;

    public BracketMatcher(TokenStream stream, MarkerConfig config) {
        this.stream = stream;
        this.skipTrailingComma = config.isSkipTrailingComma();
    }

    /**
     * 补齐区间两端缺失的括号
     */
    public TokenRange expand(TokenRange range, AstNode node) {
        Deque<String> toMatchRight = new ArrayDeque<String>();
        List<String> toMatchLeft = new ArrayList<String>();

        for (Token token : gapTokens(range.getFirst(), range.getLast(), node)) {
            if (!toMatchRight.isEmpty() && token.isOp(toMatchRight.peek())) {
                toMatchRight.pop();
            } else if (closerOf(token) != null) {
                toMatchRight.push(closerOf(token));
            } else if (openerOf(token) != null) {
                toMatchLeft.add(openerOf(token));
            }
        }

        // 由内向外补闭括号
        Token last = range.getLast();
        for (String closer : toMatchRight) {
            last = stream.next(last);
            if (skipTrailingComma && last.isOp(",")) {
                last = stream.next(last);
            }
            stream.expect(last, TokenType.OP, closer);
        }

        Token first = range.getFirst();
        for (String opener : toMatchLeft) {
            first = stream.prev(first);
            stream.expect(first, TokenType.OP, opener);
        }

        return new TokenRange(first, last);
    }

    /**
     * [first, last] 内不被任何子节点区间覆盖的 token；子节点按首 token 排序，不依赖 children() 顺序
     */
    List<Token> gapTokens(Token first, Token last, AstNode node) {
        List<AstNode> children = new ArrayList<AstNode>(node.children());
        Collections.sort(children, BY_FIRST_TOKEN);

        List<Token> result = new ArrayList<Token>();
        Token from = first;
        for (AstNode child : children) {
            if (child.getFirstToken().getIndex() > from.getIndex()) {
                result.addAll(stream.range(from, stream.get(child.getFirstToken().getIndex() - 1)));
            }
            if (child.getLastToken().getIndex() >= last.getIndex()) {
                return result;
            }
            if (child.getLastToken().getIndex() >= from.getIndex()) {
                from = stream.get(child.getLastToken().getIndex() + 1);
            }
        }
        result.addAll(stream.range(from, last));
        return result;
    }

    static String closerOf(Token opener) {
        if (!opener.is(TokenType.OP)) return null;
        switch (opener.getText()) {
            case "(": return ")";
            case "[": return "]";
            case "{": return "}";
            default: return null;
        }
    }

    static String openerOf(Token closer) {
        if (!closer.is(TokenType.OP)) return null;
        switch (closer.getText()) {
            case ")": return "(";
            case "]": return "[";
            case "}": return "{";
            default: return null;
        }
    }
}
