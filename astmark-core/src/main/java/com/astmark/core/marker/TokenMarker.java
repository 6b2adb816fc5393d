package com.astmark.core.marker;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.stmt.Statement;
import com.astmark.core.lexer.Token;
import com.astmark.core.lexer.TokenStream;
import com.astmark.core.lexer.TokenType;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 为语法树的每个节点标记首尾 token
 *
 * <p>后序处理每个节点：合并自身锚点与子节点区间，语句延伸到行尾，括号修复，
 * 按节点类型修正，修正改变区间时再做一次括号修复，最后写回节点。</p>
 *
 * <p>节点上已有的区间不作为输入，可以对同一棵树重复标记，结果相同。</p>
 */
public class TokenMarker {
    private static final Logger LOG = Logger.getLogger(TokenMarker.class.getName());

    private final TokenStream stream;
    private final BracketMatcher bracketMatcher;
    private final RangeRefiner refiner;

    public TokenMarker(TokenStream stream) {
        this(stream, new MarkerConfig());
    }

    public TokenMarker(TokenStream stream, MarkerConfig config) {
        this.stream = stream;
        this.bracketMatcher = new BracketMatcher(stream, config);
        this.refiner = new RangeRefiner(stream, config);
    }

    /**
     * 标记以 root 为根的整棵树；任何节点失败都会中止标记
     */
    public void markTokens(AstNode root) {
        final int[] count = new int[1];
        TreeWalker.walk(root, new TreeWalker.Callbacks<Token>() {
            @Override
            public TreeWalker.Relay<Token> before(AstNode node, Token inherited) {
                return beforeChildren(node, inherited);
            }

            @Override
            public void after(AstNode node, Token inherited, Token own) {
                afterChildren(node, inherited, own);
                count[0]++;
            }
        });
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Marked " + count[0] + " nodes over " + stream.size() + " tokens, root "
                    + root.getNodeName() + " " + new TokenRange(root.getFirstToken(), root.getLastToken()));
        }
    }

    TreeWalker.Relay<Token> beforeChildren(AstNode node, Token inherited) {
        Token own = null;
        if (node.hasLocation()) {
            SourceLocation loc = node.getLocation();
            own = stream.tokenAt(loc.getLine(), loc.getColumn());
        }
        return new TreeWalker.Relay<Token>(own != null ? own : inherited, own);
    }

    void afterChildren(AstNode node, Token inherited, Token own) {
        try {
            TokenRange range = combine(node, inherited, own);
            range = bracketMatcher.expand(range, node);
            TokenRange refined = refiner.refine(node, range);
            if (!refined.equals(range)) {
                refined = bracketMatcher.expand(refined, node);
            }
            node.setFirstToken(refined.getFirst());
            node.setLastToken(refined.getLast());
        } catch (MarkingException e) {
            if (e.getNodeKind() != null) {
                throw e;
            }
            throw new MarkingException(e, node.getNodeName());
        }
    }

    /**
     * 由自身锚点与子节点区间得到初始区间；子节点可以不按源码顺序排列
     */
    TokenRange combine(AstNode node, Token inherited, Token own) {
        Token first = own;
        Token last = null;
        for (AstNode child : node.children()) {
            if (first == null || child.getFirstToken().getIndex() < first.getIndex()) {
                first = child.getFirstToken();
            }
            if (last == null || child.getLastToken().getIndex() > last.getIndex()) {
                last = child.getLastToken();
            }
        }

        if (first == null) {
            first = inherited;
        }
        if (first == null) {
            throw new IllegalStateException("No anchor token for " + node.getNodeName()
                    + ": node has no location, no children and no inherited anchor");
        }
        if (last == null) {
            last = first;
        }

        if (node instanceof Statement) {
            last = findLastInLine(last);
        }
        return new TokenRange(first, last);
    }

    /**
     * 行尾 NEWLINE（没有时为 ENDMARKER）之前的最后一个 token
     */
    private Token findLastInLine(Token start) {
        Token newline = stream.find(start,
                t -> t.is(TokenType.NEWLINE) || t.is(TokenType.ENDMARKER), false, "NEWLINE");
        return stream.prev(newline);
    }
}
