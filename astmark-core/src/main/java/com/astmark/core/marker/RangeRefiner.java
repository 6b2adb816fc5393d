package com.astmark.core.marker;

import com.astmark.core.GrammarVersion;
import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.expr.CallExpr;
import com.astmark.core.ast.expr.ComprehensionClause;
import com.astmark.core.ast.expr.ComprehensionExpr;
import com.astmark.core.ast.expr.IndexExpr;
import com.astmark.core.ast.expr.Literal;
import com.astmark.core.ast.expr.MemberExpr;
import com.astmark.core.ast.expr.TupleExpr;
import com.astmark.core.lexer.Token;
import com.astmark.core.lexer.TokenStream;
import com.astmark.core.lexer.TokenType;

/**
 * 按节点类型修正区间边界；未覆盖的节点类型保持原区间
 *
 * <p>上下文参数是括号修复后的区间，返回值是修正后的区间。</p>
 */
public class RangeRefiner implements AstVisitor<TokenRange, TokenRange> {

    private final TokenStream stream;
    private final GrammarVersion grammarVersion;

    public RangeRefiner(TokenStream stream, MarkerConfig config) {
        this.stream = stream;
        this.grammarVersion = config.getGrammarVersion();
    }

    public TokenRange refine(AstNode node, TokenRange range) {
        return node.accept(this, range);
    }

    @Override
    public TokenRange visitNode(AstNode node, TokenRange range) {
        return range;
    }

    @Override
    public TokenRange visitComprehensionExpr(ComprehensionExpr node, TokenRange range) {
        // 当前语法的集合/字典推导式已经定位到 '{'
        if (node.getKind() == ComprehensionExpr.ComprehensionKind.LIST || grammarVersion == GrammarVersion.LEGACY) {
            Token before = stream.prev(range.getFirst());
            stream.expect(before, TokenType.OP, node.getKind().getOpenBracket());
            return range.withFirst(before);
        }
        return range;
    }

    @Override
    public TokenRange visitComprehensionClause(ComprehensionClause node, TokenRange range) {
        return range.withFirst(stream.find(range.getFirst(), TokenType.NAME, "for", true));
    }

    @Override
    public TokenRange visitMemberExpr(MemberExpr node, TokenRange range) {
        Token dot = stream.find(range.getLast(), TokenType.OP, ".", false);
        Token name = stream.next(dot);
        stream.expect(name, TokenType.NAME, null);
        return range.withLast(name);
    }

    @Override
    public TokenRange visitCallExpr(CallExpr node, TokenRange range) {
        return followingBracket(node.getCallee(), range, "(");
    }

    @Override
    public TokenRange visitIndexExpr(IndexExpr node, TokenRange range) {
        return followingBracket(node.getTarget(), range, "[");
    }

    /**
     * 调用与下标的括号紧跟在被调用者之后，可能不含任何子节点（如 f()、f()()）。
     * 区间延伸到这个开括号，闭括号交给随后的括号修复
     */
    private TokenRange followingBracket(AstNode head, TokenRange range, String opener) {
        Token open = stream.find(stream.next(head.getLastToken()), TokenType.OP, opener, false);
        return open.getIndex() > range.getLast().getIndex() ? range.withLast(open) : range;
    }

    @Override
    public TokenRange visitTupleExpr(TupleExpr node, TokenRange range) {
        Token last = range.getLast();
        // 空元组 () 的括号属于它自身，后面的逗号属于外层
        if (node.getElements().isEmpty() || last.is(TokenType.ENDMARKER)) {
            return range;
        }
        Token maybeComma = stream.next(last);
        return maybeComma.isOp(",") ? range.withLast(maybeComma) : range;
    }

    @Override
    public TokenRange visitLiteral(Literal node, TokenRange range) {
        if (!node.isNumeric()) {
            return range;
        }
        // 带符号的数值：跳过符号
        Token last = range.getLast();
        while (last.is(TokenType.OP)) {
            last = stream.next(last);
        }
        return range.withLast(last);
    }

    @Override
    public TokenRange visitKeyword(CallExpr.Keyword node, TokenRange range) {
        if (!node.isNamed()) {
            return range;
        }
        Token equals = stream.find(range.getFirst(), TokenType.OP, "=", true);
        Token name = stream.prev(equals);
        stream.expect(name, TokenType.NAME, node.getName());
        return range.withFirst(name);
    }
}
