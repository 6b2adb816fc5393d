package com.astmark.core;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.Program;
import com.astmark.core.lexer.Lexer;
import com.astmark.core.lexer.Token;
import com.astmark.core.lexer.TokenStream;
import com.astmark.core.marker.MarkerConfig;
import com.astmark.core.marker.TokenMarker;
import com.astmark.core.parser.Parser;

import java.io.PrintStream;
import java.util.Collections;
import java.util.List;

/**
 * 源码、token 流与已标记语法树的组合入口
 *
 * <pre>
 * AstTokens atok = AstTokens.parse("foo(bar)\n", "demo.py");
 * atok.getText(node);
 * </pre>
 */
public class AstTokens {
    private final String source;
    private final TokenStream tokenStream;
    private final Program tree;
    private final TokenMarker marker;

    public AstTokens(String source, List<Token> tokens, Program tree, MarkerConfig config) {
        this.source = source;
        this.tokenStream = new TokenStream(source, tokens);
        this.tree = tree;
        this.marker = new TokenMarker(tokenStream, config);
    }

    /**
     * 词法分析、解析并标记
     */
    public static AstTokens parse(String source, String fileName) {
        return parse(source, fileName, new MarkerConfig());
    }

    public static AstTokens parse(String source, String fileName, MarkerConfig config) {
        return parse(source, fileName, config, System.err);
    }

    /**
     * @param errStream 词法错误输出
     */
    public static AstTokens parse(String source, String fileName, MarkerConfig config, PrintStream errStream) {
        List<Token> tokens = new Lexer(source, fileName, errStream).scanTokens();
        Program program = new Parser(tokens, fileName, config.getGrammarVersion()).parse();
        AstTokens atok = new AstTokens(source, tokens, program, config);
        atok.markTokens(program);
        return atok;
    }

    public String getSource() {
        return source;
    }

    public TokenStream getTokenStream() {
        return tokenStream;
    }

    public Program getTree() {
        return tree;
    }

    /**
     * 重新标记以 node 为根的子树
     */
    public void markTokens(AstNode node) {
        marker.markTokens(node);
    }

    /**
     * 节点覆盖的源码文本；未标记的节点返回空串
     */
    public String getText(AstNode node) {
        if (!node.isMarked()) {
            return "";
        }
        return tokenStream.text(node.getFirstToken(), node.getLastToken());
    }

    /**
     * 节点覆盖的字符偏移 {start, end}（end 不含）；未标记的节点返回 {0, 0}
     */
    public int[] getTextRange(AstNode node) {
        if (!node.isMarked()) {
            return new int[]{0, 0};
        }
        return new int[]{node.getFirstToken().getOffset(), node.getLastToken().getEndOffset()};
    }

    /**
     * 节点区间内的 token
     */
    public List<Token> getTokens(AstNode node, boolean includeExtra) {
        if (!node.isMarked()) {
            return Collections.emptyList();
        }
        return tokenStream.range(node.getFirstToken(), node.getLastToken(), includeExtra);
    }
}
