package com.astmark.core.parser;

import com.astmark.core.GrammarVersion;
import com.astmark.core.ast.Program;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.Expression;
import com.astmark.core.ast.stmt.Statement;
import com.astmark.core.lexer.Lexer;
import com.astmark.core.lexer.Token;
import com.astmark.core.lexer.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.astmark.core.lexer.TokenType.*;

/**
 * 语法分析器（递归下降）
 *
 * <p>直接消费完整 token 列表，解析前滤掉注释与非逻辑换行。节点位置取自起始 token，
 * 供 token 标记时反查。</p>
 */
public class Parser {

    static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break",
            "class", "continue", "def", "del", "elif", "else", "except", "finally", "for",
            "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not",
            "or", "pass", "raise", "return", "try", "while", "with", "yield")));

    final String fileName;
    final GrammarVersion grammarVersion;
    private final List<Token> tokens;
    private int pos;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens, String fileName, GrammarVersion grammarVersion) {
        this.fileName = fileName;
        this.grammarVersion = grammarVersion;
        this.tokens = new ArrayList<Token>(tokens.size());
        for (Token token : tokens) {
            if (!token.getType().isExtra()) {
                this.tokens.add(token);
            }
        }
        if (this.tokens.isEmpty() || !this.tokens.get(this.tokens.size() - 1).is(ENDMARKER)) {
            throw new IllegalArgumentException("Token list must end with ENDMARKER");
        }
        this.current = this.tokens.get(0);
    }

    public Parser(Lexer lexer, String fileName) {
        this(lexer.scanTokens(), fileName, GrammarVersion.CURRENT);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (pos < tokens.size() - 1) {
            pos++;
        }
        current = tokens.get(pos);
        if (current.is(ERRORTOKEN)) {
            throw new ParseException("Invalid token", current);
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return tokens.get(Math.min(pos + 1, tokens.size() - 1));
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkOp(String symbol) {
        return current.isOp(symbol);
    }

    /**
     * 检查任一操作符
     */
    boolean checkAnyOp(String... symbols) {
        for (String symbol : symbols) {
            if (checkOp(symbol)) return true;
        }
        return false;
    }

    boolean checkKeyword(String keyword) {
        return current.isKeyword(keyword);
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchOp(String symbol) {
        if (checkOp(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    Token expectOp(String symbol) {
        if (checkOp(symbol)) {
            return advance();
        }
        throw new ParseException("Expected '" + symbol + "'", current, "'" + symbol + "'");
    }

    Token expectKeyword(String keyword) {
        if (checkKeyword(keyword)) {
            return advance();
        }
        throw new ParseException("Expected '" + keyword + "'", current, "'" + keyword + "'");
    }

    /**
     * 期望一个非关键字的名字
     */
    Token expectIdentifier(String message) {
        if (check(NAME) && !isKeyword(current)) {
            return advance();
        }
        throw new ParseException(message, current, "identifier");
    }

    static boolean isKeyword(Token token) {
        return token.is(NAME) && KEYWORDS.contains(token.getText());
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    SourceLocation locationOf(Token token) {
        return SourceLocation.of(fileName, token);
    }

    boolean isAtEnd() {
        return check(ENDMARKER);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序
     */
    public Program parse() {
        if (current.is(ERRORTOKEN)) {
            throw new ParseException("Invalid token", current);
        }
        // 首个有效 token，空程序时为 ENDMARKER
        SourceLocation loc = location();
        List<Statement> body = new ArrayList<Statement>();
        while (!isAtEnd()) {
            body.add(parseStatement());
        }
        return new Program(loc, body);
    }

    // ============ 语句解析委托 ============

    Statement parseStatement() { return stmtParser.parseStatement(); }

    // ============ 表达式解析委托 ============

    Expression parseExpression() { return exprParser.parseExpression(); }
    Expression parseTestList() { return exprParser.parseTestList(); }
}
