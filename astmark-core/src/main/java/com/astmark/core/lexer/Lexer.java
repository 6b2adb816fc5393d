package com.astmark.core.lexer;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 词法分析器
 *
 * <p>按 Python tokenize 的规则产出 token：逻辑行以 NEWLINE 结束，空行和括号内的换行是 NL，
 * 缩进变化产出 INDENT/DEDENT，文件末尾补齐 NEWLINE、DEDENT 与 ENDMARKER。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    private final Deque<Integer> indents = new ArrayDeque<>();
    private int parenDepth = 0;
    private boolean atLineStart = true;
    private boolean lineHasTokens = false;

    private final PrintStream errStream;

    // 按长度降序排列，保证最长匹配
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", ":=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=",
    };

    private static final Set<String> STRING_PREFIXES = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("r", "u", "b", "f", "br", "rb", "fr", "rf")));

    public Lexer(String source, String fileName) {
        this(source, fileName, System.err);
    }

    public Lexer(String source, String fileName, PrintStream errStream) {
        this.source = source;
        this.fileName = fileName;
        this.errStream = errStream;
        this.indents.push(0);
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    /**
     * 执行词法分析，返回 Token 列表（以 ENDMARKER 结尾）
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (atLineStart) {
                atLineStart = false;
                indentation();
                continue;
            }
            beginToken();
            scanToken();
        }

        beginToken();
        // 末行没有换行符时补一个空 NEWLINE
        if (lineHasTokens) {
            addToken(TokenType.NEWLINE);
        }
        while (indents.size() > 1) {
            indents.pop();
            addToken(TokenType.DEDENT);
        }
        addToken(TokenType.ENDMARKER);
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 空白字符
            case ' ':
            case '\t':
            case '\f':
            case '\r':
                break;

            case '\n':
                if (parenDepth > 0 || !lineHasTokens) {
                    addToken(TokenType.NL);
                } else {
                    addToken(TokenType.NEWLINE);
                    lineHasTokens = false;
                }
                newLine();
                if (parenDepth == 0) {
                    atLineStart = true;
                }
                break;

            case '#':
                while (peek() != '\n' && !isAtEnd()) advance();
                addToken(TokenType.COMMENT);
                break;

            case '\\':
                // 续行符
                match('\r');
                if (match('\n')) {
                    newLine();
                } else {
                    error("Unexpected character after line continuation");
                }
                break;

            case '"':
            case '\'':
                string(c);
                break;

            case '(':
            case '[':
            case '{':
                parenDepth++;
                addToken(TokenType.OP);
                break;

            case ')':
            case ']':
            case '}':
                if (parenDepth > 0) parenDepth--;
                addToken(TokenType.OP);
                break;

            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number(c);
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    operator();
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        int pos = current + distance;
        if (pos >= source.length()) return '\0';
        return source.charAt(pos);
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isExponentOrImaginary(char c) {
        return c == 'e' || c == 'E' || c == 'j' || c == 'J';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void beginToken() {
        start = current;
        startLine = line;
        startColumn = current - lineStart + 1;
    }

    private void addToken(TokenType type) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, startLine, startColumn, start, tokens.size()));
        if (type.isSignificant()) {
            lineHasTokens = true;
        }
    }

    // === 复杂 Token 扫描 ===

    /**
     * 处理物理行开头的缩进；空行和纯注释行不影响缩进栈
     */
    private void indentation() {
        beginToken();
        int width = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            advance();
        }
        if (isAtEnd()) return;

        char c = peek();
        if (c == '#' || c == '\n' || c == '\r' || c == '\\') return;

        if (width > indents.peek()) {
            indents.push(width);
            addToken(TokenType.INDENT);
            return;
        }
        beginToken();
        while (width < indents.peek()) {
            indents.pop();
            addToken(TokenType.DEDENT);
        }
        if (width != indents.peek()) {
            error("Unindent does not match any outer indentation level");
        }
    }

    private void string(char quote) {
        boolean triple = false;
        if (peek() == quote && peekNext() == quote) {
            advance();
            advance();
            triple = true;
        }

        while (!isAtEnd()) {
            char c = peek();
            if (c == '\\') {
                advance();
                if (!isAtEnd() && advance() == '\n') newLine();
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    error("Unterminated string");
                    return;
                }
                advance();
                newLine();
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    advance();
                    addToken(TokenType.STRING);
                    return;
                }
                if (peekNext() == quote && peekAt(2) == quote) {
                    advance();
                    advance();
                    advance();
                    addToken(TokenType.STRING);
                    return;
                }
            }
            advance();
        }
        error(triple ? "Unterminated triple-quoted string" : "Unterminated string");
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private void number(char first) {
        char radix = Character.toLowerCase(peek());
        if (first == '0' && (radix == 'x' || radix == 'o' || radix == 'b')) {
            advance();
            while (isHexDigit(peek()) || peek() == '_') advance();
        } else {
            if (first == '.') {
                advanceDigits();
            } else {
                advanceDigits();
                if (peek() == '.' && isDigit(peekNext())) {
                    advance();
                    advanceDigits();
                } else if (peek() == '.' && peekNext() != '.'
                        && (!isAlpha(peekNext()) || isExponentOrImaginary(peekNext()))) {
                    // 形如 "1."、"1.e5"、"1.j" 的浮点数
                    advance();
                }
            }
            // 指数部分
            if (peek() == 'e' || peek() == 'E') {
                char sign = peekNext();
                if (isDigit(sign) || ((sign == '+' || sign == '-') && isDigit(peekAt(2)))) {
                    advance();
                    if (peek() == '+' || peek() == '-') advance();
                    advanceDigits();
                }
            }
        }
        // 虚数后缀
        if (peek() == 'j' || peek() == 'J') advance();
        addToken(TokenType.NUMBER);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        if ((peek() == '"' || peek() == '\'') && STRING_PREFIXES.contains(text.toLowerCase())) {
            string(advance());
            return;
        }
        addToken(TokenType.NAME);
    }

    private void operator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, start)) {
                current = start + op.length();
                addToken(TokenType.OP);
                return;
            }
        }
        error("Unexpected character: " + source.charAt(start));
    }

    private void error(String message) {
        String errorMsg = String.format("[%s:%d:%d] Lexer error: %s",
                fileName, line, current - lineStart + 1, message);
        errStream.println(errorMsg);
        addToken(TokenType.ERRORTOKEN);
    }
}
