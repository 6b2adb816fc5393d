package com.astmark.core.lexer;

import com.astmark.core.marker.MarkingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * 只读 token 流访问器：按位置查找 token、前后步进、定向搜索、区间截取
 *
 * <p>{@link #next(Token)} / {@link #prev(Token)} 默认跳过注释与非逻辑换行；
 * 越过流的两端时抛出 {@link MarkingException.Reason#STREAM_BOUNDARY}。</p>
 */
public final class TokenStream {
    private final String source;
    private final List<Token> tokens;
    private final LineNumbers lineNumbers;

    public TokenStream(String source, List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).getIndex() != i) {
                throw new IllegalArgumentException("Token index mismatch at position " + i + ": " + tokens.get(i));
            }
        }
        this.source = source;
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
        this.lineNumbers = new LineNumbers(source);
    }

    public String getSource() {
        return source;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public LineNumbers getLineNumbers() {
        return lineNumbers;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    // ============ 位置查找 ============

    /**
     * 起始偏移不大于 offset 的最后一个 token；空流返回 null
     */
    public Token tokenAtOffset(int offset) {
        if (tokens.isEmpty()) return null;
        int lo = 0;
        int hi = tokens.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (tokens.get(mid).getOffset() <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return tokens.get(lo);
    }

    /**
     * 行列号（从 1 开始）处的 token
     */
    public Token tokenAt(int line, int column) {
        return tokenAtOffset(lineNumbers.lineToOffset(line, column));
    }

    // ============ 步进 ============

    public Token next(Token token) {
        return next(token, false);
    }

    public Token next(Token token, boolean includeExtra) {
        int i = token.getIndex() + 1;
        while (i < tokens.size()) {
            Token t = tokens.get(i);
            if (includeExtra || !t.getType().isExtra()) {
                return t;
            }
            i++;
        }
        throw new MarkingException(MarkingException.Reason.STREAM_BOUNDARY,
                "No token after end of stream", token, null);
    }

    public Token prev(Token token) {
        return prev(token, false);
    }

    public Token prev(Token token, boolean includeExtra) {
        int i = token.getIndex() - 1;
        while (i >= 0) {
            Token t = tokens.get(i);
            if (includeExtra || !t.getType().isExtra()) {
                return t;
            }
            i--;
        }
        throw new MarkingException(MarkingException.Reason.STREAM_BOUNDARY,
                "No token before start of stream", token, null);
    }

    // ============ 搜索 ============

    /**
     * 从 from（含）开始沿指定方向查找第一个满足条件的 token
     */
    public Token find(Token from, Predicate<Token> predicate, boolean reverse, String expected) {
        int step = reverse ? -1 : 1;
        for (int i = from.getIndex(); i >= 0 && i < tokens.size(); i += step) {
            Token t = tokens.get(i);
            if (predicate.test(t)) {
                return t;
            }
        }
        throw new MarkingException(MarkingException.Reason.STREAM_BOUNDARY,
                reverse ? "Search reached start of stream" : "Search reached end of stream", from, expected);
    }

    /**
     * 查找给定类型（与文本，text 为 null 时不限）的 token
     */
    public Token find(Token from, TokenType type, String text, boolean reverse) {
        String expected = text != null ? type + " '" + text + "'" : type.name();
        return find(from, t -> t.matches(type, text), reverse, expected);
    }

    /**
     * 断言 token 的类型（与文本，text 为 null 时不限），否则抛出 MALFORMED_INPUT
     */
    public Token expect(Token token, TokenType type, String text) {
        if (!token.matches(type, text)) {
            String expected = text != null ? type + " '" + text + "'" : type.name();
            throw new MarkingException(MarkingException.Reason.MALFORMED_INPUT,
                    "Unexpected token", token, expected);
        }
        return token;
    }

    // ============ 区间 ============

    /**
     * [first, last] 闭区间内的 token，first 在 last 之后时为空
     */
    public List<Token> range(Token first, Token last) {
        return range(first, last, false);
    }

    public List<Token> range(Token first, Token last, boolean includeExtra) {
        List<Token> result = new ArrayList<>();
        for (int i = first.getIndex(); i <= last.getIndex(); i++) {
            Token t = tokens.get(i);
            if (includeExtra || !t.getType().isExtra()) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * [first, last] 覆盖的源码文本
     */
    public String text(Token first, Token last) {
        if (first.getIndex() > last.getIndex()) return "";
        return source.substring(first.getOffset(), last.getEndOffset());
    }
}
