package com.astmark.core.marker;

import com.astmark.core.lexer.Token;

/**
 * 节点的 token 闭区间 [first, last]，按 token 序号比较
 */
public final class TokenRange {
    private final Token first;
    private final Token last;

    public TokenRange(Token first, Token last) {
        this.first = first;
        this.last = last;
    }

    public Token getFirst() {
        return first;
    }

    public Token getLast() {
        return last;
    }

    public TokenRange withFirst(Token newFirst) {
        return new TokenRange(newFirst, last);
    }

    public TokenRange withLast(Token newLast) {
        return new TokenRange(first, newLast);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenRange)) return false;
        TokenRange other = (TokenRange) o;
        return first.getIndex() == other.first.getIndex() && last.getIndex() == other.last.getIndex();
    }

    @Override
    public int hashCode() {
        return 31 * first.getIndex() + last.getIndex();
    }

    @Override
    public String toString() {
        return "[" + first + " .. " + last + "]";
    }
}
