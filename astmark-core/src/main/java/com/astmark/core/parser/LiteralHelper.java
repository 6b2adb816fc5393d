package com.astmark.core.parser;

import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.Literal;
import com.astmark.core.lexer.Token;

import java.math.BigInteger;

/**
 * 数值字面量解析辅助类：整数保存为 BigInteger，浮点与虚数保存为 Double（虚数只保留虚部）
 */
final class LiteralHelper {

    private LiteralHelper() {
    }

    static Literal numberLiteral(SourceLocation loc, Token token) {
        String text = token.getText().replace("_", "");
        String lower = text.toLowerCase();
        try {
            if (lower.endsWith("j")) {
                return new Literal(loc, Double.valueOf(text.substring(0, text.length() - 1)),
                        Literal.LiteralKind.COMPLEX);
            }
            if (lower.startsWith("0x")) {
                return new Literal(loc, new BigInteger(text.substring(2), 16), Literal.LiteralKind.INT);
            }
            if (lower.startsWith("0o")) {
                return new Literal(loc, new BigInteger(text.substring(2), 8), Literal.LiteralKind.INT);
            }
            if (lower.startsWith("0b")) {
                return new Literal(loc, new BigInteger(text.substring(2), 2), Literal.LiteralKind.INT);
            }
            if (lower.contains(".") || lower.contains("e")) {
                return new Literal(loc, Double.valueOf(text), Literal.LiteralKind.FLOAT);
            }
            return new Literal(loc, new BigInteger(text), Literal.LiteralKind.INT);
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid number literal", token);
        }
    }

    /**
     * 取反，位置不变
     */
    static Literal negate(Literal literal) {
        Object value = literal.getValue();
        Object negated;
        if (value instanceof BigInteger) {
            negated = ((BigInteger) value).negate();
        } else {
            negated = -((Double) value);
        }
        return new Literal(literal.getLocation(), negated, literal.getKind());
    }
}
