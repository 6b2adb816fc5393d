package com.astmark.core.ast.expr;

import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.AstVisitor;
import com.astmark.core.ast.SourceLocation;

import java.util.List;

/**
 * 二元表达式（算术、位运算、比较、逻辑），位置指向运算符
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public List<AstNode> children() {
        return childList(left, right);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        MAT_MUL("@"),
        DIV("/"),
        FLOOR_DIV("//"),
        MOD("%"),
        POW("**"),

        // 位运算
        LSHIFT("<<"),
        RSHIFT(">>"),
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),
        IN("in"),
        NOT_IN("not in"),
        IS("is"),
        IS_NOT("is not"),

        // 逻辑
        AND("and"),
        OR("or");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        /**
         * 按符号查找运算符，未知符号返回 null
         */
        public static BinaryOp fromSymbol(String symbol) {
            for (BinaryOp op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            return null;
        }
    }
}
