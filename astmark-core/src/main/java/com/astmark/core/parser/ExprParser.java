package com.astmark.core.parser;

import com.astmark.core.GrammarVersion;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.expr.*;
import com.astmark.core.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.astmark.core.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>优先级从低到高：条件表达式、or、and、not、比较、|、^、&amp;、移位、加减、乘除、一元、幂、后缀。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 逗号分隔的表达式列表；多于一个元素（或带逗号）时组成元组
     */
    Expression parseTestList() {
        SourceLocation loc = parser.location();
        Expression first = parseExpression();
        if (!parser.checkOp(",")) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.matchOp(",")) {
            if (!isExpressionStart()) break;
            elements.add(parseExpression());
        }
        return new TupleExpr(loc, elements);
    }

    /**
     * for 循环和推导式的目标列表，元素在 | 层级解析以免吞掉 in
     */
    Expression parseTargetList() {
        SourceLocation loc = parser.location();
        Expression first = parseBitOrExpr();
        if (!parser.checkOp(",")) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.matchOp(",")) {
            if (!isExpressionStart()) break;
            elements.add(parseBitOrExpr());
        }
        return new TupleExpr(loc, elements);
    }

    // 条件表达式 thenExpr if condition else elseExpr（右结合）
    Expression parseExpression() {
        if (parser.checkKeyword("lambda")) {
            throw new ParseException("Lambda expressions are not supported", parser.current);
        }
        Expression thenExpr = parseOrExpr();
        if (!parser.checkKeyword("if")) {
            return thenExpr;
        }
        SourceLocation loc = parser.location();
        parser.advance();
        Expression condition = parseOrExpr();
        parser.expectKeyword("else");
        Expression elseExpr = parseExpression();
        return new ConditionalExpr(loc, condition, thenExpr, elseExpr);
    }

    // 逻辑或 or
    private Expression parseOrExpr() {
        Expression left = parseAndExpr();

        while (parser.checkKeyword("or")) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression right = parseAndExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, right);
        }

        return left;
    }

    // 逻辑与 and
    private Expression parseAndExpr() {
        Expression left = parseNotExpr();

        while (parser.checkKeyword("and")) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression right = parseNotExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, right);
        }

        return left;
    }

    // 逻辑非 not
    private Expression parseNotExpr() {
        if (parser.checkKeyword("not")) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression operand = parseNotExpr();
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, operand);
        }
        return parseComparisonExpr();
    }

    // 比较 < > == >= <= != in, not in, is, is not（链式比较左结合）
    private Expression parseComparisonExpr() {
        Expression left = parseBitOrExpr();

        while (true) {
            SourceLocation loc = parser.location();
            BinaryExpr.BinaryOp op;
            if (parser.checkAnyOp("<", ">", "==", ">=", "<=", "!=")) {
                op = BinaryExpr.BinaryOp.fromSymbol(parser.advance().getText());
            } else if (parser.matchKeyword("in")) {
                op = BinaryExpr.BinaryOp.IN;
            } else if (parser.checkKeyword("not") && parser.peek().isKeyword("in")) {
                parser.advance();
                parser.advance();
                op = BinaryExpr.BinaryOp.NOT_IN;
            } else if (parser.matchKeyword("is")) {
                op = parser.matchKeyword("not") ? BinaryExpr.BinaryOp.IS_NOT : BinaryExpr.BinaryOp.IS;
            } else {
                break;
            }
            Expression right = parseBitOrExpr();
            left = new BinaryExpr(loc, left, op, right);
        }

        return left;
    }

    // 按位或 |
    private Expression parseBitOrExpr() {
        Expression left = parseBitXorExpr();
        while (parser.checkOp("|")) {
            SourceLocation loc = parser.location();
            String op = parser.advance().getText();
            Expression right = parseBitXorExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.fromSymbol(op), right);
        }
        return left;
    }

    // 按位异或 ^
    private Expression parseBitXorExpr() {
        Expression left = parseBitAndExpr();
        while (parser.checkOp("^")) {
            SourceLocation loc = parser.location();
            String op = parser.advance().getText();
            Expression right = parseBitAndExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.fromSymbol(op), right);
        }
        return left;
    }

    // 按位与 &
    private Expression parseBitAndExpr() {
        Expression left = parseShiftExpr();
        while (parser.checkOp("&")) {
            SourceLocation loc = parser.location();
            String op = parser.advance().getText();
            Expression right = parseShiftExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.fromSymbol(op), right);
        }
        return left;
    }

    // 移位 << >>
    private Expression parseShiftExpr() {
        Expression left = parseAdditiveExpr();
        while (parser.checkAnyOp("<<", ">>")) {
            SourceLocation loc = parser.location();
            String op = parser.advance().getText();
            Expression right = parseAdditiveExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.fromSymbol(op), right);
        }
        return left;
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();
        while (parser.checkAnyOp("+", "-")) {
            SourceLocation loc = parser.location();
            String op = parser.advance().getText();
            Expression right = parseMultiplicativeExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.fromSymbol(op), right);
        }
        return left;
    }

    // 乘除 * / // % @
    private Expression parseMultiplicativeExpr() {
        Expression left = parseUnaryExpr();
        while (parser.checkAnyOp("*", "/", "//", "%", "@")) {
            SourceLocation loc = parser.location();
            String op = parser.advance().getText();
            Expression right = parseUnaryExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.fromSymbol(op), right);
        }
        return left;
    }

    // 一元 - + ~；符号紧跟数字时折叠为带符号的字面量
    private Expression parseUnaryExpr() {
        if (!parser.checkAnyOp("-", "+", "~")) {
            return parsePowerExpr();
        }
        SourceLocation loc = parser.location();
        Token op = parser.advance();

        if (!op.isOp("~") && parser.check(NUMBER) && !isTrailerOrPower(parser.peek())) {
            Token number = parser.advance();
            Literal literal = LiteralHelper.numberLiteral(loc, number);
            return op.isOp("-") ? LiteralHelper.negate(literal) : literal;
        }

        Expression operand = parseUnaryExpr();
        UnaryExpr.UnaryOp unaryOp;
        switch (op.getText()) {
            case "-": unaryOp = UnaryExpr.UnaryOp.NEG; break;
            case "+": unaryOp = UnaryExpr.UnaryOp.POS; break;
            default: unaryOp = UnaryExpr.UnaryOp.INVERT; break;
        }
        return new UnaryExpr(loc, unaryOp, operand);
    }

    private boolean isTrailerOrPower(Token token) {
        return token.isOp("**") || token.isOp(".") || token.isOp("(") || token.isOp("[");
    }

    // 幂 **（右结合，右侧可以是一元表达式）
    private Expression parsePowerExpr() {
        Expression base = parsePostfixExpr();
        if (parser.checkOp("**")) {
            SourceLocation loc = parser.location();
            parser.advance();
            Expression exponent = parseUnaryExpr();
            return new BinaryExpr(loc, base, BinaryExpr.BinaryOp.POW, exponent);
        }
        return base;
    }

    // 后缀：成员访问、调用、下标
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();

        while (true) {
            if (parser.checkOp(".")) {
                SourceLocation loc = parser.location();
                parser.advance();
                if (!parser.check(NAME)) {
                    throw new ParseException("Expected member name", parser.current, "NAME");
                }
                Token member = parser.advance();
                MemberExpr memberExpr = new MemberExpr(loc, expr, member.getText());
                memberExpr.setMemberLocation(parser.locationOf(member));
                expr = memberExpr;
            } else if (parser.checkOp("(")) {
                expr = parseCall(expr);
            } else if (parser.checkOp("[")) {
                SourceLocation loc = parser.location();
                parser.advance();
                if (parser.checkOp(":")) {
                    throw new ParseException("Slices are not supported", parser.current);
                }
                Expression index = parseTestList();
                if (parser.checkOp(":")) {
                    throw new ParseException("Slices are not supported", parser.current);
                }
                parser.expectOp("]");
                expr = new IndexExpr(loc, expr, index);
            } else {
                break;
            }
        }

        return expr;
    }

    private Expression parseCall(Expression callee) {
        SourceLocation loc = parser.location();
        parser.expectOp("(");
        List<Expression> args = new ArrayList<Expression>();
        List<CallExpr.Keyword> keywords = new ArrayList<CallExpr.Keyword>();

        while (!parser.checkOp(")")) {
            if (parser.checkOp("*")) {
                throw new ParseException("Starred arguments are not supported", parser.current);
            }
            if (parser.matchOp("**")) {
                keywords.add(new CallExpr.Keyword(null, parseExpression()));
            } else if (parser.check(NAME) && parser.peek().isOp("=")) {
                Token name = parser.expectIdentifier("Expected keyword argument name");
                parser.advance();
                keywords.add(new CallExpr.Keyword(name.getText(), parseExpression()));
            } else {
                if (!keywords.isEmpty()) {
                    throw new ParseException("Positional argument follows keyword argument", parser.current);
                }
                args.add(parseExpression());
                if (parser.checkKeyword("for")) {
                    throw new ParseException("Generator expressions are not supported", parser.current);
                }
            }
            if (!parser.matchOp(",")) break;
        }

        parser.expectOp(")");
        return new CallExpr(loc, callee, args, keywords);
    }

    // ============ 原子表达式 ============

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();
        Token token = parser.current;

        switch (token.getType()) {
            case NUMBER:
                parser.advance();
                return LiteralHelper.numberLiteral(loc, token);
            case STRING:
                parser.advance();
                if (parser.check(STRING)) {
                    throw new ParseException("Implicit string concatenation is not supported", parser.current);
                }
                return new Literal(loc, token.getText(), Literal.LiteralKind.STRING);
            case NAME:
                return parseName(loc, token);
            case OP:
                break;
            default:
                throw new ParseException("Expected expression", token);
        }

        if (token.isOp("(")) {
            return parseParenthesized(loc);
        }
        if (token.isOp("[")) {
            return parseListDisplay(loc);
        }
        if (token.isOp("{")) {
            return parseBraceDisplay(loc);
        }
        if (token.isOp("*")) {
            throw new ParseException("Starred expressions are not supported", token);
        }
        throw new ParseException("Expected expression", token);
    }

    private Expression parseName(SourceLocation loc, Token token) {
        String text = token.getText();
        if ("True".equals(text) || "False".equals(text)) {
            parser.advance();
            return new Literal(loc, Boolean.valueOf(text), Literal.LiteralKind.BOOLEAN);
        }
        if ("None".equals(text)) {
            parser.advance();
            return new Literal(loc, null, Literal.LiteralKind.NONE);
        }
        if ("lambda".equals(text)) {
            throw new ParseException("Lambda expressions are not supported", token);
        }
        if (Parser.isKeyword(token)) {
            throw new ParseException("Unexpected keyword '" + text + "'", token, "expression");
        }
        parser.advance();
        return new Identifier(loc, text);
    }

    /**
     * 括号表达式、元组或空元组；括号本身不产生节点
     */
    private Expression parseParenthesized(SourceLocation parenLoc) {
        parser.expectOp("(");
        if (parser.matchOp(")")) {
            return new TupleExpr(parenLoc, Collections.<Expression>emptyList());
        }

        SourceLocation loc = parser.location();
        Expression first = parseExpression();
        if (parser.checkKeyword("for")) {
            throw new ParseException("Generator expressions are not supported", parser.current);
        }
        if (!parser.checkOp(",")) {
            parser.expectOp(")");
            return first;
        }

        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.matchOp(",")) {
            if (parser.checkOp(")")) break;
            elements.add(parseExpression());
        }
        parser.expectOp(")");
        return new TupleExpr(loc, elements);
    }

    private Expression parseListDisplay(SourceLocation bracketLoc) {
        parser.expectOp("[");
        if (parser.matchOp("]")) {
            return new CollectionLiteral(bracketLoc, CollectionLiteral.CollectionKind.LIST,
                    Collections.<Expression>emptyList(), null);
        }

        SourceLocation elementLoc = parser.location();
        Expression first = parseExpression();
        if (parser.checkKeyword("for")) {
            // 列表推导式定位到元素表达式
            List<ComprehensionClause> clauses = parseComprehensionClauses();
            parser.expectOp("]");
            return new ComprehensionExpr(elementLoc, ComprehensionExpr.ComprehensionKind.LIST, first, null, clauses);
        }

        List<Expression> elements = parseRemainingElements(first, "]");
        return new CollectionLiteral(bracketLoc, CollectionLiteral.CollectionKind.LIST, elements, null);
    }

    private Expression parseBraceDisplay(SourceLocation braceLoc) {
        parser.expectOp("{");
        if (parser.matchOp("}")) {
            return new CollectionLiteral(braceLoc, CollectionLiteral.CollectionKind.MAP,
                    null, Collections.<CollectionLiteral.MapEntry>emptyList());
        }

        SourceLocation elementLoc = parser.location();
        SourceLocation comprehensionLoc = parser.grammarVersion == GrammarVersion.LEGACY ? elementLoc : braceLoc;
        Expression first = parseExpression();

        if (parser.matchOp(":")) {
            Expression value = parseExpression();
            if (parser.checkKeyword("for")) {
                List<ComprehensionClause> clauses = parseComprehensionClauses();
                parser.expectOp("}");
                return new ComprehensionExpr(comprehensionLoc, ComprehensionExpr.ComprehensionKind.DICT,
                        first, value, clauses);
            }
            List<CollectionLiteral.MapEntry> entries = new ArrayList<CollectionLiteral.MapEntry>();
            entries.add(new CollectionLiteral.MapEntry(first, value));
            while (parser.matchOp(",")) {
                if (parser.checkOp("}")) break;
                Expression key = parseExpression();
                parser.expectOp(":");
                entries.add(new CollectionLiteral.MapEntry(key, parseExpression()));
            }
            parser.expectOp("}");
            return new CollectionLiteral(braceLoc, CollectionLiteral.CollectionKind.MAP, null, entries);
        }

        if (parser.checkKeyword("for")) {
            List<ComprehensionClause> clauses = parseComprehensionClauses();
            parser.expectOp("}");
            return new ComprehensionExpr(comprehensionLoc, ComprehensionExpr.ComprehensionKind.SET,
                    first, null, clauses);
        }

        List<Expression> elements = parseRemainingElements(first, "}");
        return new CollectionLiteral(braceLoc, CollectionLiteral.CollectionKind.SET, elements, null);
    }

    /**
     * 解析首元素之后的元素与闭括号，允许末尾逗号
     */
    private List<Expression> parseRemainingElements(Expression first, String closer) {
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.matchOp(",")) {
            if (parser.checkOp(closer)) break;
            elements.add(parseExpression());
        }
        parser.expectOp(closer);
        return elements;
    }

    // for target in iterable [if cond]... 可重复
    private List<ComprehensionClause> parseComprehensionClauses() {
        List<ComprehensionClause> clauses = new ArrayList<ComprehensionClause>();
        while (parser.matchKeyword("for")) {
            Expression target = parseTargetList();
            parser.expectKeyword("in");
            Expression iterable = parseOrExpr();
            List<Expression> conditions = new ArrayList<Expression>();
            while (parser.matchKeyword("if")) {
                conditions.add(parseOrExpr());
            }
            clauses.add(new ComprehensionClause(target, iterable, conditions));
        }
        return clauses;
    }

    // ============ 辅助方法 ============

    /**
     * 当前 token 能否开始一个表达式
     */
    boolean isExpressionStart() {
        Token token = parser.current;
        switch (token.getType()) {
            case NUMBER:
            case STRING:
                return true;
            case NAME:
                return !Parser.isKeyword(token) || token.isKeyword("not") || token.isKeyword("None")
                        || token.isKeyword("True") || token.isKeyword("False") || token.isKeyword("lambda");
            case OP:
                return token.isOp("(") || token.isOp("[") || token.isOp("{") || token.isOp("-")
                        || token.isOp("+") || token.isOp("~") || token.isOp("*");
            default:
                return false;
        }
    }
}
