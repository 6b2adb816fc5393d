package com.astmark.core.parser;

import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.decl.Arguments;
import com.astmark.core.ast.decl.FunctionDef;
import com.astmark.core.ast.decl.Parameter;
import com.astmark.core.ast.expr.BinaryExpr;
import com.astmark.core.ast.expr.Expression;
import com.astmark.core.ast.stmt.*;
import com.astmark.core.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.astmark.core.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    private static final String[] AUG_ASSIGN_OPS = {
            "+=", "-=", "*=", "@=", "/=", "//=", "%=", "**=", "<<=", ">>=", "&=", "|=", "^="
    };

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        if (parser.check(INDENT)) {
            throw new ParseException("Unexpected indent", parser.current);
        }
        if (parser.checkKeyword("def")) {
            return parseFunctionDef();
        }
        if (parser.checkKeyword("if")) {
            return parseIfStmt();
        }
        if (parser.checkKeyword("while")) {
            return parseWhileStmt();
        }
        if (parser.checkKeyword("for")) {
            return parseForStmt();
        }

        Statement stmt = parseSimpleStatement();
        endOfLine();
        return stmt;
    }

    /**
     * 单行语句（不含行尾 NEWLINE）
     */
    private Statement parseSimpleStatement() {
        SourceLocation loc = parser.location();
        if (parser.matchKeyword("pass")) {
            return new PassStmt(loc);
        }
        if (parser.matchKeyword("break")) {
            return new BreakStmt(loc);
        }
        if (parser.matchKeyword("continue")) {
            return new ContinueStmt(loc);
        }
        if (parser.matchKeyword("return")) {
            Expression value = atLineEnd() ? null : parser.parseTestList();
            return new ReturnStmt(loc, value);
        }
        if (parser.matchKeyword("del")) {
            return parseDeleteStmt(loc);
        }
        return parseExpressionOrAssignment(loc);
    }

    private Statement parseDeleteStmt(SourceLocation loc) {
        List<Expression> targets = new ArrayList<Expression>();
        targets.add(parser.parseExpression());
        while (parser.matchOp(",")) {
            if (atLineEnd()) break;
            targets.add(parser.parseExpression());
        }
        return new DeleteStmt(loc, targets);
    }

    private Statement parseExpressionOrAssignment(SourceLocation loc) {
        Expression first = parser.parseTestList();

        for (String op : AUG_ASSIGN_OPS) {
            if (parser.checkOp(op)) {
                parser.advance();
                Expression value = parser.parseTestList();
                String symbol = op.substring(0, op.length() - 1);
                return new AugAssignStmt(loc, first, BinaryExpr.BinaryOp.fromSymbol(symbol), value);
            }
        }

        if (!parser.checkOp("=")) {
            return new ExpressionStmt(loc, first);
        }

        // 链式赋值：最后一个表达式是值，其余都是目标
        List<Expression> targets = new ArrayList<Expression>();
        Expression value = first;
        while (parser.matchOp("=")) {
            targets.add(value);
            value = parser.parseTestList();
        }
        return new AssignStmt(loc, targets, value);
    }

    // ============ 复合语句 ============

    private Statement parseIfStmt() {
        // if 与 elif 共用：elif 产生嵌套 IfStmt，位置指向 elif
        SourceLocation loc = parser.location();
        parser.advance();
        Expression condition = parser.parseExpression();
        List<Statement> thenBody = parseSuite();

        List<Statement> elseBody;
        if (parser.checkKeyword("elif")) {
            elseBody = Collections.<Statement>singletonList(parseIfStmt());
        } else if (parser.matchKeyword("else")) {
            elseBody = parseSuite();
        } else {
            elseBody = Collections.emptyList();
        }
        return new IfStmt(loc, condition, thenBody, elseBody);
    }

    private Statement parseWhileStmt() {
        SourceLocation loc = parser.location();
        parser.expectKeyword("while");
        Expression condition = parser.parseExpression();
        List<Statement> body = parseSuite();
        List<Statement> elseBody = parseElseSuite();
        return new WhileStmt(loc, condition, body, elseBody);
    }

    private Statement parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expectKeyword("for");
        Expression target = parser.exprParser.parseTargetList();
        parser.expectKeyword("in");
        Expression iterable = parser.parseTestList();
        List<Statement> body = parseSuite();
        List<Statement> elseBody = parseElseSuite();
        return new ForStmt(loc, target, iterable, body, elseBody);
    }

    private List<Statement> parseElseSuite() {
        if (parser.matchKeyword("else")) {
            return parseSuite();
        }
        return Collections.emptyList();
    }

    private Statement parseFunctionDef() {
        SourceLocation loc = parser.location();
        parser.expectKeyword("def");
        Token name = parser.expectIdentifier("Expected function name");

        parser.expectOp("(");
        List<Parameter> params = new ArrayList<Parameter>();
        List<Expression> defaults = new ArrayList<Expression>();
        while (!parser.checkOp(")")) {
            Token paramName = parser.expectIdentifier("Expected parameter name");
            Expression annotation = null;
            if (parser.matchOp(":")) {
                annotation = parser.parseExpression();
            }
            params.add(new Parameter(parser.locationOf(paramName), paramName.getText(), annotation));
            if (parser.matchOp("=")) {
                defaults.add(parser.parseExpression());
            } else if (!defaults.isEmpty()) {
                throw new ParseException("Non-default parameter follows default parameter", paramName);
            }
            if (!parser.matchOp(",")) break;
        }
        parser.expectOp(")");

        Expression returnType = null;
        if (parser.matchOp("->")) {
            returnType = parser.parseExpression();
        }
        List<Statement> body = parseSuite();

        FunctionDef def = new FunctionDef(loc, name.getText(), new Arguments(params, defaults), body, returnType);
        def.setNameLocation(parser.locationOf(name));
        return def;
    }

    /**
     * 解析 ':' 之后的语句体：同一行的单条语句，或 NEWLINE INDENT ... DEDENT 缩进块
     */
    private List<Statement> parseSuite() {
        parser.expectOp(":");
        if (!parser.match(NEWLINE)) {
            Statement stmt = parseSimpleStatement();
            endOfLine();
            return Collections.singletonList(stmt);
        }

        parser.expect(INDENT, "Expected an indented block");
        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(DEDENT) && !parser.isAtEnd()) {
            statements.add(parseStatement());
        }
        parser.expect(DEDENT, "Expected end of indented block");
        return statements;
    }

    private boolean atLineEnd() {
        return parser.check(NEWLINE) || parser.isAtEnd();
    }

    private void endOfLine() {
        if (parser.checkOp(";")) {
            throw new ParseException("Multiple statements on one line are not supported", parser.current);
        }
        if (parser.isAtEnd()) {
            return;
        }
        parser.expect(NEWLINE, "Expected end of line");
    }
}
