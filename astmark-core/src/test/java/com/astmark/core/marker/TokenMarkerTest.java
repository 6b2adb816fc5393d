package com.astmark.core.marker;

import com.astmark.core.AstTokens;
import com.astmark.core.GrammarVersion;
import com.astmark.core.TestTrees;
import com.astmark.core.ast.AstNode;
import com.astmark.core.ast.Program;
import com.astmark.core.ast.SourceLocation;
import com.astmark.core.ast.decl.Arguments;
import com.astmark.core.ast.decl.FunctionDef;
import com.astmark.core.ast.decl.Parameter;
import com.astmark.core.ast.expr.*;
import com.astmark.core.ast.stmt.*;
import com.astmark.core.lexer.Lexer;
import com.astmark.core.lexer.Token;
import com.astmark.core.lexer.TokenStream;
import com.astmark.core.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TokenMarker 单元测试：各类节点的区间与错误情形
 */
class TokenMarkerTest {

    private AstTokens mark(String source) {
        return AstTokens.parse(source, "<test>");
    }

    /** 先序列出给定类型节点的文本 */
    private <T extends AstNode> List<String> texts(AstTokens atok, Class<T> type) {
        return TestTrees.findAll(atok.getTree(), type).stream()
                .map(atok::getText)
                .collect(Collectors.toList());
    }

    private <T extends AstNode> String text(AstTokens atok, Class<T> type) {
        return atok.getText(TestTrees.findFirst(atok.getTree(), type));
    }

    // ============ 基本场景 ============

    @Nested
    @DisplayName("基本场景")
    class ScenarioTests {

        @Test
        @DisplayName("调用：从函数名到右括号")
        void testCall() {
            AstTokens atok = mark("foo(bar)\n");
            CallExpr call = TestTrees.findFirst(atok.getTree(), CallExpr.class);
            assertEquals("foo", call.getFirstToken().getText());
            assertEquals(")", call.getLastToken().getText());
            assertEquals("foo(bar)", atok.getText(call));
        }

        @Test
        @DisplayName("末尾逗号元组包含逗号")
        void testTrailingCommaTuple() {
            assertEquals("1, 2,", text(mark("1, 2,\n"), TupleExpr.class));
        }

        @Test
        @DisplayName("列表推导式从 [ 到 ]")
        void testListComprehension() {
            AstTokens atok = mark("[x for x in y]\n");
            assertEquals("[x for x in y]", text(atok, ComprehensionExpr.class));
            assertEquals("for x in y", text(atok, ComprehensionClause.class));
        }

        @Test
        @DisplayName("成员访问链")
        void testAttributeChain() {
            assertThat(texts(mark("a.b.c\n"), MemberExpr.class)).containsExactly("a.b.c", "a.b");
        }

        @Test
        @DisplayName("关键字参数包含参数名")
        void testKeywordArgument() {
            AstTokens atok = mark("f(x=1)\n");
            assertEquals("x=1", text(atok, CallExpr.Keyword.class));
            assertEquals("f(x=1)", text(atok, CallExpr.class));
        }

        @Test
        @DisplayName("带符号的字面量包含符号")
        void testSignedLiteral() {
            assertEquals("-1", text(mark("-1\n"), Literal.class));
            assertEquals("-1", text(mark("x = -1\n"), Literal.class));
            assertEquals("x=-2.5", text(mark("f(x=-2.5)\n"), CallExpr.Keyword.class));
        }

        @Test
        @DisplayName("小数点后接指数的浮点数是一个字面量")
        void testTrailingDotFloat() {
            AstTokens atok = mark("x = 1.e5\n");
            assertEquals("1.e5", text(atok, Literal.class));
            assertThat(TestTrees.findAll(atok.getTree(), MemberExpr.class)).isEmpty();
        }
    }

    // ============ 括号与嵌套 ============

    @Nested
    @DisplayName("括号与嵌套")
    class BracketTests {

        @Test
        @DisplayName("括号内的子表达式不含括号，外层补齐左括号")
        void testParenthesizedOperand() {
            AstTokens atok = mark("(a + b) * c\n");
            assertThat(texts(atok, BinaryExpr.class)).containsExactly("(a + b) * c", "a + b");
        }

        @Test
        @DisplayName("多层括号属于语句")
        void testNestedParens() {
            AstTokens atok = mark("((a))\n");
            assertEquals("((a))", text(atok, ExpressionStmt.class));
            assertEquals("a", text(atok, Identifier.class));
        }

        @Test
        @DisplayName("嵌套调用与下标")
        void testNestedCallsAndSubscripts() {
            assertThat(texts(mark("f(g(x), y)\n"), CallExpr.class)).containsExactly("f(g(x), y)", "g(x)");
            assertThat(texts(mark("a[1][2]\n"), IndexExpr.class)).containsExactly("a[1][2]", "a[1]");
            assertThat(texts(mark("f(a, (b))\n"), CallExpr.class)).containsExactly("f(a, (b))");
        }

        @Test
        @DisplayName("方法调用与括号内的调用对象")
        void testMethodCall() {
            AstTokens atok = mark("obj.method(1)\n");
            assertEquals("obj.method(1)", text(atok, CallExpr.class));
            assertEquals("obj.method", text(atok, MemberExpr.class));

            assertEquals("(f)(x)", text(mark("(f)(x)\n"), CallExpr.class));
            assertEquals("(a).b", text(mark("(a).b\n"), MemberExpr.class));
        }

        @Test
        @DisplayName("链式调用：外层调用包含自己的参数括号")
        void testChainedCalls() {
            assertThat(texts(mark("f()()\n"), CallExpr.class)).containsExactly("f()()", "f()");
            assertThat(texts(mark("f(x)()\n"), CallExpr.class)).containsExactly("f(x)()", "f(x)");
            assertThat(texts(mark("f(a)(b)(c)\n"), CallExpr.class)).containsExactly("f(a)(b)(c)", "f(a)(b)", "f(a)");

            AstTokens atok = mark("get()().x\n");
            assertEquals("get()().x", text(atok, MemberExpr.class));
            assertThat(texts(atok, CallExpr.class)).containsExactly("get()()", "get()");
        }

        @Test
        @DisplayName("调用结果上的下标与下标中的调用")
        void testSubscriptAfterCall() {
            AstTokens atok = mark("f()[0]\n");
            assertEquals("f()[0]", text(atok, IndexExpr.class));
            assertEquals("f()", text(atok, CallExpr.class));

            assertEquals("a[f()]", text(mark("a[f()]\n"), IndexExpr.class));
            assertEquals("(a)[1]", text(mark("(a)[1]\n"), IndexExpr.class));
        }

        @Test
        @DisplayName("空调用、空集合、空元组")
        void testEmpty() {
            assertEquals("f()", text(mark("f()\n"), CallExpr.class));
            assertEquals("[]", text(mark("x = []\n"), CollectionLiteral.class));
            assertEquals("{}", text(mark("x = {}\n"), CollectionLiteral.class));
            assertEquals("()", text(mark("x = ()\n"), TupleExpr.class));
            assertThat(texts(mark("x = (), 1\n"), TupleExpr.class)).containsExactly("(), 1", "()");
        }

        @Test
        @DisplayName("调用参数末尾逗号")
        void testCallTrailingComma() {
            assertEquals("f(a,)", text(mark("f(a,)\n"), CallExpr.class));
        }

        @Test
        @DisplayName("跨行调用")
        void testMultilineCall() {
            AstTokens atok = mark("foo(a,\n    b)\n");
            assertEquals("foo(a,\n    b)", text(atok, CallExpr.class));
        }

        @Test
        @DisplayName("括号内的元组不含括号，单元素元组含逗号")
        void testParenthesizedTuple() {
            assertEquals("1, 2", text(mark("x = (1, 2)\n"), TupleExpr.class));
            assertEquals("1,", text(mark("x = (1,)\n"), TupleExpr.class));
        }

        @Test
        @DisplayName("字典与集合字面量")
        void testDisplays() {
            assertEquals("{'a': 1, 'b': 2}", text(mark("d = {'a': 1, 'b': 2}\n"), CollectionLiteral.class));
            assertEquals("{1, 2}", text(mark("s = {1, 2}\n"), CollectionLiteral.class));
        }
    }

    // ============ 推导式 ============

    @Nested
    @DisplayName("推导式")
    class ComprehensionTests {

        @Test
        @DisplayName("集合推导式在两种语法版本下区间相同")
        void testSetComprehension() {
            MarkerConfig legacy = new MarkerConfig();
            legacy.setGrammarVersion(GrammarVersion.LEGACY);
            String source = "{x for x in y}\n";
            assertEquals("{x for x in y}", text(mark(source), ComprehensionExpr.class));
            assertEquals("{x for x in y}",
                    text(AstTokens.parse(source, "<test>", legacy), ComprehensionExpr.class));
        }

        @Test
        @DisplayName("字典推导式与元组目标")
        void testDictComprehension() {
            MarkerConfig legacy = new MarkerConfig();
            legacy.setGrammarVersion(GrammarVersion.LEGACY);
            for (AstTokens atok : new AstTokens[]{
                    mark("{k: v for k, v in items}\n"),
                    AstTokens.parse("{k: v for k, v in items}\n", "<test>", legacy)}) {
                assertEquals("{k: v for k, v in items}", text(atok, ComprehensionExpr.class));
                assertEquals("for k, v in items", text(atok, ComprehensionClause.class));
                assertEquals("k, v", text(atok, TupleExpr.class));
            }
        }

        @Test
        @DisplayName("带括号目标与条件的多子句推导式")
        void testMultipleClauses() {
            AstTokens atok = mark("[a for (a, b) in c if a for d in b]\n");
            assertEquals("[a for (a, b) in c if a for d in b]", text(atok, ComprehensionExpr.class));
            assertThat(texts(atok, ComprehensionClause.class))
                    .containsExactly("for (a, b) in c if a", "for d in b");
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("语句延伸到行尾，不含注释与换行")
        void testStatementExtendsToLineEnd() {
            AstTokens atok = mark("x = 1  # comment\ny = f(x)\n");
            assertThat(texts(atok, AssignStmt.class)).containsExactly("x = 1", "y = f(x)");
        }

        @Test
        @DisplayName("无结尾换行的最后一行")
        void testNoFinalNewline() {
            AstTokens atok = mark("x = 1");
            AssignStmt stmt = TestTrees.findFirst(atok.getTree(), AssignStmt.class);
            assertEquals("x = 1", atok.getText(stmt));
        }

        @Test
        @DisplayName("函数定义：返回类型在函数体之后访问")
        void testFunctionDef() {
            AstTokens atok = mark("def f(a, b: int = 2) -> str:\n    return a\n");
            assertEquals("def f(a, b: int = 2) -> str:\n    return a", text(atok, FunctionDef.class));
            assertEquals("a, b: int = 2", text(atok, Arguments.class));
            assertThat(texts(atok, Parameter.class)).containsExactly("a", "b: int");
            assertEquals("return a", text(atok, ReturnStmt.class));
        }

        @Test
        @DisplayName("无参数的形参列表继承函数的锚点")
        void testEmptyArguments() {
            AstTokens atok = mark("def g():\n    pass\n");
            Arguments args = TestTrees.findFirst(atok.getTree(), Arguments.class);
            assertEquals("def", args.getFirstToken().getText());
            assertEquals("def g():\n    pass", text(atok, FunctionDef.class));
        }

        @Test
        @DisplayName("if / elif / else")
        void testIfChain() {
            String source = "if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n";
            AstTokens atok = mark(source);
            assertThat(texts(atok, IfStmt.class)).containsExactly(
                    source.substring(0, source.length() - 1),
                    "elif b:\n    x = 2\nelse:\n    x = 3");
        }

        @Test
        @DisplayName("for / while 及同一行的语句体")
        void testLoops() {
            AstTokens atok = mark("for i in range(3): print(i)\nwhile x:\n    x -= 1\n");
            assertEquals("for i in range(3): print(i)", text(atok, ForStmt.class));
            assertEquals("while x:\n    x -= 1", text(atok, WhileStmt.class));
            assertEquals("x -= 1", text(atok, AugAssignStmt.class));
        }

        @Test
        @DisplayName("条件表达式的子节点不按源码顺序")
        void testConditional() {
            assertEquals("f(a) if b else c", text(mark("y = f(a) if b else c\n"), ConditionalExpr.class));
        }

        @Test
        @DisplayName("开头的注释与空行不属于程序")
        void testLeadingCommentAndBlankLines() {
            AstTokens atok = mark("# c\n\nx = 1\n");
            assertEquals("x = 1", atok.getText(atok.getTree()));
            assertEquals("x", atok.getTree().getFirstToken().getText());
        }

        @Test
        @DisplayName("只有注释的程序定位到 ENDMARKER")
        void testCommentOnlyProgram() {
            AstTokens atok = mark("# only\n");
            assertEquals(TokenType.ENDMARKER, atok.getTree().getFirstToken().getType());
            assertEquals("", atok.getText(atok.getTree()));
        }

        @Test
        @DisplayName("空程序的区间是 ENDMARKER")
        void testEmptyProgram() {
            AstTokens atok = mark("");
            Program program = atok.getTree();
            assertEquals(program.getFirstToken(), program.getLastToken());
            assertEquals("", atok.getText(program));
        }
    }

    // ============ 错误情形 ============

    @Nested
    @DisplayName("错误情形")
    class ErrorTests {

        private SourceLocation loc(Token token) {
            return SourceLocation.of("<test>", token);
        }

        @Test
        @DisplayName("括号不匹配：MALFORMED_INPUT，带节点类型与期望")
        void testMismatchedBracket() {
            // 0 foo, 1 (, 2 bar, 3 ]
            String source = "foo(bar]\n";
            List<Token> tokens = new Lexer(source, "<test>").scanTokens();
            TokenStream stream = new TokenStream(source, tokens);
            CallExpr call = new CallExpr(loc(tokens.get(1)), new Identifier(loc(tokens.get(0)), "foo"),
                    Collections.<Expression>singletonList(new Identifier(loc(tokens.get(2)), "bar")),
                    Collections.<CallExpr.Keyword>emptyList());

            MarkingException e = assertThrows(MarkingException.class, () -> new TokenMarker(stream).markTokens(call));
            assertEquals(MarkingException.Reason.MALFORMED_INPUT, e.getReason());
            assertEquals("CallExpr", e.getNodeKind());
            assertEquals("]", e.getToken().getText());
            assertEquals("OP ')'", e.getExpected());
            assertThat(e.getMessage()).contains("line 1, column 8").contains("[node: CallExpr]");
        }

        @Test
        @DisplayName("越过流尾：STREAM_BOUNDARY")
        void testStreamBoundary() {
            // 0 f, 1 NEWLINE, 2 ENDMARKER：找不到 '('
            String source = "f";
            List<Token> tokens = new Lexer(source, "<test>").scanTokens();
            TokenStream stream = new TokenStream(source, tokens);
            CallExpr call = new CallExpr(loc(tokens.get(0)), new Identifier(loc(tokens.get(0)), "f"),
                    Collections.<Expression>emptyList(), Collections.<CallExpr.Keyword>emptyList());

            MarkingException e = assertThrows(MarkingException.class, () -> new TokenMarker(stream).markTokens(call));
            assertEquals(MarkingException.Reason.STREAM_BOUNDARY, e.getReason());
            assertEquals("CallExpr", e.getNodeKind());
        }

        @Test
        @DisplayName("参数括号未闭合：MALFORMED_INPUT")
        void testUnclosedArguments() {
            // 0 f, 1 (, 2 NEWLINE, 3 ENDMARKER
            String source = "f(";
            List<Token> tokens = new Lexer(source, "<test>").scanTokens();
            TokenStream stream = new TokenStream(source, tokens);
            CallExpr call = new CallExpr(loc(tokens.get(1)), new Identifier(loc(tokens.get(0)), "f"),
                    Collections.<Expression>emptyList(), Collections.<CallExpr.Keyword>emptyList());

            MarkingException e = assertThrows(MarkingException.class, () -> new TokenMarker(stream).markTokens(call));
            assertEquals(MarkingException.Reason.MALFORMED_INPUT, e.getReason());
            assertEquals(TokenType.NEWLINE, e.getToken().getType());
            assertEquals("OP ')'", e.getExpected());
        }

        @Test
        @DisplayName("关键字参数名与 token 不一致")
        void testKeywordNameMismatch() {
            // 0 f, 1 (, 2 y, 3 =, 4 1, 5 )
            String source = "f(y=1)\n";
            List<Token> tokens = new Lexer(source, "<test>").scanTokens();
            TokenStream stream = new TokenStream(source, tokens);
            Literal one = new Literal(loc(tokens.get(4)), 1, Literal.LiteralKind.INT);
            CallExpr call = new CallExpr(loc(tokens.get(1)), new Identifier(loc(tokens.get(0)), "f"),
                    Collections.<Expression>emptyList(),
                    Collections.singletonList(new CallExpr.Keyword("x", one)));

            MarkingException e = assertThrows(MarkingException.class, () -> new TokenMarker(stream).markTokens(call));
            assertEquals("Keyword", e.getNodeKind());
            assertEquals("NAME 'x'", e.getExpected());
        }

        @Test
        @DisplayName("没有任何锚点的节点违反前置条件")
        void testNoAnchor() {
            String source = "x\n";
            TokenStream stream = new TokenStream(source, new Lexer(source, "<test>").scanTokens());
            Arguments orphan = new Arguments(Collections.<Parameter>emptyList(), Collections.<Expression>emptyList());
            assertThrows(IllegalStateException.class, () -> new TokenMarker(stream).markTokens(orphan));
        }
    }
}
