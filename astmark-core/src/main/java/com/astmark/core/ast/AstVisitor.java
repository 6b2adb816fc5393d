package com.astmark.core.ast;

import com.astmark.core.ast.decl.*;
import com.astmark.core.ast.expr.*;
import com.astmark.core.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>每个方法默认转发到 {@link #visitNode}，实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    /** 未单独处理的节点 */
    default R visitNode(AstNode node, C ctx) { return null; }

    default R visitProgram(Program node, C ctx) { return visitNode(node, ctx); }

    // ============ 声明 ============

    default R visitFunctionDef(FunctionDef node, C ctx) { return visitNode(node, ctx); }

    default R visitArguments(Arguments node, C ctx) { return visitNode(node, ctx); }

    default R visitParameter(Parameter node, C ctx) { return visitNode(node, ctx); }

    // ============ 语句 ============

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitAssignStmt(AssignStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitAugAssignStmt(AugAssignStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitDeleteStmt(DeleteStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitPassStmt(PassStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitBreakStmt(BreakStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitIfStmt(IfStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitWhileStmt(WhileStmt node, C ctx) { return visitNode(node, ctx); }

    default R visitForStmt(ForStmt node, C ctx) { return visitNode(node, ctx); }

    // ============ 表达式 ============

    default R visitIdentifier(Identifier node, C ctx) { return visitNode(node, ctx); }

    default R visitLiteral(Literal node, C ctx) { return visitNode(node, ctx); }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitConditionalExpr(ConditionalExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitMemberExpr(MemberExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitIndexExpr(IndexExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitCallExpr(CallExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitKeyword(CallExpr.Keyword node, C ctx) { return visitNode(node, ctx); }

    default R visitTupleExpr(TupleExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitCollectionLiteral(CollectionLiteral node, C ctx) { return visitNode(node, ctx); }

    default R visitComprehensionExpr(ComprehensionExpr node, C ctx) { return visitNode(node, ctx); }

    default R visitComprehensionClause(ComprehensionClause node, C ctx) { return visitNode(node, ctx); }
}
