package com.storielang.compiler.ast;

import com.storielang.compiler.ast.decl.Program;
import com.storielang.compiler.ast.expr.*;
import com.storielang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    default R visitProgram(Program node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitVarStmt(VarStmt node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitProcStmt(ProcStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }
}
