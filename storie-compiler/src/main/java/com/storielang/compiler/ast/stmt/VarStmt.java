package com.storielang.compiler.ast.stmt;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.expr.Expression;

/**
 * var / let 声明
 *
 * <p>两者求值行为相同：都在当前帧（重新）绑定名称。let 不强制不可变。</p>
 */
public class VarStmt extends Statement {
    private final DeclKind kind;
    private final String name;
    private final Expression initializer;

    public VarStmt(SourceLocation location, DeclKind kind, String name, Expression initializer) {
        super(location);
        this.kind = kind;
        this.name = name;
        this.initializer = initializer;
    }

    public DeclKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarStmt(this, context);
    }

    public enum DeclKind {
        VAR("var"),
        LET("let");

        private final String keyword;

        DeclKind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }
}
