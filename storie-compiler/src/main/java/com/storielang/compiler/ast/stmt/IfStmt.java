package com.storielang.compiler.ast.stmt;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * If 语句：主分支、零个或多个 elif 分支、可选 else 块
 */
public class IfStmt extends Statement {
    private final IfBranch primary;
    private final List<IfBranch> elifBranches;
    private final Block elseBranch;  // 可选

    public IfStmt(SourceLocation location, IfBranch primary, List<IfBranch> elifBranches, Block elseBranch) {
        super(location);
        this.primary = primary;
        this.elifBranches = Collections.unmodifiableList(elifBranches);
        this.elseBranch = elseBranch;
    }

    public IfBranch getPrimary() {
        return primary;
    }

    public List<IfBranch> getElifBranches() {
        return elifBranches;
    }

    public Block getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
