package com.storielang.compiler.ast.decl;

import com.storielang.compiler.ast.AstNode;
import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元）：顶层语句的有序序列
 */
public class Program extends AstNode {
    private final String fileName;
    private final List<Statement> statements;

    public Program(SourceLocation location, String fileName, List<Statement> statements) {
        super(location);
        this.fileName = fileName;
        this.statements = Collections.unmodifiableList(statements);
    }

    public String getFileName() {
        return fileName;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public int size() {
        return statements.size();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
