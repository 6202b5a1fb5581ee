package com.storielang.compiler.ast.stmt;

import com.storielang.compiler.ast.AstVisitor;
import com.storielang.compiler.ast.SourceLocation;
import com.storielang.compiler.ast.decl.Parameter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * proc 声明
 */
public class ProcStmt extends Statement {
    private final String name;
    private final List<Parameter> params;
    private final Block body;

    public ProcStmt(SourceLocation location, String name, List<Parameter> params, Block body) {
        super(location);
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public List<String> getParamNames() {
        List<String> names = new ArrayList<>(params.size());
        for (Parameter p : params) {
            names.add(p.getName());
        }
        return names;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProcStmt(this, context);
    }
}
