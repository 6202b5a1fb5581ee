package com.storielang.compiler.ast.decl;

import com.storielang.compiler.ast.SourceLocation;

/**
 * proc 参数：名称 + 类型名
 *
 * <p>类型名仅作文档用途，运行时不做检查。</p>
 */
public final class Parameter {
    private final SourceLocation location;
    private final String name;
    private final String typeName;

    public Parameter(SourceLocation location, String name, String typeName) {
        this.location = location;
        this.name = name;
        this.typeName = typeName;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return name + ": " + typeName;
    }
}
