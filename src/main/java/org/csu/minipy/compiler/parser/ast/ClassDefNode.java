package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * AST 节点: 表示一个类定义，类体中只允许方法定义
 *
 * @param baseName 唯一的基类名，没有基类时为 null
 */
public record ClassDefNode(
        String name,
        String baseName,
        List<FunctionDefNode> methods,
        SourcePosition position
) implements StatementNode {

    public ClassDefNode {
        methods = List.copyOf(methods);
    }

    public boolean hasBase() {
        return baseName != null;
    }

    @Override
    public String kind() {
        return "ClassDef";
    }

    @Override
    public String detail() {
        return hasBase() ? name + "(" + baseName + ")" : name;
    }

    @Override
    public List<AstChild> children() {
        return AstChildren.of("method", methods);
    }
}
