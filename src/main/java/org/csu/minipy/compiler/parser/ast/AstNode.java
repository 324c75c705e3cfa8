package org.csu.minipy.compiler.parser.ast;

import java.util.List;

/**
 * @description: 所有 AST 节点的根接口
 *
 * 节点集合是封闭的 (sealed)，新增节点种类时所有遍历逻辑都需要同步修改。
 * 该接口提供的遍历契约足以支持 IR 生成以及外部序列化：
 * 节点种类名、可选的字面值/名称、按顺序排列的具名子节点。
 */
public sealed interface AstNode permits ModuleNode, StatementNode, ExpressionNode {

    SourcePosition position();

    /**
     * @return 节点种类的可读名称，例如 "FunctionDef"
     */
    String kind();

    /**
     * @return 节点附带的名称、运算符或字面值文本；没有时返回 null
     */
    default String detail() {
        return null;
    }

    /**
     * @return 按源码顺序排列的子节点
     */
    List<AstChild> children();
}
