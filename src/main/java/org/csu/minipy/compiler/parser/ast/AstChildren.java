package org.csu.minipy.compiler.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * 构造子节点列表的小工具
 */
final class AstChildren {

    private AstChildren() {
    }

    static List<AstChild> of(String role, List<? extends AstNode> nodes) {
        List<AstChild> children = new ArrayList<>(nodes.size());
        for (AstNode node : nodes) {
            children.add(new AstChild(role, node));
        }
        return List.copyOf(children);
    }

    static List<AstChild> append(List<AstChild> children, String role, List<? extends AstNode> nodes) {
        List<AstChild> result = new ArrayList<>(children);
        result.addAll(of(role, nodes));
        return List.copyOf(result);
    }
}
