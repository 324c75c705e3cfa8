package org.csu.minipy.engine;

import org.csu.minipy.compiler.parser.ast.AstChild;
import org.csu.minipy.compiler.parser.ast.AstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 将 AST 转换为可视化使用的两种形式：
 * 嵌套的树结构 (节点编号按先序遍历分配，从 0 开始) 和逐行缩进的文本。
 */
public class AstTreeFormatter {

    private static final String INDENT = "  ";

    public record AstTree(int id, String name, String value, List<AstTree> children) {
        public AstTree {
            children = List.copyOf(children);
        }
    }

    public static AstTree toTree(AstNode root) {
        return buildTree(root, new int[]{0});
    }

    private static AstTree buildTree(AstNode node, int[] nextId) {
        int id = nextId[0]++;
        List<AstTree> children = new ArrayList<>();
        for (AstChild child : node.children()) {
            children.add(buildTree(child.node(), nextId));
        }
        return new AstTree(id, node.kind(), node.detail(), children);
    }

    /**
     * @return 每个节点一行，形如 Kind(detail)，每深一层缩进两个空格
     */
    public static List<String> toLines(AstNode root) {
        List<String> lines = new ArrayList<>();
        appendLines(root, 0, lines);
        return lines;
    }

    public static String toText(AstNode root) {
        return String.join("\n", toLines(root));
    }

    private static void appendLines(AstNode node, int depth, List<String> lines) {
        String label = node.detail() == null ? node.kind() : node.kind() + "(" + node.detail() + ")";
        lines.add(INDENT.repeat(depth) + label);
        for (AstChild child : node.children()) {
            appendLines(child.node(), depth + 1, lines);
        }
    }
}
