package org.csu.minipy.compiler.parser.ast;

/**
 * 带角色名的子节点，例如 BinOp 的 "left" / "right"
 *
 * @param role 子节点在父节点中扮演的角色
 * @param node 子节点本身
 */
public record AstChild(String role, AstNode node) {
}
