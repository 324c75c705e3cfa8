package org.csu.minipy.compiler.ir.operand;

import org.csu.minipy.compiler.parser.ast.LiteralType;

/**
 * 字面量操作数，字符串渲染时带引号
 */
public record Literal(LiteralType type, String text) implements Operand {

    @Override
    public String render() {
        return type.render(text);
    }

    @Override
    public String toString() {
        return render();
    }
}
