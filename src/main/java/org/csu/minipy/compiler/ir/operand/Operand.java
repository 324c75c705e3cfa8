package org.csu.minipy.compiler.ir.operand;

/**
 * IR 指令的"值"操作数：临时变量、具名变量、字面量或属性路径
 */
public sealed interface Operand permits Temp, Variable, Literal, AttributePath {

    /**
     * @return 操作数在 IR 文本中的固定写法
     */
    String render();
}
