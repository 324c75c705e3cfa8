package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;
import org.csu.minipy.compiler.ir.operand.Temp;

import java.util.List;
import java.util.Optional;

/**
 * @description: 三地址码 (TAC) 指令
 *
 * 每条指令最多一个运算，按位置寻址于所属函数的指令列表中。
 * {@link #render()} 给出固定、稳定的文本格式，下游渲染和测试按字符串精确匹配。
 */
public sealed interface IrInstruction
        permits AssignInstruction, StoreInstruction, CallInstruction, MethodCallInstruction,
        NewInstruction, BinaryOpInstruction, UnaryOpInstruction, ReturnInstruction,
        LabelInstruction, CondJumpInstruction, JumpInstruction {

    String render();

    /**
     * @return 该指令定义的临时变量 (结果)
     */
    default Optional<Temp> definedTemp() {
        return Optional.empty();
    }

    /**
     * @return 该指令读取的操作数，按渲染顺序
     */
    default List<Operand> uses() {
        return List.of();
    }
}
