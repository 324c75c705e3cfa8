package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;

import java.util.List;

/**
 * if cond jump L —— 条件为真时跳转，否则顺序执行下一条
 */
public record CondJumpInstruction(Operand condition, String targetLabel) implements IrInstruction {

    @Override
    public String render() {
        return "if " + condition.render() + " jump " + targetLabel;
    }

    @Override
    public List<Operand> uses() {
        return List.of(condition);
    }

    @Override
    public String toString() {
        return render();
    }
}
