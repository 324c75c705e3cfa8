package org.csu.minipy.compiler.ir.instruction;

/**
 * 跳转目标 L1:
 */
public record LabelInstruction(String id) implements IrInstruction {

    @Override
    public String render() {
        return id + ":";
    }

    @Override
    public String toString() {
        return render();
    }
}
