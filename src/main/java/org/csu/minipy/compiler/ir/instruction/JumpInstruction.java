package org.csu.minipy.compiler.ir.instruction;

/**
 * jump L
 */
public record JumpInstruction(String targetLabel) implements IrInstruction {

    @Override
    public String render() {
        return "jump " + targetLabel;
    }

    @Override
    public String toString() {
        return render();
    }
}
