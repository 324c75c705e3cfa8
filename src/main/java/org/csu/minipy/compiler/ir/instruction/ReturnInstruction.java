package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;

import java.util.List;

/**
 * return [value]
 *
 * @param value 返回值，裸 return 时为 null
 */
public record ReturnInstruction(Operand value) implements IrInstruction {

    @Override
    public String render() {
        return value == null ? "return" : "return " + value.render();
    }

    @Override
    public List<Operand> uses() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public String toString() {
        return render();
    }
}
