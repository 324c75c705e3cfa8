package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;
import org.csu.minipy.compiler.ir.operand.Temp;

import java.util.List;
import java.util.Optional;

/**
 * t = value
 */
public record AssignInstruction(Temp result, Operand value) implements IrInstruction {

    @Override
    public String render() {
        return result.render() + " = " + value.render();
    }

    @Override
    public Optional<Temp> definedTemp() {
        return Optional.of(result);
    }

    @Override
    public List<Operand> uses() {
        return List.of(value);
    }

    @Override
    public String toString() {
        return render();
    }
}
