package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;
import org.csu.minipy.compiler.ir.operand.Temp;

import java.util.List;
import java.util.Optional;

/**
 * t = left op right
 */
public record BinaryOpInstruction(Temp result, String operator, Operand left, Operand right) implements IrInstruction {

    @Override
    public String render() {
        return result.render() + " = " + left.render() + " " + operator + " " + right.render();
    }

    @Override
    public Optional<Temp> definedTemp() {
        return Optional.of(result);
    }

    @Override
    public List<Operand> uses() {
        return List.of(left, right);
    }

    @Override
    public String toString() {
        return render();
    }
}
