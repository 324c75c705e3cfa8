package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;
import org.csu.minipy.compiler.ir.operand.Temp;

import java.util.List;
import java.util.Optional;

/**
 * t = -x 或 t = not x
 */
public record UnaryOpInstruction(Temp result, String operator, Operand operand) implements IrInstruction {

    @Override
    public String render() {
        String separator = Character.isLetter(operator.charAt(operator.length() - 1)) ? " " : "";
        return result.render() + " = " + operator + separator + operand.render();
    }

    @Override
    public Optional<Temp> definedTemp() {
        return Optional.of(result);
    }

    @Override
    public List<Operand> uses() {
        return List.of(operand);
    }

    @Override
    public String toString() {
        return render();
    }
}
