package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;
import org.csu.minipy.compiler.ir.operand.Temp;

import java.util.List;
import java.util.Optional;

/**
 * t = new ClassName(args)
 */
public record NewInstruction(Temp result, String className, List<Operand> arguments) implements IrInstruction {

    public NewInstruction {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String render() {
        return result.render() + " = new " + className + "(" + Operands.join(arguments) + ")";
    }

    @Override
    public Optional<Temp> definedTemp() {
        return Optional.of(result);
    }

    @Override
    public List<Operand> uses() {
        return arguments;
    }

    @Override
    public String toString() {
        return render();
    }
}
