package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;
import org.csu.minipy.compiler.ir.operand.Temp;

import java.util.List;
import java.util.Optional;

/**
 * [t =] call receiver.method(args)
 */
public record MethodCallInstruction(
        Temp result,
        Operand receiver,
        String methodName,
        List<Operand> arguments
) implements IrInstruction {

    public MethodCallInstruction {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String render() {
        return Operands.resultPrefix(result) + "call " + receiver.render() + "." + methodName
                + "(" + Operands.join(arguments) + ")";
    }

    @Override
    public Optional<Temp> definedTemp() {
        return Optional.ofNullable(result);
    }

    @Override
    public List<Operand> uses() {
        return Operands.concat(receiver, arguments);
    }

    @Override
    public String toString() {
        return render();
    }
}
