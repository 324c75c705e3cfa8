package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;
import org.csu.minipy.compiler.ir.operand.Temp;

import java.util.List;
import java.util.Optional;

/**
 * [t =] call f(args)
 *
 * @param result 结果临时变量，可以为 null
 */
public record CallInstruction(Temp result, String callee, List<Operand> arguments) implements IrInstruction {

    public CallInstruction {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String render() {
        return Operands.resultPrefix(result) + "call " + callee + "(" + Operands.join(arguments) + ")";
    }

    @Override
    public Optional<Temp> definedTemp() {
        return Optional.ofNullable(result);
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
