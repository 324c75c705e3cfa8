package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.Operand;
import org.csu.minipy.compiler.ir.operand.Temp;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

final class Operands {

    private Operands() {
    }

    static String join(List<Operand> arguments) {
        return arguments.stream().map(Operand::render).collect(Collectors.joining(", "));
    }

    static String resultPrefix(Temp result) {
        return result == null ? "" : result.render() + " = ";
    }

    static List<Operand> concat(Operand first, List<Operand> rest) {
        List<Operand> all = new ArrayList<>(rest.size() + 1);
        all.add(first);
        all.addAll(rest);
        return List.copyOf(all);
    }
}
