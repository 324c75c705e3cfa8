package org.csu.minipy.compiler.ir;

import org.csu.minipy.compiler.ir.instruction.IrInstruction;

import java.util.List;
import java.util.Optional;

/**
 * @description: 一次编译的全部 IR：模块顶层指令 + 按声明顺序排列的函数
 */
public record IrProgram(List<IrInstruction> topLevel, List<IrFunction> functions) {

    public IrProgram {
        topLevel = List.copyOf(topLevel);
        functions = List.copyOf(functions);
    }

    public Optional<IrFunction> function(String qualifiedName) {
        return functions.stream()
                .filter(f -> f.qualifiedName().equals(qualifiedName))
                .findFirst();
    }
}
