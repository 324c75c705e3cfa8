package org.csu.minipy.compiler.ir;

import org.csu.minipy.compiler.ir.instruction.IrInstruction;

import java.util.List;

/**
 * @description: 一个函数 (或方法) 的 IR
 *
 * @param qualifiedName 方法为 ClassName.method，嵌套函数为 outer.inner
 * @param parameters    形参名
 * @param instructions  按顺序排列的指令
 */
public record IrFunction(String qualifiedName, List<String> parameters, List<IrInstruction> instructions) {

    public IrFunction {
        parameters = List.copyOf(parameters);
        instructions = List.copyOf(instructions);
    }

    /**
     * @return 形如 function hello(name): 的头部
     */
    public String header() {
        return "function " + qualifiedName + "(" + String.join(", ", parameters) + "):";
    }
}
