package org.csu.minipy.compiler.ir.instruction;

import org.csu.minipy.compiler.ir.operand.AttributePath;
import org.csu.minipy.compiler.ir.operand.Operand;

import java.util.List;

/**
 * store value -> target
 *
 * @param target 具名变量或属性路径
 */
public record StoreInstruction(Operand value, Operand target) implements IrInstruction {

    @Override
    public String render() {
        return "store " + value.render() + " -> " + target.render();
    }

    @Override
    public List<Operand> uses() {
        // 写属性时需要读取接收者
        if (target instanceof AttributePath path) {
            return List.of(value, path.base());
        }
        return List.of(value);
    }

    @Override
    public String toString() {
        return render();
    }
}
