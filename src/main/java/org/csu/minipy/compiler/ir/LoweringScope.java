package org.csu.minipy.compiler.ir;

import lombok.AccessLevel;
import lombok.Getter;
import org.csu.minipy.compiler.ir.instruction.IrInstruction;
import org.csu.minipy.compiler.ir.instruction.ReturnInstruction;
import org.csu.minipy.compiler.ir.operand.Temp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * @description: 一个降级作用域 (模块顶层或单个函数体)
 * 持有该作用域独立的临时变量计数器、标签计数器和指令列表，以及正在降级的循环的标签栈。
 */
@Getter
class LoweringScope {

    /** 所属函数的限定名，模块顶层为 null */
    private final String qualifiedName;
    private final List<IrInstruction> instructions = new ArrayList<>();
    private int tempCount;
    private int labelCount;
    @Getter(AccessLevel.NONE)
    private final Deque<LoopLabels> loops = new ArrayDeque<>();

    /**
     * continue 跳回 condLabel，break 跳到 endLabel
     */
    record LoopLabels(String condLabel, String endLabel) {
    }

    LoweringScope(String qualifiedName) {
        this.qualifiedName = qualifiedName;
    }

    boolean isModule() {
        return qualifiedName == null;
    }

    Temp newTemp() {
        return new Temp(++tempCount);
    }

    String newLabel() {
        return "L" + (++labelCount);
    }

    void emit(IrInstruction instruction) {
        instructions.add(instruction);
    }

    /**
     * 为嵌套定义生成限定名
     */
    String qualify(String name) {
        return isModule() ? name : qualifiedName + "." + name;
    }

    void enterLoop(String condLabel, String endLabel) {
        loops.push(new LoopLabels(condLabel, endLabel));
    }

    void exitLoop() {
        loops.pop();
    }

    /**
     * @return 最内层循环的标签，不在循环中时为 null
     */
    LoopLabels innermostLoop() {
        return loops.peek();
    }

    boolean endsWithReturn() {
        return !instructions.isEmpty()
                && instructions.get(instructions.size() - 1) instanceof ReturnInstruction;
    }
}
