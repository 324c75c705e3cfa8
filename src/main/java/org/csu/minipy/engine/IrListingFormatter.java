package org.csu.minipy.engine;

import org.csu.minipy.compiler.ir.IrFunction;
import org.csu.minipy.compiler.ir.IrProgram;
import org.csu.minipy.compiler.ir.instruction.IrInstruction;
import org.csu.minipy.compiler.ir.instruction.LabelInstruction;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 将 IR 程序格式化为文本。
 */
public class IrListingFormatter {

    public static final String MODULE_SCOPE = "<module>";

    private static final String INDENT = "    ";

    /**
     * @return 作用域名 -> 指令文本；先是 {@value #MODULE_SCOPE}，再按声明顺序排列各函数。
     * 同名函数被重复定义时，第 n 次出现的键为 "name#n" (n >= 2)，每个函数都保留在结果中。
     */
    public static Map<String, List<String>> toMap(IrProgram program) {
        Map<String, List<String>> listing = new LinkedHashMap<>();
        Map<String, Integer> occurrences = new HashMap<>();
        listing.put(MODULE_SCOPE, render(program.topLevel()));
        for (IrFunction function : program.functions()) {
            String name = function.qualifiedName();
            int occurrence = occurrences.merge(name, 1, Integer::sum);
            String key = occurrence == 1 ? name : name + "#" + occurrence;
            listing.put(key, render(function.instructions()));
        }
        return listing;
    }

    /**
     * 完整的文本清单：每个函数以 "function name(params):" 开头，指令缩进四个空格，函数之间空一行；
     * 模块顶层指令 (若有) 列在最后。
     */
    public static String format(IrProgram program) {
        StringBuilder sb = new StringBuilder();
        for (IrFunction function : program.functions()) {
            sb.append(function.header()).append("\n");
            appendInstructions(sb, function.instructions());
            sb.append("\n");
        }
        if (!program.topLevel().isEmpty()) {
            sb.append(MODULE_SCOPE).append(":\n");
            appendInstructions(sb, program.topLevel());
        }
        return sb.toString().stripTrailing();
    }

    private static void appendInstructions(StringBuilder sb, List<IrInstruction> instructions) {
        for (IrInstruction instruction : instructions) {
            sb.append(instruction instanceof LabelInstruction ? "" : INDENT)
                    .append(instruction.render())
                    .append("\n");
        }
    }

    private static List<String> render(List<IrInstruction> instructions) {
        return instructions.stream().map(IrInstruction::render).collect(Collectors.toList());
    }
}
