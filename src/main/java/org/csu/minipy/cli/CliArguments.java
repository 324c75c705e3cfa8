package org.csu.minipy.cli;

import lombok.Getter;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 解析并保存 {@link AstCli} 的命令行参数: {@code <file> [--show-ir] [--help]}
 */
@Getter
public class CliArguments {

    private Path inputFile;
    private boolean showIr;
    private boolean help;

    // 使用 parse() 构造
    private CliArguments() {
    }

    /**
     * @throws IllegalArgumentException 参数不合法 (未知选项、缺少或多余的输入文件)
     */
    public static CliArguments parse(String[] args) {
        CliArguments parsed = new CliArguments();
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                parsed.help = true;
                return parsed; // --help 优先于其它参数
            }
            if (arg.equals("--show-ir")) {
                parsed.showIr = true;
                continue;
            }
            if (arg.startsWith("-")) {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
            if (parsed.inputFile != null) {
                throw new IllegalArgumentException("Only one input file may be given, found extra argument: " + arg);
            }
            parsed.inputFile = Paths.get(arg);
        }
        if (parsed.inputFile == null) {
            throw new IllegalArgumentException("Missing input file");
        }
        return parsed;
    }

    public static String usage() {
        return "Usage: AstCli <file> [--show-ir] [--help]\n"
                + "  <file>      MiniPy source file to analyze\n"
                + "  --show-ir   also print the three-address code\n"
                + "  --help      show this message";
    }
}
