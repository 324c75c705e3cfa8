package org.csu.minipy.cli;

import org.csu.minipy.engine.AnalysisResult;
import org.csu.minipy.engine.AstTreeFormatter;
import org.csu.minipy.engine.FrontendProcessor;
import org.csu.minipy.engine.IrListingFormatter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * @description: 命令行入口
 * 读取一个源文件，打印 AST 的文本形式，指定 --show-ir 时再打印三地址码。
 *
 * 退出码: 0 成功；1 分析失败或文件不可读；2 参数错误。
 */
public class AstCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private static final String SEPARATOR = "-".repeat(50);

    private final FrontendProcessor processor;

    public AstCli() {
        this(new FrontendProcessor());
    }

    public AstCli(FrontendProcessor processor) {
        this.processor = processor;
    }

    public static void main(String[] args) {
        System.exit(new AstCli().run(args, System.out, System.err));
    }

    public int run(String[] args, PrintStream out, PrintStream err) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliArguments.usage());
            return EXIT_USAGE;
        }
        if (arguments.isHelp()) {
            out.println(CliArguments.usage());
            return EXIT_OK;
        }

        String source;
        try {
            source = Files.readString(arguments.getInputFile(), StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            err.println("Error: File " + arguments.getInputFile() + " is not valid UTF-8 text");
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("Error: Could not open file " + arguments.getInputFile());
            return EXIT_FAILURE;
        }

        AnalysisResult result = processor.analyze(source);
        if (!result.isSuccess()) {
            err.println(result.error().message());
            return EXIT_FAILURE;
        }

        out.println("Abstract Syntax Tree for " + arguments.getInputFile() + ":");
        out.println(SEPARATOR);
        out.println(AstTreeFormatter.toText(result.ast()));

        if (arguments.isShowIr()) {
            out.println();
            out.println("Intermediate Representation:");
            out.println(SEPARATOR);
            out.println(IrListingFormatter.format(result.ir()));
        }
        return EXIT_OK;
    }
}
