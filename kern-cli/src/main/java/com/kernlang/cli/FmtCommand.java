package com.kernlang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli fmt 子命令：输出规范编码
 */
@Command(name = "fmt", description = "把表达式格式化为规范编码")
public class FmtCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(arity = "0..*", description = "源码文件路径（省略时读取标准输入）")
    List<String> files;

    @Option(names = "-e", description = "直接格式化给定的表达式")
    String expression;

    @Option(names = "--show-indices", description = "绑定变量显示为 De Bruijn 索引")
    boolean showIndices;

    @Option(names = "--check", description = "只检查是否已是规范形式，否则以 1 退出")
    boolean check;

    @Option(names = {"-w", "--write"}, description = "把规范形式写回文件（只用于文件参数）")
    boolean write;

    @Override
    public Integer call() {
        CommandLine cmd = spec.commandLine();
        if (write && (expression != null || files == null || files.isEmpty())) {
            throw new ParameterException(cmd, "--write 只能用于文件参数，不能与 -e 或标准输入一起使用");
        }
        SourceRunner runner = new SourceRunner(cmd.getOut(), cmd.getErr());
        if (expression != null) {
            return check ? runner.check("<expr>", expression) : runner.format(expression, showIndices);
        }
        if (files == null || files.isEmpty()) {
            String source = runner.readStdin();
            if (source == null) {
                return SourceRunner.EXIT_IO;
            }
            return check ? runner.check("<stdin>", source) : runner.format(source, showIndices);
        }
        int status = SourceRunner.EXIT_OK;
        for (String file : files) {
            int result;
            if (check) {
                result = runner.checkFile(file);
            } else if (write) {
                result = runner.formatFile(file);
            } else {
                result = runner.printFile(file, showIndices);
            }
            status = Math.max(status, result);
        }
        return status;
    }
}
