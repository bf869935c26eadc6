package com.kernlang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.util.concurrent.Callable;

/**
 * picocli dump 子命令：输出表达式树的 JSON 编码
 */
@Command(name = "dump", description = "以 JSON 输出表达式树（保留索引与宇宙层级）")
public class DumpCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "源码文件路径（省略时读取标准输入）")
    String file;

    @Option(names = "-e", description = "直接导出给定的表达式")
    String expression;

    @Option(names = "--pretty", description = "缩进输出")
    boolean pretty;

    @Override
    public Integer call() {
        CommandLine cmd = spec.commandLine();
        SourceRunner runner = new SourceRunner(cmd.getOut(), cmd.getErr());
        String source;
        if (expression != null) {
            source = expression;
        } else if (file != null) {
            source = runner.readFile(file);
        } else {
            source = runner.readStdin();
        }
        if (source == null) {
            return SourceRunner.EXIT_IO;
        }
        return runner.dump(source, pretty);
    }
}
