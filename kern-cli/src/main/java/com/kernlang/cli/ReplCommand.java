package com.kernlang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * picocli repl 子命令：交互式解码与格式化
 */
@Command(name = "repl", description = "启动交互模式")
public class ReplCommand implements Runnable {

    @Option(names = "--show-indices", description = "绑定变量显示为 De Bruijn 索引")
    boolean showIndices;

    @Override
    public void run() {
        new ReplRunner(showIndices).run();
    }
}
