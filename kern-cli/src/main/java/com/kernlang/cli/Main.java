package com.kernlang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * Kern CLI 入口点（picocli）
 */
@Command(name = "kern", version = "Kern v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {FmtCommand.class, DumpCommand.class, ReplCommand.class})
public class Main implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "-e", description = "解码表达式并输出规范形式")
    String expression;

    @Option(names = "--show-indices", description = "绑定变量显示为 De Bruijn 索引")
    boolean showIndices;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志（放在子命令之前）")
    void setVerbose(boolean verbose) {
        configureLogging(verbose ? Level.FINE : Level.WARNING);
    }

    @Override
    public Integer call() {
        CommandLine cmd = spec.commandLine();
        if (expression != null) {
            return new SourceRunner(cmd.getOut(), cmd.getErr()).format(expression, showIndices);
        }
        new ReplRunner(showIndices).run();
        return SourceRunner.EXIT_OK;
    }

    /**
     * 创建配置好的命令行对象（测试也通过它执行命令）
     */
    public static CommandLine commandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        configureLogging(Level.WARNING);

        // λ、Π、Σ、□ 需要控制台使用正确的编码输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = commandLine();
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(commandLine().execute(args));
        }
    }

    /**
     * 日志输出到 stderr，不干扰 stdout 上的编码结果
     */
    static void configureLogging(Level level) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(System.err, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(level);
        rootLogger.addHandler(stderrHandler);
        rootLogger.setLevel(level);
        Logger.getLogger("com.kernlang").setLevel(level);
    }

    /**
     * 获取控制台实际使用的字符编码名；native.encoding（Java 17+）反映操作系统原生编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
