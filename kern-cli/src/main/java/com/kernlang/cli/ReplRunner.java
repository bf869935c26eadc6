package com.kernlang.cli;

import com.kernlang.syntax.ast.Exp;
import com.kernlang.syntax.codec.CoreCodec;
import com.kernlang.syntax.codec.JsonCodec;
import com.kernlang.syntax.error.KernException;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * jline REPL 交互模式
 *
 * <p>每行输入一个表达式，输出其规范编码。括号未闭合时自动续行。</p>
 */
public class ReplRunner {

    private static final String VERSION = "0.1.0";

    private final PrintStream out;
    private boolean showIndices;
    private boolean json;

    public ReplRunner(boolean showIndices) {
        this(showIndices, System.out);
    }

    ReplRunner(boolean showIndices, PrintStream out) {
        this.showIndices = showIndices;
        this.out = out;
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("Kern v" + VERSION);
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, "... ")
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            System.err.println("终端初始化失败: " + e.getMessage());
            // 回退到简单模式
            runFallbackLoop();
        }

        out.println("\n再见！");
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        StringBuilder buffer = new StringBuilder();

        while (true) {
            try {
                String line = reader.readLine(buffer.length() > 0 ? "... " : "kern> ");
                if (line == null) break;
                if (!accept(buffer, line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                buffer.setLength(0);
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    private void runFallbackLoop() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        StringBuilder buffer = new StringBuilder();

        while (true) {
            try {
                out.print(buffer.length() > 0 ? "... " : "kern> ");
                out.flush();

                String line = reader.readLine();
                if (line == null) break;
                if (!accept(buffer, line)) break;
            } catch (IOException e) {
                System.err.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * 处理一行输入
     *
     * @return false 表示退出
     */
    boolean accept(StringBuilder buffer, String line) {
        if (buffer.length() == 0 && line.trim().startsWith(":")) {
            return handleCommand(line.trim());
        }

        buffer.append(line).append('\n');
        if (hasUnclosedParens(buffer)) {
            return true;
        }

        String source = buffer.toString();
        buffer.setLength(0);
        if (!source.trim().isEmpty()) {
            evaluateAndPrint(source);
        }
        return true;
    }

    private void evaluateAndPrint(String source) {
        try {
            Exp exp = CoreCodec.create().decode(source);
            if (json) {
                out.println(new JsonCodec(true).encodeToString(exp));
            } else {
                out.println(CoreCodec.withShowIndices(showIndices).encode(exp));
            }
        } catch (KernException e) {
            out.println("错误: " + e.getMessage());
        } catch (StackOverflowError e) {
            out.println("错误: " + SourceRunner.NESTING_TOO_DEEP);
        }
    }

    /**
     * REPL 命令
     *
     * @return false 表示退出
     */
    private boolean handleCommand(String command) {
        switch (command) {
            case ":quit":
            case ":q":
                return false;
            case ":indices":
                showIndices = !showIndices;
                out.println("显示索引: " + (showIndices ? "开" : "关"));
                return true;
            case ":json":
                json = !json;
                out.println("JSON 输出: " + (json ? "开" : "关"));
                return true;
            case ":help":
                out.println("  <表达式>   解码并输出规范形式，例如 λx : □ . x");
                out.println("  :indices   切换绑定变量的索引显示");
                out.println("  :json      切换 JSON 输出");
                out.println("  :quit      退出");
                return true;
            default:
                out.println("未知命令: " + command + "（输入 :help 查看帮助）");
                return true;
        }
    }

    boolean isShowIndices() {
        return showIndices;
    }

    boolean isJson() {
        return json;
    }

    /**
     * 检查是否有未闭合的括号
     */
    static boolean hasUnclosedParens(CharSequence text) {
        int parens = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') parens++;
            else if (c == ')') parens--;
        }
        return parens > 0;
    }
}
