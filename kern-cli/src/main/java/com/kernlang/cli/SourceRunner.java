package com.kernlang.cli;

import com.kernlang.syntax.ast.Exp;
import com.kernlang.syntax.codec.CoreCodec;
import com.kernlang.syntax.codec.JsonCodec;
import com.kernlang.syntax.error.KernException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 格式化、检查、导出执行器
 *
 * <p>每个输入只包含一个表达式。返回值即进程退出码。</p>
 */
public class SourceRunner {
    private static final Logger LOG = Logger.getLogger(SourceRunner.class.getName());

    public static final int EXIT_OK = 0;
    /** 解码失败，或 --check 发现非规范输入 */
    public static final int EXIT_DECODE = 1;
    public static final int EXIT_IO = 2;

    /** 解析递归深度与嵌套深度成正比，超出线程栈时报告此错误 */
    static final String NESTING_TOO_DEEP = "expression nested too deeply";

    private final PrintWriter out;
    private final PrintWriter err;
    private final InputStream in;

    public SourceRunner(PrintWriter out, PrintWriter err) {
        this(out, err, System.in);
    }

    public SourceRunner(PrintWriter out, PrintWriter err, InputStream in) {
        this.out = out;
        this.err = err;
        this.in = in;
    }

    /**
     * 解码并输出规范形式
     */
    public int format(String source, boolean showIndices) {
        Exp exp = decode(source);
        if (exp == null) {
            return EXIT_DECODE;
        }
        out.println(CoreCodec.withShowIndices(showIndices).encode(exp));
        out.flush();
        return EXIT_OK;
    }

    /**
     * 检查输入是否已是规范形式
     */
    public int check(String name, String source) {
        Exp exp = decode(source);
        if (exp == null) {
            return EXIT_DECODE;
        }
        if (!CoreCodec.create().encode(exp).equals(normalize(source))) {
            err.println("未规范化: " + name);
            err.flush();
            return EXIT_DECODE;
        }
        return EXIT_OK;
    }

    public int printFile(String file, boolean showIndices) {
        String source = readFile(file);
        return source == null ? EXIT_IO : format(source, showIndices);
    }

    public int checkFile(String file) {
        String source = readFile(file);
        return source == null ? EXIT_IO : check(file, source);
    }

    /**
     * 把规范形式写回文件
     */
    public int formatFile(String file) {
        String source = readFile(file);
        if (source == null) {
            return EXIT_IO;
        }
        Exp exp = decode(source);
        if (exp == null) {
            return EXIT_DECODE;
        }
        try {
            String canonical = CoreCodec.create().encode(exp) + "\n";
            Files.write(Paths.get(file), canonical.getBytes(StandardCharsets.UTF_8));
            out.println("已格式化: " + file);
            out.flush();
            return EXIT_OK;
        } catch (IOException e) {
            LOG.log(Level.FINE, "Failed to write " + file, e);
            err.println("错误: 写入文件失败 - " + file + ": " + e.getMessage());
            err.flush();
            return EXIT_IO;
        }
    }

    /**
     * 输出 JSON 编码
     */
    public int dump(String source, boolean pretty) {
        Exp exp = decode(source);
        if (exp == null) {
            return EXIT_DECODE;
        }
        out.println(new JsonCodec(pretty).encodeToString(exp));
        out.flush();
        return EXIT_OK;
    }

    /**
     * 读取文件；失败时输出错误并返回 null
     */
    public String readFile(String file) {
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + file);
            err.flush();
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.FINE, "Failed to read " + file, e);
            err.println("错误: 读取文件失败 - " + file + ": " + e.getMessage());
            err.flush();
            return null;
        }
    }

    public String readStdin() {
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            byte[] chunk = new byte[4096];
            int n;
            while ((n = in.read(chunk)) >= 0) {
                buffer.write(chunk, 0, n);
            }
            return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.FINE, "Failed to read stdin", e);
            err.println("错误: 读取标准输入失败: " + e.getMessage());
            err.flush();
            return null;
        }
    }

    /**
     * 解码；失败时输出错误并返回 null
     */
    private Exp decode(String source) {
        try {
            return CoreCodec.create().decode(source.replace("\r\n", "\n"));
        } catch (KernException e) {
            err.println("解码错误: " + e.getMessage());
            err.flush();
            return null;
        } catch (StackOverflowError e) {
            LOG.log(Level.FINE, "Expression nested too deeply", e);
            err.println("解码错误: " + NESTING_TOO_DEEP);
            err.flush();
            return null;
        }
    }

    /**
     * 统一换行符并去掉首尾空白
     */
    static String normalize(String source) {
        return source.replace("\r\n", "\n").trim();
    }
}
