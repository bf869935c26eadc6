package com.kernlang.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SourceRunner 测试")
class SourceRunnerTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private SourceRunner runner(String stdin) {
        return new SourceRunner(new PrintWriter(out), new PrintWriter(err),
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("读取标准输入")
    void testReadStdin() {
        SourceRunner runner = runner("Πa : □ . a\n");
        String source = runner.readStdin();
        assertThat(source).isEqualTo("Πa : □ . a\n");
        assertThat(runner.check("<stdin>", source)).isEqualTo(SourceRunner.EXIT_OK);
    }

    @Test
    @DisplayName("CRLF 输入的错误偏移不受影响")
    void testCrlfOffsets() {
        assertThat(runner("").format("f\r\n)", false)).isEqualTo(SourceRunner.EXIT_DECODE);
        assertThat(err.toString()).contains("at location: 2..3");
    }

    @Test
    @DisplayName("规范化只处理换行与首尾空白")
    void testNormalize() {
        assertThat(SourceRunner.normalize("  f x\r\n")).isEqualTo("f x");
        assertThat(SourceRunner.normalize("f  x")).isEqualTo("f  x");
    }
}
