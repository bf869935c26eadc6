package com.kernlang.syntax.error;

import com.kernlang.syntax.ast.Idx;
import com.kernlang.syntax.lexer.Token;
import com.kernlang.syntax.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("错误信息测试")
class DecodeExceptionTest {

    @Test
    @DisplayName("非法 token")
    void testInvalidToken() {
        DecodeException e = DecodeException.invalidToken(7);
        assertThat(e.getMessage()).isEqualTo("invalid token, at location 7");
        assertThat(e.getKind()).isEqualTo(DecodeException.Kind.INVALID_TOKEN);
        assertThat(e.getStart()).isEqualTo(7);
        assertThat(e.getToken()).isNull();
        assertThat(e.getExpected()).isEmpty();
    }

    @Test
    @DisplayName("输入提前结束")
    void testEndOfStream() {
        DecodeException e = DecodeException.endOfStream(4, Arrays.asList("identifier", "\"(\""));
        assertThat(e.getMessage()).isEqualTo("unexpected end of stream, at location: 4, expected: identifier | \"(\"");
        assertThat(e.getExpected()).containsExactly("identifier", "\"(\"");
    }

    @Test
    @DisplayName("意外的 token")
    void testUnexpectedToken() {
        Token token = new Token(TokenType.RPAREN, ")", 4, 5, 1, 5);
        DecodeException e = DecodeException.unexpectedToken(token, Collections.singletonList("\".\""));
        assertThat(e.getMessage()).isEqualTo("unexpected token: ), at location: 4..5, expected: \".\"");
        assertThat(e.getToken()).isEqualTo(token);
        assertThat(e.getEnd()).isEqualTo(5);
    }

    @Test
    @DisplayName("不期望任何 token 时显示 none")
    void testUnexpectedTokenNothingExpected() {
        Token token = new Token(TokenType.IDENTIFIER, "foo", 0, 3, 1, 1);
        DecodeException e = DecodeException.unexpectedToken(token, Collections.<String>emptyList());
        assertThat(e.getMessage()).endsWith("expected: none");
    }

    @Test
    @DisplayName("系统错误保留溢出原因")
    void testSystem() {
        OverflowException overflow = OverflowException.index(Idx.MAX_VALUE);
        DecodeException e = DecodeException.system(overflow, 0, 12);
        assertThat(e.getMessage()).isEqualTo("max limit 18446744073709551615 for indices has been reached");
        assertThat(e.getKind()).isEqualTo(DecodeException.Kind.SYSTEM);
        assertThat(e.getSystemError()).isSameAs(overflow);
        assertThat(e.getStart()).isZero();
        assertThat(e.getEnd()).isEqualTo(12);
        assertThat(e).isInstanceOf(KernException.class);
    }

    @Test
    @DisplayName("宇宙层级溢出信息")
    void testUniverseOverflowMessage() {
        assertThat(OverflowException.universe(Idx.MAX_VALUE).getMessage())
                .isEqualTo("max limit 18446744073709551615 for universe levels has been reached");
    }

    @Test
    @DisplayName("非系统错误没有溢出原因")
    void testNoSystemError() {
        assertThat(DecodeException.malformed("bad").getSystemError()).isNull();
        assertThat(DecodeException.malformed("bad", new IllegalStateException()).getSystemError()).isNull();
    }
}
