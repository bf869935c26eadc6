package com.kernlang.syntax.error;

import com.kernlang.syntax.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * 解码错误：文本（或其他编码）无法还原为表达式。
 *
 * <p>词法错误、语法错误以及构造绑定器时遇到的 {@link OverflowException} 都汇总为此类型，
 * 并携带足以定位源码区间的偏移量。偏移量以 Java 字符串的 char 下标计。</p>
 */
public class DecodeException extends KernException {

    /**
     * 解码错误种类
     */
    public enum Kind {
        /** 词法分析器无法识别的字符 */
        INVALID_TOKEN,
        /** 语法仍需要更多 token，但输入已结束 */
        END_OF_STREAM,
        /** 遇到合法 token，但语法期望的是其他 token（或不再期望任何 token） */
        UNEXPECTED_TOKEN,
        /** 构造表达式时遇到系统级错误 */
        SYSTEM,
        /** 结构化编码（如 JSON）不符合表达式格式 */
        MALFORMED
    }

    private final Kind kind;
    private final int start;
    private final int end;
    private final Token token;
    private final List<String> expected;

    private DecodeException(Kind kind, String message, int start, int end, Token token,
                            List<String> expected, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.token = token;
        this.expected = expected;
    }

    public static DecodeException invalidToken(int offset) {
        return new DecodeException(Kind.INVALID_TOKEN,
                "invalid token, at location " + offset,
                offset, offset, null, Collections.<String>emptyList(), null);
    }

    public static DecodeException endOfStream(int offset, List<String> expected) {
        return new DecodeException(Kind.END_OF_STREAM,
                "unexpected end of stream, at location: " + offset + ", expected: " + String.join(" | ", expected),
                offset, offset, null, Collections.unmodifiableList(expected), null);
    }

    public static DecodeException unexpectedToken(Token token, List<String> expected) {
        String accepted = expected.isEmpty() ? "none" : String.join(" | ", expected);
        return new DecodeException(Kind.UNEXPECTED_TOKEN,
                "unexpected token: " + token.getLexeme() + ", at location: "
                        + token.getStart() + ".." + token.getEnd() + ", expected: " + accepted,
                token.getStart(), token.getEnd(), token, Collections.unmodifiableList(expected), null);
    }

    public static DecodeException system(OverflowException cause, int start, int end) {
        return new DecodeException(Kind.SYSTEM, cause.getMessage(),
                start, end, null, Collections.<String>emptyList(), cause);
    }

    public static DecodeException malformed(String message) {
        return new DecodeException(Kind.MALFORMED, message,
                -1, -1, null, Collections.<String>emptyList(), null);
    }

    public static DecodeException malformed(String message, Throwable cause) {
        return new DecodeException(Kind.MALFORMED, message,
                -1, -1, null, Collections.<String>emptyList(), cause);
    }

    public Kind getKind() {
        return kind;
    }

    /** 起始偏移；MALFORMED 时为 -1 */
    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /** 仅 UNEXPECTED_TOKEN 时非空 */
    public Token getToken() {
        return token;
    }

    public List<String> getExpected() {
        return expected;
    }

    /** SYSTEM 错误的原始溢出异常，其他种类返回 null */
    public OverflowException getSystemError() {
        return getCause() instanceof OverflowException ? (OverflowException) getCause() : null;
    }
}
