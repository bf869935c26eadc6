package com.kernlang.syntax.lexer;

/**
 * Kern 词法单元类型
 */
public enum TokenType {
    // === 标识符 ===
    IDENTIFIER("identifier"),   // [a-z][a-z0-9_]*

    // === 标点 ===
    LPAREN("\"(\""),
    RPAREN("\")\""),
    DOT("\".\""),
    COLON("\":\""),

    // === 保留符号 ===
    LAMBDA("\"λ\""),            // λ 抽象
    PI("\"Π\""),                // Π 类型
    SIGMA("\"Σ\""),             // Σ 类型
    BOX("\"□\""),               // 宇宙

    // === 特殊 ===
    EOF("end of input");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    /**
     * 错误信息中“期望的 token”使用的名称
     */
    public String getDisplay() {
        return display;
    }

    /**
     * 是否为绑定器前缀
     */
    public boolean isBinder() {
        return this == LAMBDA || this == PI || this == SIGMA;
    }

    /**
     * 是否可以开始一个原子表达式
     */
    public boolean isAtomStart() {
        return this == IDENTIFIER || this == LPAREN || this == BOX;
    }
}
