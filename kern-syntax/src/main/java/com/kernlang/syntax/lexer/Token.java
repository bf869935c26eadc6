package com.kernlang.syntax.lexer;

/**
 * 词法单元
 *
 * <p>{@code start}/{@code end} 是源码中的 char 偏移（左闭右开），{@code line}/{@code column} 从 1 开始。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final int start;
    private final int end;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, int start, int end, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return type == other.type && start == other.start && end == other.end
                && lexeme.equals(other.lexeme);
    }

    @Override
    public int hashCode() {
        return (type.hashCode() * 31 + lexeme.hashCode()) * 31 + start;
    }

    @Override
    public String toString() {
        return String.format("%s(%s) at %d..%d", type, lexeme, start, end);
    }
}
