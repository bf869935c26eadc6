package com.kernlang.syntax.lexer;

import com.kernlang.syntax.error.DecodeException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Logger;

/**
 * Kern 词法分析器
 *
 * <p>把文本分类为固定的 token 字母表：标识符、{@code ( ) . :} 以及 λ、Π、Σ、□ 四个保留符号。
 * 空白（空格、制表符、换行、换页）被跳过。无法识别的字符抛出
 * {@link DecodeException.Kind#INVALID_TOKEN}，携带该字符的起始偏移。</p>
 *
 * <p>{@link #nextToken()} 是流式接口，读到末尾后持续返回 EOF；
 * {@link #iterator()} 每次都从头开始扫描，不影响流式位置。</p>
 */
public class Lexer implements Iterable<Token> {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final String source;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    public Lexer(String source) {
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @throws DecodeException 遇到无法识别的字符
     */
    public Token nextToken() {
        skipWhitespace();

        start = current;
        startLine = line;
        startColumn = column;
        if (isAtEnd()) {
            return makeToken(TokenType.EOF);
        }

        char c = advance();
        switch (c) {
            case '(': return makeToken(TokenType.LPAREN);
            case ')': return makeToken(TokenType.RPAREN);
            case '.': return makeToken(TokenType.DOT);
            case ':': return makeToken(TokenType.COLON);
            case 'λ': return makeToken(TokenType.LAMBDA);
            case 'Π': return makeToken(TokenType.PI);
            case 'Σ': return makeToken(TokenType.SIGMA);
            case '□': return makeToken(TokenType.BOX);
            default:
                if (isLower(c)) {
                    return identifier();
                }
                LOG.fine("Invalid character '" + c + "' at offset " + start);
                throw DecodeException.invalidToken(start);
        }
    }

    /**
     * 扫描全部输入，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<Token>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (!token.is(TokenType.EOF));
        return tokens;
    }

    /**
     * 从头扫描的惰性 token 序列（不含 EOF）
     */
    @Override
    public Iterator<Token> iterator() {
        final Lexer fresh = new Lexer(source);
        return new Iterator<Token>() {
            private Token pending;

            @Override
            public boolean hasNext() {
                if (pending == null) {
                    pending = fresh.nextToken();
                }
                return !pending.is(TokenType.EOF);
            }

            @Override
            public Token next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Token token = pending;
                pending = null;
                return token;
            }
        };
    }

    private Token identifier() {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        return makeToken(TokenType.IDENTIFIER);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                advance();
                line++;
                column = 1;
            } else if (c == ' ' || c == '\t' || c == '\f') {
                advance();
            } else {
                break;
            }
        }
    }

    private Token makeToken(TokenType type) {
        return new Token(type, source.substring(start, current), start, current, startLine, startColumn);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private char peek() {
        return source.charAt(current);
    }

    /**
     * 文本是否恰好构成一个标识符 token
     */
    public static boolean isIdentifier(String text) {
        if (text.isEmpty() || !isLower(text.charAt(0))) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            if (!isIdentifierPart(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isLower(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isIdentifierPart(char c) {
        return isLower(c) || (c >= '0' && c <= '9') || c == '_';
    }
}
