package com.kernlang.syntax.parser;

import com.kernlang.syntax.ast.Abs;
import com.kernlang.syntax.ast.App;
import com.kernlang.syntax.ast.Exp;
import com.kernlang.syntax.ast.Prd;
import com.kernlang.syntax.ast.Sum;
import com.kernlang.syntax.ast.Sym;
import com.kernlang.syntax.ast.Unv;
import com.kernlang.syntax.ast.VarExp;
import com.kernlang.syntax.error.DecodeException;
import com.kernlang.syntax.error.OverflowException;
import com.kernlang.syntax.lexer.Lexer;
import com.kernlang.syntax.lexer.Token;
import com.kernlang.syntax.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static com.kernlang.syntax.lexer.TokenType.*;

/**
 * Kern 语法分析器（递归下降）
 *
 * <pre>
 * Exp         := Binder | Application
 * Binder      := ('λ' | 'Π' | 'Σ') Ident ':' Exp '.' Exp
 * Application := Atom+ Binder?
 * Atom        := Ident | '□' | '(' Exp ')'
 * </pre>
 *
 * <p>应用左结合：{@code a b c} 解析为 {@code (a b) c}。绑定器主体尽可能向右延伸，
 * 因此应用的最后一个参数可以是不带括号的绑定器，它吞掉外层表达式的剩余部分。</p>
 *
 * <p>绑定器通过 {@code Abs.of} 等工厂构造，索引溢出包装为
 * {@link DecodeException.Kind#SYSTEM}。递归深度与输入的嵌套深度成正比。</p>
 */
public class Parser {

    /** 一个完整表达式之后可以继续出现的 token：更多参数或尾随的绑定器 */
    private static final EnumSet<TokenType> CONTINUATION =
            EnumSet.of(IDENTIFIER, LPAREN, LAMBDA, PI, SIGMA, BOX);

    private final Lexer lexer;
    private Token current;
    private Token previous;

    public Parser(Lexer lexer) {
        this.lexer = lexer;
        advance();  // 读取第一个 token
    }

    /**
     * 解析完整输入为一个表达式，之后必须是输入结尾
     *
     * @throws DecodeException 词法、语法或索引错误
     */
    public Exp parse() {
        Exp exp = parseExp();
        if (!check(EOF)) {
            throw error(CONTINUATION);
        }
        return exp;
    }

    // ============ 产生式 ============

    Exp parseExp() {
        if (current.getType().isBinder()) {
            return parseBinder();
        }
        return parseApplication();
    }

    private Exp parseApplication() {
        Exp exp = parseAtom();
        while (true) {
            TokenType type = current.getType();
            if (type.isAtomStart()) {
                exp = App.of(exp, parseAtom());
            } else if (type.isBinder()) {
                return App.of(exp, parseBinder());  // 主体贪婪，应用到此结束
            } else {
                return exp;
            }
        }
    }

    private Exp parseAtom() {
        if (check(IDENTIFIER)) {
            return VarExp.free(advance().getLexeme());
        }
        if (match(BOX)) {
            return Unv.of();
        }
        if (match(LPAREN)) {
            Exp inner = parseExp();
            expectAfterExp(RPAREN);
            return inner;
        }
        throw error(CONTINUATION);
    }

    private Exp parseBinder() {
        Token prefix = advance();
        Sym sym = Sym.of(expect(IDENTIFIER).getLexeme());
        expect(COLON);
        Exp type = parseExp();
        expectAfterExp(DOT);
        Exp body = parseExp();
        try {
            switch (prefix.getType()) {
                case LAMBDA: return Abs.of(sym, type, body);
                case PI:     return Prd.of(sym, type, body);
                case SIGMA:  return Sum.of(sym, type, body);
                default:
                    throw new IllegalStateException("Not a binder prefix: " + prefix);
            }
        } catch (OverflowException e) {
            throw DecodeException.system(e, prefix.getStart(), previous.getEnd());
        }
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回刚消费的 token
     */
    private Token advance() {
        previous = current;
        current = lexer.nextToken();
        return previous;
    }

    private boolean check(TokenType type) {
        return current.getType() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error(EnumSet.of(type));
    }

    /**
     * 完整表达式之后期望 {@code closer}；表达式本身也可以继续，因此一并列入期望集合
     */
    private void expectAfterExp(TokenType closer) {
        if (match(closer)) {
            return;
        }
        EnumSet<TokenType> expected = EnumSet.copyOf(CONTINUATION);
        expected.add(closer);
        throw error(expected);
    }

    private DecodeException error(EnumSet<TokenType> expected) {
        List<String> names = new ArrayList<String>(expected.size());
        for (TokenType type : expected) {
            names.add(type.getDisplay());
        }
        if (check(EOF)) {
            return DecodeException.endOfStream(previous != null ? previous.getEnd() : 0, names);
        }
        return DecodeException.unexpectedToken(current, names);
    }
}
