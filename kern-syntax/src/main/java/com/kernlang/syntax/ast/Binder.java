package com.kernlang.syntax.ast;

/**
 * 绑定器：引入符号 {@code sym}（类型为 {@code type}），作用域覆盖 {@code body}。
 *
 * <p>{@link Abs}、{@link Prd}、{@link Sum} 形状相同，只有前缀不同，编码器通过此接口统一处理。
 * 各自的静态工厂 {@code of(sym, type, body)} 在构造前对 {@code body} 执行一次索引化，
 * 是自由符号变为绑定索引的唯一途径。</p>
 */
public interface Binder {

    /**
     * 显示用前缀："λ"、"Π" 或 "Σ"
     */
    String prefix();

    Sym getSym();

    Exp getType();

    Exp getBody();
}
