package com.kernlang.syntax.ast;

/**
 * 表达式：AST 的顶层实体。
 *
 * <p>封闭的和类型，仅有 {@link VarExp}、{@link App}、{@link Abs}、{@link Prd}、{@link Sum}、
 * {@link Unv} 六种变体（构造器包内可见）。节点构造完成后不可变，
 * 每个节点独占其子表达式，树中没有共享和环。</p>
 *
 * <p>{@link #toString()} 输出结构化的调试形式；规范文本由
 * {@link com.kernlang.syntax.codec.CoreCodec} 生成。</p>
 */
public abstract class Exp {

    Exp() {
    }

    public abstract <R, C> R accept(ExpVisitor<R, C> visitor, C context);
}
