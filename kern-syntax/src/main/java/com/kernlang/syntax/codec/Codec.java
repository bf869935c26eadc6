package com.kernlang.syntax.codec;

import com.kernlang.syntax.ast.Exp;
import com.kernlang.syntax.error.DecodeException;

/**
 * 表达式与编码类型 {@code T} 之间的双向映射
 */
public interface Codec<T> {

    /**
     * 把表达式编码为 {@code T}
     */
    T encode(Exp exp);

    /**
     * 把 {@code T} 解码为表达式
     *
     * @throws DecodeException 值不是合法编码
     */
    Exp decode(T val);
}
