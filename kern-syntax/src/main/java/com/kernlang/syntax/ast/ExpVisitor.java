package com.kernlang.syntax.ast;

/**
 * 表达式访问者
 *
 * <p>不提供默认实现：新增变体时所有访问者都必须处理它。</p>
 */
public interface ExpVisitor<R, C> {

    R visitVar(VarExp node, C ctx);

    R visitApp(App node, C ctx);

    R visitAbs(Abs node, C ctx);

    R visitPrd(Prd node, C ctx);

    R visitSum(Sum node, C ctx);

    R visitUnv(Unv node, C ctx);
}
