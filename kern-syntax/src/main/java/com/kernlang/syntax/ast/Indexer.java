package com.kernlang.syntax.ast;

import com.kernlang.syntax.error.OverflowException;

/**
 * De Bruijn 索引化。
 *
 * <p>把表达式中每个引用目标符号、且未被内层同名绑定器遮蔽的自由变量转换为索引；
 * 每跨过一个绑定器，索引值加一，因此索引等于该变量与绑定它的绑定器之间的绑定器数量。</p>
 *
 * <ul>
 *   <li>应用的两个分支使用相同的索引</li>
 *   <li>遇到同名绑定器立即停止：内层绑定器构造时已经索引过自己的主体</li>
 *   <li>绑定器的类型不在任何内层符号的作用域内，不参与索引</li>
 *   <li>宇宙常量不含变量</li>
 * </ul>
 *
 * <p>节点不可变，索引化返回新树，未改变的子树原样复用。溢出时抛出异常，
 * 输入树不受影响。递归深度等于树深度。</p>
 */
public final class Indexer implements ExpVisitor<Exp, Idx> {
    private final Sym target;

    private Indexer(Sym target) {
        this.target = target;
    }

    /**
     * 以 {@code idx} 为起始索引，把 {@code exp} 中引用 {@code sym} 的自由变量转换为索引
     *
     * @throws OverflowException 跨越绑定器时索引超出上限
     */
    public static Exp index(Exp exp, Sym sym, Idx idx) {
        return exp.accept(new Indexer(sym), idx);
    }

    @Override
    public Exp visitVar(VarExp node, Idx idx) {
        return node.getVar().accept(new Var.Visitor<Exp>() {
            @Override
            public Exp visitFree(Var.Free var) {
                return var.getSym().equals(target) ? VarExp.bound(idx) : node;
            }

            @Override
            public Exp visitBound(Var.Bound var) {
                return node; // 已绑定的变量不再索引
            }
        });
    }

    @Override
    public Exp visitApp(App node, Idx idx) {
        Exp fst = node.getFst().accept(this, idx);
        Exp snd = node.getSnd().accept(this, idx);
        if (fst == node.getFst() && snd == node.getSnd()) {
            return node;
        }
        return new App(fst, snd);
    }

    @Override
    public Exp visitAbs(Abs node, Idx idx) {
        if (shadows(node)) {
            return node;
        }
        Exp body = node.getBody().accept(this, idx.inc());
        return body == node.getBody() ? node : new Abs(node.getSym(), node.getType(), body);
    }

    @Override
    public Exp visitPrd(Prd node, Idx idx) {
        if (shadows(node)) {
            return node;
        }
        Exp body = node.getBody().accept(this, idx.inc());
        return body == node.getBody() ? node : new Prd(node.getSym(), node.getType(), body);
    }

    @Override
    public Exp visitSum(Sum node, Idx idx) {
        if (shadows(node)) {
            return node;
        }
        Exp body = node.getBody().accept(this, idx.inc());
        return body == node.getBody() ? node : new Sum(node.getSym(), node.getType(), body);
    }

    @Override
    public Exp visitUnv(Unv node, Idx idx) {
        return node;
    }

    private boolean shadows(Binder node) {
        return node.getSym().equals(target);  // 内层同名绑定器已索引过自己的主体
    }
}
