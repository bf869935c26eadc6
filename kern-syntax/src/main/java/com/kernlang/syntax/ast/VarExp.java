package com.kernlang.syntax.ast;

import java.util.Objects;

/**
 * 变量表达式，原子叶子节点
 */
public final class VarExp extends Exp {
    private final Var var;

    VarExp(Var var) {
        this.var = Objects.requireNonNull(var, "var");
    }

    public static VarExp of(Var var) {
        return new VarExp(var);
    }

    public static VarExp free(String name) {
        return new VarExp(Var.free(Sym.of(name)));
    }

    public static VarExp free(Sym sym) {
        return new VarExp(Var.free(sym));
    }

    public static VarExp bound(Idx idx) {
        return new VarExp(Var.bound(idx));
    }

    public Var getVar() {
        return var;
    }

    @Override
    public <R, C> R accept(ExpVisitor<R, C> visitor, C context) {
        return visitor.visitVar(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VarExp && var.equals(((VarExp) o).var);
    }

    @Override
    public int hashCode() {
        return var.hashCode();
    }

    @Override
    public String toString() {
        return "Var(" + var + ")";
    }
}
