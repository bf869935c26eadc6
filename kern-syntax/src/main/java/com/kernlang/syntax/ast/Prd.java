package com.kernlang.syntax.ast;

import com.kernlang.syntax.error.OverflowException;

import java.util.Objects;

/**
 * Π 类型（积类型），类型构造器
 */
public final class Prd extends Exp implements Binder {
    private final Sym sym;
    private final Exp type;
    private final Exp body;

    Prd(Sym sym, Exp type, Exp body) {
        this.sym = Objects.requireNonNull(sym, "sym");
        this.type = Objects.requireNonNull(type, "type");
        this.body = Objects.requireNonNull(body, "body");
    }

    /**
     * 创建 Π 绑定器，并把 {@code body} 中未被遮蔽的 {@code sym} 转换为索引
     *
     * @throws OverflowException 索引超出上限
     */
    public static Prd of(Sym sym, Exp type, Exp body) {
        return new Prd(sym, type, Indexer.index(body, sym, Idx.of(sym)));
    }

    public static Prd of(String sym, Exp type, Exp body) {
        return of(Sym.of(sym), type, body);
    }

    @Override
    public String prefix() {
        return "Π";
    }

    @Override
    public Sym getSym() {
        return sym;
    }

    @Override
    public Exp getType() {
        return type;
    }

    @Override
    public Exp getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(ExpVisitor<R, C> visitor, C context) {
        return visitor.visitPrd(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Prd)) return false;
        Prd other = (Prd) o;
        return sym.equals(other.sym) && type.equals(other.type) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Π", sym, type, body);
    }

    @Override
    public String toString() {
        return "Prd(" + sym + ", " + type + ", " + body + ")";
    }
}
