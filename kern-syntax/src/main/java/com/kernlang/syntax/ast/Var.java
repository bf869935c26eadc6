package com.kernlang.syntax.ast;

import java.util.Objects;

/**
 * 变量引用：自由的 {@link Sym} 或已绑定的 {@link Idx}。
 *
 * <p>只有 {@link Free} 与 {@link Bound} 两种形态，通过 {@link #accept(Visitor)} 穷尽分派。</p>
 */
public abstract class Var {

    private Var() {
    }

    public static Var free(Sym sym) {
        return new Free(sym);
    }

    public static Var bound(Idx idx) {
        return new Bound(idx);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public abstract boolean isBound();

    /**
     * 变量形态访问者
     */
    public interface Visitor<R> {
        R visitFree(Free var);

        R visitBound(Bound var);
    }

    /**
     * 尚未解析的自由变量
     */
    public static final class Free extends Var {
        private final Sym sym;

        private Free(Sym sym) {
            this.sym = Objects.requireNonNull(sym, "sym");
        }

        public Sym getSym() {
            return sym;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFree(this);
        }

        @Override
        public boolean isBound() {
            return false;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Free && sym.equals(((Free) o).sym);
        }

        @Override
        public int hashCode() {
            return sym.hashCode();
        }

        @Override
        public String toString() {
            return sym.toString();
        }
    }

    /**
     * 已解析为 De Bruijn 索引的绑定变量
     */
    public static final class Bound extends Var {
        private final Idx idx;

        private Bound(Idx idx) {
            this.idx = Objects.requireNonNull(idx, "idx");
        }

        public Idx getIdx() {
            return idx;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBound(this);
        }

        @Override
        public boolean isBound() {
            return true;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bound && idx.equals(((Bound) o).idx);
        }

        @Override
        public int hashCode() {
            return 17 + idx.hashCode();
        }

        @Override
        public String toString() {
            return idx + ":" + idx.getSym();
        }
    }
}
