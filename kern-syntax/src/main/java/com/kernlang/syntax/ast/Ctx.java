package com.kernlang.syntax.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 类型上下文 Γ：形如 {@code x : N} 的有序声明序列。
 *
 * <p>留给类型检查器填充；本层不读写它，只提供只读视图。</p>
 */
public final class Ctx {
    private static final Ctx EMPTY = new Ctx(Collections.<Decl>emptyList());

    private final List<Decl> declarations;

    private Ctx(List<Decl> declarations) {
        this.declarations = declarations;
    }

    public static Ctx empty() {
        return EMPTY;
    }

    public static Ctx of(List<Decl> declarations) {
        return new Ctx(Collections.unmodifiableList(new ArrayList<Decl>(declarations)));
    }

    public List<Decl> getDeclarations() {
        return declarations;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Ctx && declarations.equals(((Ctx) o).declarations);
    }

    @Override
    public int hashCode() {
        return declarations.hashCode();
    }

    /**
     * 单条声明 {@code sym : type}
     */
    public static final class Decl {
        private final Sym sym;
        private final Exp type;

        public Decl(Sym sym, Exp type) {
            this.sym = Objects.requireNonNull(sym, "sym");
            this.type = Objects.requireNonNull(type, "type");
        }

        public Sym getSym() {
            return sym;
        }

        public Exp getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Decl)) return false;
            Decl other = (Decl) o;
            return sym.equals(other.sym) && type.equals(other.type);
        }

        @Override
        public int hashCode() {
            return 31 * sym.hashCode() + type.hashCode();
        }

        @Override
        public String toString() {
            return sym + " : " + type;
        }
    }
}
