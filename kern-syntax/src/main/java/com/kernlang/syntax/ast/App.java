package com.kernlang.syntax.ast;

import java.util.Objects;

/**
 * 应用：{@code fst} 作用于 {@code snd}
 */
public final class App extends Exp {
    private final Exp fst;
    private final Exp snd;

    App(Exp fst, Exp snd) {
        this.fst = Objects.requireNonNull(fst, "fst");
        this.snd = Objects.requireNonNull(snd, "snd");
    }

    public static App of(Exp fst, Exp snd) {
        return new App(fst, snd);
    }

    /** 被执行的操作 */
    public Exp getFst() {
        return fst;
    }

    /** 操作作用的对象 */
    public Exp getSnd() {
        return snd;
    }

    @Override
    public <R, C> R accept(ExpVisitor<R, C> visitor, C context) {
        return visitor.visitApp(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof App)) return false;
        App other = (App) o;
        return fst.equals(other.fst) && snd.equals(other.snd);
    }

    @Override
    public int hashCode() {
        return 31 * fst.hashCode() + snd.hashCode();
    }

    @Override
    public String toString() {
        return "App(" + fst + ", " + snd + ")";
    }
}
