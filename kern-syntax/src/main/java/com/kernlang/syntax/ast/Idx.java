package com.kernlang.syntax.ast;

import com.kernlang.syntax.error.OverflowException;

import java.util.Objects;

/**
 * De Bruijn 索引：绑定变量与绑定它的绑定器之间相隔的绑定器数量。
 *
 * <p>{@code val} 按无符号 64 位解释，上限为 {@link #MAX_VALUE}；{@link #inc()} 溢出时抛出
 * {@link OverflowException} 而不是回绕。{@code sym} 记录原始符号，参与相等比较。</p>
 */
public final class Idx {

    /** 无符号 64 位最大值 */
    public static final long MAX_VALUE = 0xFFFF_FFFF_FFFF_FFFFL;

    private final long val;
    private final Sym sym;

    private Idx(long val, Sym sym) {
        this.val = val;
        this.sym = Objects.requireNonNull(sym, "sym");
    }

    /**
     * 值为 0 的索引
     */
    public static Idx of(Sym sym) {
        return new Idx(0L, sym);
    }

    public static Idx of(long val, Sym sym) {
        return new Idx(val, sym);
    }

    public long getVal() {
        return val;
    }

    public Sym getSym() {
        return sym;
    }

    /**
     * 返回值加一的新索引
     *
     * @throws OverflowException 当前值已是 {@link #MAX_VALUE}
     */
    public Idx inc() {
        if (val == MAX_VALUE) {
            throw OverflowException.index(val);
        }
        return new Idx(val + 1, sym);
    }

    /**
     * 返回值减一的新索引
     *
     * @throws IllegalStateException 当前值为 0
     */
    public Idx dec() {
        if (val == 0L) {
            throw new IllegalStateException("cannot decrement index 0 of " + sym);
        }
        return new Idx(val - 1, sym);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Idx)) return false;
        Idx other = (Idx) o;
        return val == other.val && sym.equals(other.sym);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(val) + sym.hashCode();
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(val);
    }
}
