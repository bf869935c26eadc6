package com.kernlang.syntax.ast;

import java.util.Objects;

/**
 * 符号：变量的名字。
 *
 * <p>符号用于引用自由变量；绑定变量也保留其原始符号，但仅用于显示。
 * 两个符号文本相同即相等，不保证唯一，允许遮蔽。</p>
 */
public final class Sym {
    private final String val;

    private Sym(String val) {
        this.val = Objects.requireNonNull(val, "val");
    }

    public static Sym of(String val) {
        return new Sym(val);
    }

    public String getVal() {
        return val;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sym)) return false;
        return val.equals(((Sym) o).val);
    }

    @Override
    public int hashCode() {
        return val.hashCode();
    }

    @Override
    public String toString() {
        return val;
    }
}
