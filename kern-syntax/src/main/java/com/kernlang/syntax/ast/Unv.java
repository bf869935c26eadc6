package com.kernlang.syntax.ast;

import com.kernlang.syntax.error.OverflowException;

/**
 * 宇宙（sort）：类型所在的空间。
 *
 * <p>理论上宇宙有无穷多层，层级从 0 开始；这里层级按无符号 64 位解释，超过
 * {@link Idx#MAX_VALUE} 时 {@link #inc()} 抛出 {@link OverflowException}。
 * 宇宙是累积的：属于第 N 层的类型也属于更高的层级。该性质留给类型检查器，本层只负责排序与递增。</p>
 */
public final class Unv extends Exp implements Comparable<Unv> {

    /** 规范文本中的宇宙符号，不体现层级 */
    public static final String GLYPH = "□";

    private final long level;

    private Unv(long level) {
        this.level = level;
    }

    /**
     * 第 0 层宇宙
     */
    public static Unv of() {
        return new Unv(0L);
    }

    public static Unv of(long level) {
        return new Unv(level);
    }

    /**
     * 两者中层级较高的宇宙（相等时返回 {@code a}）
     */
    public static Unv max(Unv a, Unv b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public long getLevel() {
        return level;
    }

    /**
     * 高一层的宇宙
     *
     * @throws OverflowException 层级已达上限
     */
    public Unv inc() {
        if (level == Idx.MAX_VALUE) {
            throw OverflowException.universe(level);
        }
        return new Unv(level + 1);
    }

    @Override
    public int compareTo(Unv other) {
        return Long.compareUnsigned(level, other.level);
    }

    @Override
    public <R, C> R accept(ExpVisitor<R, C> visitor, C context) {
        return visitor.visitUnv(this, context);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Unv && level == ((Unv) o).level;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(level);
    }

    @Override
    public String toString() {
        return "Unv(" + Long.toUnsignedString(level) + ")";
    }
}
