package com.kernlang.syntax.error;

/**
 * 系统级错误：数值达到表示上限。
 *
 * <p>携带溢出前的值（按无符号 64 位解释）。</p>
 */
public class OverflowException extends KernException {

    /**
     * 溢出的数值种类
     */
    public enum Kind {
        /** De Bruijn 索引 */
        INDEX("indices"),
        /** 宇宙层级 */
        UNIVERSE("universe levels");

        private final String noun;

        Kind(String noun) {
            this.noun = noun;
        }

        public String getNoun() {
            return noun;
        }
    }

    private final Kind kind;
    private final long limit;

    public OverflowException(Kind kind, long limit) {
        super(String.format("max limit %s for %s has been reached",
                Long.toUnsignedString(limit), kind.getNoun()));
        this.kind = kind;
        this.limit = limit;
    }

    public static OverflowException index(long limit) {
        return new OverflowException(Kind.INDEX, limit);
    }

    public static OverflowException universe(long limit) {
        return new OverflowException(Kind.UNIVERSE, limit);
    }

    public Kind getKind() {
        return kind;
    }

    /** 无符号值，显示时使用 {@link Long#toUnsignedString(long)} */
    public long getLimit() {
        return limit;
    }
}
