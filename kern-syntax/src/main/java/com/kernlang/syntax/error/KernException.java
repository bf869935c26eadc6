package com.kernlang.syntax.error;

/**
 * Kern 基础异常。
 *
 * <p>系统级错误 {@link OverflowException} 与解码错误 {@link DecodeException} 都继承此类，
 * 调用方（CLI、REPL、测试）可以统一捕获并输出 {@link #getMessage()}。</p>
 */
public class KernException extends RuntimeException {

    public KernException(String message) {
        super(message);
    }

    public KernException(String message, Throwable cause) {
        super(message, cause);
    }
}
