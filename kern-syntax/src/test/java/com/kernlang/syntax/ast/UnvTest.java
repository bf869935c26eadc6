package com.kernlang.syntax.ast;

import com.kernlang.syntax.error.OverflowException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Unv 测试")
class UnvTest {

    @Test
    @DisplayName("新宇宙位于第 0 层，inc 加一")
    void testInc() {
        Unv o1 = Unv.of();
        assertThat(o1.getLevel()).isZero();
        assertThat(o1.inc().getLevel()).isEqualTo(1L);
    }

    @Test
    @DisplayName("层级上限处溢出")
    void testIncOverflow() {
        Unv o1 = Unv.of(Idx.MAX_VALUE - 1);
        Unv o2 = o1.inc();
        assertThat(o2.getLevel()).isEqualTo(Idx.MAX_VALUE);

        OverflowException overflow = catchThrowableOfType(o2::inc, OverflowException.class);
        assertThat(overflow).hasMessage("max limit 18446744073709551615 for universe levels has been reached");
        assertThat(overflow.getKind()).isEqualTo(OverflowException.Kind.UNIVERSE);
    }

    @Test
    @DisplayName("max 返回较高层级")
    void testMax() {
        Unv o1 = Unv.of();
        Unv o2 = o1.inc();
        Unv o3 = o2.inc();
        assertThat(Unv.max(o1, o2)).isEqualTo(o2);
        assertThat(Unv.max(o2, o1)).isEqualTo(o2);
        assertThat(Unv.max(o2, o3)).isEqualTo(o3);
        assertThat(Unv.max(o3, o2)).isEqualTo(o3);
        assertThat(Unv.max(o2, Unv.of(1))).isEqualTo(o2);
    }

    @Test
    @DisplayName("层级按无符号比较")
    void testUnsignedOrder() {
        Unv top = Unv.of(Idx.MAX_VALUE);
        assertThat(top).isGreaterThan(Unv.of(1));
        assertThat(Unv.max(Unv.of(1), top)).isEqualTo(top);
        assertThat(top.toString()).isEqualTo("Unv(18446744073709551615)");
    }

    @Test
    @DisplayName("相等比较基于层级")
    void testEquality() {
        assertThat(Unv.of()).isEqualTo(Unv.of(0));
        assertThat(Unv.of()).isNotEqualTo(Unv.of(1));
    }
}
