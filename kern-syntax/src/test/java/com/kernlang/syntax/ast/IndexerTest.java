package com.kernlang.syntax.ast;

import com.kernlang.syntax.error.OverflowException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * 索引化与绑定器构造测试
 */
class IndexerTest {

    private static final Sym X = Sym.of("x");
    private static final Sym Y = Sym.of("y");
    private static final Exp T = VarExp.free("t");

    private static VarExp free(String name) {
        return VarExp.free(name);
    }

    private static VarExp bound(long val, String name) {
        return VarExp.bound(Idx.of(val, Sym.of(name)));
    }

    @Nested
    @DisplayName("变量")
    class VarTests {

        @Test
        @DisplayName("匹配的自由变量转换为索引")
        void testMatch() {
            assertThat(Indexer.index(free("x"), X, Idx.of(X))).isEqualTo(bound(0, "x"));
        }

        @Test
        @DisplayName("不匹配的自由变量保持不变")
        void testNoMatch() {
            Exp y = free("y");
            assertThat(Indexer.index(y, X, Idx.of(X))).isSameAs(y);
        }

        @Test
        @DisplayName("已绑定的变量不再索引")
        void testAlreadyBound() {
            Exp b = bound(5, "x");
            assertThat(Indexer.index(b, X, Idx.of(X))).isSameAs(b);
        }

        @Test
        @DisplayName("宇宙常量不含变量")
        void testUnv() {
            Exp unv = Unv.of(3);
            assertThat(Indexer.index(unv, X, Idx.of(X))).isSameAs(unv);
        }
    }

    @Nested
    @DisplayName("绑定器")
    class BinderTests {

        @Test
        @DisplayName("应用的两个分支使用相同索引")
        void testApp() {
            Abs abs = Abs.of("x", T, App.of(free("x"), free("x")));
            assertThat(abs.getBody()).isEqualTo(App.of(bound(0, "x"), bound(0, "x")));
        }

        @Test
        @DisplayName("每跨过一个绑定器索引加一")
        void testNested() {
            Abs abs = Abs.of("x", T, Prd.of("y", T, Sum.of("z", T, App.of(free("x"), free("y")))));
            Exp inner = ((Binder) ((Binder) abs.getBody()).getBody()).getBody();
            assertThat(inner).isEqualTo(App.of(bound(2, "x"), bound(1, "y")));
        }

        @Test
        @DisplayName("内层同名绑定器遮蔽外层")
        void testShadowing() {
            // λx:T.(λx:U. x) x
            Abs innerAbs = Abs.of("x", free("u"), free("x"));
            assertThat(innerAbs.getBody()).isEqualTo(bound(0, "x"));

            Abs outer = Abs.of("x", T, App.of(innerAbs, free("x")));
            App body = (App) outer.getBody();
            assertThat(body.getFst()).isSameAs(innerAbs);
            assertThat(body.getSnd()).isEqualTo(bound(0, "x"));
        }

        @Test
        @DisplayName("遮蔽只停止当前分支")
        void testShadowingOneBranch() {
            Abs outer = Abs.of("x", T, App.of(Abs.of("x", T, free("y")), free("x")));
            assertThat(((App) outer.getBody()).getSnd()).isEqualTo(bound(0, "x"));

            Exp shadowed = ((Binder) ((App) outer.getBody()).getFst()).getBody();
            assertThat(shadowed).isEqualTo(free("y"));
        }

        @Test
        @DisplayName("绑定器的类型不参与索引")
        void testTypeNotIndexed() {
            Abs abs = Abs.of("x", free("x"), Abs.of("y", free("x"), free("y")));
            assertThat(abs.getType()).isEqualTo(free("x"));
            assertThat(((Binder) abs.getBody()).getType()).isEqualTo(free("x"));
            assertThat(((Binder) abs.getBody()).getBody()).isEqualTo(bound(0, "y"));
        }

        @Test
        @DisplayName("三种绑定器行为一致")
        void testAllBinders() {
            assertThat(Abs.of("x", T, free("x")).getBody()).isEqualTo(bound(0, "x"));
            assertThat(Prd.of("x", T, free("x")).getBody()).isEqualTo(bound(0, "x"));
            assertThat(Sum.of("x", T, free("x")).getBody()).isEqualTo(bound(0, "x"));
            assertThat(Abs.of("x", T, free("x")).prefix()).isEqualTo("λ");
            assertThat(Prd.of("x", T, free("x")).prefix()).isEqualTo("Π");
            assertThat(Sum.of("x", T, free("x")).prefix()).isEqualTo("Σ");
        }

        @Test
        @DisplayName("不同种类的绑定器不相等")
        void testBinderEquality() {
            assertThat(Abs.of("x", T, free("x"))).isEqualTo(Abs.of("x", T, free("x")));
            assertThat(Abs.of("x", T, free("x"))).isNotEqualTo(Prd.of("x", T, free("x")));
            assertThat(Abs.of("x", T, free("x"))).isNotEqualTo(Abs.of("y", T, free("y")));
        }
    }

    @Nested
    @DisplayName("溢出")
    class OverflowTests {

        @Test
        @DisplayName("跨越绑定器时溢出，输入树不受影响")
        void testOverflowLeavesInputIntact() {
            Abs input = Abs.of("y", T, App.of(free("x"), free("y")));
            Exp before = App.of(input, free("x"));

            assertThatThrownBy(() -> Indexer.index(before, X, Idx.of(Idx.MAX_VALUE, X)))
                    .isInstanceOf(OverflowException.class);
            assertThat(input.getBody()).isEqualTo(App.of(free("x"), bound(0, "y")));
            assertThat(((App) before).getSnd()).isEqualTo(free("x"));
        }

        @Test
        @DisplayName("不跨越绑定器时上限索引可用")
        void testMaxWithoutBinder() {
            Exp result = Indexer.index(App.of(free("x"), free("y")), X, Idx.of(Idx.MAX_VALUE, X));
            assertThat(result).isEqualTo(App.of(bound(Idx.MAX_VALUE, "x"), free("y")));
        }

        @Test
        @DisplayName("遮蔽的绑定器不触发递增")
        void testShadowSkipsIncrement() {
            Exp shadow = Abs.of("x", T, free("x"));
            assertThat(Indexer.index(shadow, X, Idx.of(Idx.MAX_VALUE, X))).isSameAs(shadow);
        }
    }

    @Test
    @DisplayName("Ctx 保持声明顺序且只读")
    void testCtx() {
        Ctx ctx = Ctx.of(java.util.Arrays.asList(new Ctx.Decl(X, T), new Ctx.Decl(Y, Unv.of())));
        assertThat(ctx.getDeclarations()).extracting(Ctx.Decl::getSym).containsExactly(X, Y);
        assertThatThrownBy(() -> ctx.getDeclarations().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(Ctx.empty().getDeclarations()).isEmpty();
    }
}
