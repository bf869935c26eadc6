package com.kernlang.syntax.codec;

import com.kernlang.syntax.ast.Abs;
import com.kernlang.syntax.ast.App;
import com.kernlang.syntax.ast.Binder;
import com.kernlang.syntax.ast.Exp;
import com.kernlang.syntax.ast.ExpVisitor;
import com.kernlang.syntax.ast.Prd;
import com.kernlang.syntax.ast.Sum;
import com.kernlang.syntax.ast.Unv;
import com.kernlang.syntax.ast.Var;
import com.kernlang.syntax.ast.VarExp;
import com.kernlang.syntax.error.DecodeException;
import com.kernlang.syntax.lexer.Lexer;
import com.kernlang.syntax.parser.Parser;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 核心语言的规范编码。
 *
 * <p>{@link #encode(Exp)} 输出括号最少、且能被 {@link #decode(String)} 还原为同一棵树的文本。
 * 编码时携带两个标志：当前节点是否<em>仅</em>位于应用的左子树、是否<em>仅</em>位于右子树。</p>
 *
 * <ul>
 *   <li>应用：当前节点位于右子树时整体加括号，括号内标志复位。之后左分支
 *       {@code ltree = true, rtree = false}；右分支 {@code rtree = true}，{@code ltree} 继承当前节点，
 *       因为右分支之后是否还有参数取决于外层</li>
 *   <li>绑定器：位于左子树时整体加括号，否则主体会吞掉后续参数；类型和主体从新的分支开始</li>
 *   <li>宇宙：总是输出 {@code □}，层级不体现在文本中，解码得到第 0 层</li>
 * </ul>
 *
 * <p>实例不可变，可以共享。递归深度等于树深度。</p>
 */
public final class CoreCodec implements Codec<String> {
    private static final Logger LOG = Logger.getLogger(CoreCodec.class.getName());

    private static final CoreCodec DEFAULT = new CoreCodec(false);

    /** 绑定变量显示为 De Bruijn 索引而非原始符号 */
    private final boolean showIndices;

    private CoreCodec(boolean showIndices) {
        this.showIndices = showIndices;
    }

    public static CoreCodec create() {
        return DEFAULT;
    }

    /**
     * 指定绑定变量的显示方式。仅影响输出，语法总是读取标识符，
     * 因此显示索引的文本一般不能再解码回同一棵树。
     */
    public static CoreCodec withShowIndices(boolean showIndices) {
        return showIndices ? new CoreCodec(true) : DEFAULT;
    }

    public boolean isShowIndices() {
        return showIndices;
    }

    @Override
    public String encode(Exp exp) {
        Encoder encoder = new Encoder();
        exp.accept(encoder, Branch.ROOT);
        return encoder.out.toString();
    }

    @Override
    public Exp decode(String val) {
        try {
            return new Parser(new Lexer(val)).parse();
        } catch (DecodeException e) {
            LOG.log(Level.FINE, "Failed to decode expression: " + val, e);
            throw e;
        }
    }

    /**
     * 当前节点在应用链中的位置
     */
    private static final class Branch {
        static final Branch ROOT = new Branch(false, false);

        /** 仅位于左子树 */
        final boolean ltree;
        /** 仅位于右子树 */
        final boolean rtree;

        Branch(boolean ltree, boolean rtree) {
            this.ltree = ltree;
            this.rtree = rtree;
        }
    }

    private final class Encoder implements ExpVisitor<Void, Branch>, Var.Visitor<String> {
        final StringBuilder out = new StringBuilder();

        @Override
        public Void visitVar(VarExp node, Branch branch) {
            out.append(node.getVar().accept(this));
            return null;
        }

        @Override
        public String visitFree(Var.Free var) {
            return var.getSym().getVal();
        }

        @Override
        public String visitBound(Var.Bound var) {
            return showIndices ? var.getIdx().toString() : var.getIdx().getSym().getVal();
        }

        @Override
        public Void visitApp(App node, Branch branch) {
            boolean parens = branch.rtree;
            Branch inner = parens ? Branch.ROOT : branch;  // 括号内从新分支开始
            if (parens) out.append('(');
            node.getFst().accept(this, new Branch(true, false));
            out.append(' ');
            node.getSnd().accept(this, new Branch(inner.ltree, true));
            if (parens) out.append(')');
            return null;
        }

        @Override
        public Void visitAbs(Abs node, Branch branch) {
            return binder(node, branch);
        }

        @Override
        public Void visitPrd(Prd node, Branch branch) {
            return binder(node, branch);
        }

        @Override
        public Void visitSum(Sum node, Branch branch) {
            return binder(node, branch);
        }

        @Override
        public Void visitUnv(Unv node, Branch branch) {
            out.append(Unv.GLYPH);
            return null;
        }

        private Void binder(Binder node, Branch branch) {
            boolean parens = branch.ltree;
            if (parens) out.append('(');
            out.append(node.prefix()).append(node.getSym().getVal()).append(" : ");
            node.getType().accept(this, Branch.ROOT);
            out.append(" . ");
            node.getBody().accept(this, Branch.ROOT);  // 主体贪婪，从新分支开始
            if (parens) out.append(')');
            return null;
        }
    }
}
