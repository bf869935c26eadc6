package com.kernlang.syntax.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.kernlang.syntax.ast.Abs;
import com.kernlang.syntax.ast.App;
import com.kernlang.syntax.ast.Binder;
import com.kernlang.syntax.ast.Exp;
import com.kernlang.syntax.ast.ExpVisitor;
import com.kernlang.syntax.ast.Idx;
import com.kernlang.syntax.ast.Prd;
import com.kernlang.syntax.ast.Sum;
import com.kernlang.syntax.ast.Sym;
import com.kernlang.syntax.ast.Unv;
import com.kernlang.syntax.ast.Var;
import com.kernlang.syntax.ast.VarExp;
import com.kernlang.syntax.error.DecodeException;
import com.kernlang.syntax.error.OverflowException;
import com.kernlang.syntax.lexer.Lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 结构化 JSON 编码（Gson）
 *
 * <p>与 {@link CoreCodec} 不同，这里保留宇宙层级和索引值，编码是无损的：</p>
 * <pre>
 * {"kind":"var","sym":"x"}                     自由变量
 * {"kind":"var","sym":"x","idx":"0"}           绑定变量
 * {"kind":"app","fst":{..},"snd":{..}}
 * {"kind":"abs"|"prd"|"sum","sym":"x","type":{..},"body":{..}}
 * {"kind":"unv","level":"0"}
 * </pre>
 * <p>无符号数值以十进制字符串表示。解码时绑定器仍经由工厂构造，并且只接受工厂能够产生的树：
 * 符号必须是合法标识符；带 {@code idx} 的变量必须指向最内层的同名外围绑定器。
 * 绑定器的类型不在任何外围绑定器的作用域内，因此类型中不能出现外层的索引。</p>
 */
public final class JsonCodec implements Codec<JsonElement> {
    private static final Logger LOG = Logger.getLogger(JsonCodec.class.getName());

    private final Gson gson;

    public JsonCodec() {
        this(false);
    }

    public JsonCodec(boolean pretty) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    @Override
    public JsonElement encode(Exp exp) {
        return exp.accept(ENCODER, null);
    }

    public String encodeToString(Exp exp) {
        return gson.toJson(encode(exp));
    }

    @Override
    public Exp decode(JsonElement val) {
        try {
            return decodeNode(val, "$", new ArrayList<Sym>());
        } catch (DecodeException e) {
            LOG.log(Level.FINE, "Failed to decode JSON expression", e);
            throw e;
        }
    }

    public Exp decodeFromString(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw DecodeException.malformed("invalid JSON: " + e.getMessage(), e);
        }
        return decode(element);
    }

    // ============ 编码 ============

    private static final ExpVisitor<JsonElement, Void> ENCODER = new ExpVisitor<JsonElement, Void>() {
        @Override
        public JsonElement visitVar(VarExp node, Void ctx) {
            final JsonObject obj = kind("var");
            node.getVar().accept(new Var.Visitor<Void>() {
                @Override
                public Void visitFree(Var.Free var) {
                    obj.addProperty("sym", var.getSym().getVal());
                    return null;
                }

                @Override
                public Void visitBound(Var.Bound var) {
                    obj.addProperty("sym", var.getIdx().getSym().getVal());
                    obj.addProperty("idx", var.getIdx().toString());
                    return null;
                }
            });
            return obj;
        }

        @Override
        public JsonElement visitApp(App node, Void ctx) {
            JsonObject obj = kind("app");
            obj.add("fst", node.getFst().accept(this, ctx));
            obj.add("snd", node.getSnd().accept(this, ctx));
            return obj;
        }

        @Override
        public JsonElement visitAbs(Abs node, Void ctx) {
            return binder("abs", node, this);
        }

        @Override
        public JsonElement visitPrd(Prd node, Void ctx) {
            return binder("prd", node, this);
        }

        @Override
        public JsonElement visitSum(Sum node, Void ctx) {
            return binder("sum", node, this);
        }

        @Override
        public JsonElement visitUnv(Unv node, Void ctx) {
            JsonObject obj = kind("unv");
            obj.addProperty("level", Long.toUnsignedString(node.getLevel()));
            return obj;
        }
    };

    private static JsonObject kind(String kind) {
        JsonObject obj = new JsonObject();
        obj.addProperty("kind", kind);
        return obj;
    }

    private static JsonObject binder(String kind, Binder node, ExpVisitor<JsonElement, Void> encoder) {
        JsonObject obj = kind(kind);
        obj.addProperty("sym", node.getSym().getVal());
        obj.add("type", node.getType().accept(encoder, null));
        obj.add("body", node.getBody().accept(encoder, null));
        return obj;
    }

    // ============ 解码 ============

    /**
     * @param scope 外围绑定器的符号，最内层在末尾
     */
    private Exp decodeNode(JsonElement element, String path, List<Sym> scope) {
        if (element == null || !element.isJsonObject()) {
            throw DecodeException.malformed("expected an object at " + path);
        }
        JsonObject obj = element.getAsJsonObject();
        String kind = string(obj, "kind", path);
        switch (kind) {
            case "var": {
                Sym sym = symbol(obj, path);
                if (!obj.has("idx")) {
                    return VarExp.free(sym);
                }
                long idx = unsigned(obj, "idx", path);
                checkBound(sym, idx, scope, path);
                return VarExp.bound(Idx.of(idx, sym));
            }
            case "app":
                return App.of(decodeNode(obj.get("fst"), path + ".fst", scope),
                        decodeNode(obj.get("snd"), path + ".snd", scope));
            case "abs":
            case "prd":
            case "sum": {
                Sym sym = symbol(obj, path);
                Exp type = decodeNode(obj.get("type"), path + ".type", new ArrayList<Sym>());
                scope.add(sym);
                Exp body;
                try {
                    body = decodeNode(obj.get("body"), path + ".body", scope);
                } finally {
                    scope.remove(scope.size() - 1);
                }
                try {
                    if (kind.equals("abs")) return Abs.of(sym, type, body);
                    if (kind.equals("prd")) return Prd.of(sym, type, body);
                    return Sum.of(sym, type, body);
                } catch (OverflowException e) {
                    throw DecodeException.system(e, -1, -1);
                }
            }
            case "unv":
                return Unv.of(unsigned(obj, "level", path));
            default:
                throw DecodeException.malformed("unknown kind '" + kind + "' at " + path);
        }
    }

    /**
     * 绑定索引必须等于到最内层同名外围绑定器的距离，否则没有工厂能产生它
     */
    private static void checkBound(Sym sym, long idx, List<Sym> scope, String path) {
        int binder = scope.lastIndexOf(sym);
        if (binder < 0) {
            throw DecodeException.malformed("bound variable '" + sym + "' has no enclosing binder at " + path);
        }
        long expected = scope.size() - 1 - binder;
        if (idx != expected) {
            throw DecodeException.malformed("index " + Long.toUnsignedString(idx) + " of '" + sym
                    + "' does not match its binder (expected " + expected + ") at " + path);
        }
    }

    private static Sym symbol(JsonObject obj, String path) {
        String text = string(obj, "sym", path);
        if (!Lexer.isIdentifier(text)) {
            throw DecodeException.malformed("invalid identifier '" + text + "' at " + path);
        }
        return Sym.of(text);
    }

    private static String string(JsonObject obj, String field, String path) {
        JsonElement value = obj.get(field);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw DecodeException.malformed("expected string field '" + field + "' at " + path);
        }
        return value.getAsString();
    }

    private static long unsigned(JsonObject obj, String field, String path) {
        String text = string(obj, field, path);
        try {
            return Long.parseUnsignedLong(text);
        } catch (NumberFormatException e) {
            throw DecodeException.malformed("invalid unsigned value '" + text + "' for '" + field + "' at " + path, e);
        }
    }
}
