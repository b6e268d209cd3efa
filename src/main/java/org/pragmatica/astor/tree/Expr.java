package org.pragmatica.astor.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.pragmatica.astor.tree.Children.childList;
import static org.pragmatica.astor.tree.Children.requiredChild;

/**
 * Expression and type nodes.
 */
public sealed interface Expr extends Node {

    // === Terminals ===

    /**
     * Placeholder for an expression containing syntax errors.
     */
    final class BadExpr implements Expr {
        @Override
        public NodeKind kind() {
            return NodeKind.BAD_EXPR;
        }
    }

    /**
     * Identifier.
     */
    final class Ident implements Expr {
        private final String name;

        public Ident(String name) {
            this.name = checkNotNull(name);
        }

        public static Ident of(String name) {
            return new Ident(name);
        }

        public static List<Ident> list(String... names) {
            return Arrays.stream(names)
                         .map(Ident::new)
                         .toList();
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IDENT;
        }

        public String name() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * {@code ...} in a parameter list or array length.
     */
    final class Ellipsis implements Expr {
        private @Nullable Expr elt;

        public Ellipsis(@Nullable Expr elt) {
            this.elt = elt;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ELLIPSIS;
        }

        public @Nullable Expr elt() {
            return elt;
        }

        public void setElt(@Nullable Expr elt) {
            this.elt = elt;
        }
    }

    /**
     * Literal of basic type. The value is kept in source form, quotes included.
     */
    final class BasicLit implements Expr {
        private final Token literalKind;
        private final String value;

        public BasicLit(Token literalKind, String value) {
            checkArgument(literalKind.isLiteral(), "Not a literal kind: %s", literalKind);
            this.literalKind = literalKind;
            this.value = checkNotNull(value);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BASIC_LIT;
        }

        public Token literalKind() {
            return literalKind;
        }

        public String value() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * Function literal.
     */
    final class FuncLit implements Expr {
        private FuncType type;
        private Stmt.BlockStmt body;

        public FuncLit(FuncType type, Stmt.BlockStmt body) {
            this.type = requiredChild(type, "type");
            this.body = requiredChild(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNC_LIT;
        }

        public FuncType type() {
            return type;
        }

        public void setType(FuncType type) {
            this.type = requiredChild(type, "type");
        }

        public Stmt.BlockStmt body() {
            return body;
        }

        public void setBody(Stmt.BlockStmt body) {
            this.body = requiredChild(body, "body");
        }
    }

    /**
     * Composite literal such as {@code T{a, b}}. The type is absent for elided types.
     */
    final class CompositeLit implements Expr {
        private @Nullable Expr type;
        private List<Expr> elts;

        public CompositeLit(@Nullable Expr type, List<Expr> elts) {
            this.type = type;
            this.elts = childList(elts, "elts");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMPOSITE_LIT;
        }

        public @Nullable Expr type() {
            return type;
        }

        public void setType(@Nullable Expr type) {
            this.type = type;
        }

        public List<Expr> elts() {
            return elts;
        }

        public void setElts(List<Expr> elts) {
            this.elts = childList(elts, "elts");
        }
    }

    // === Compound expressions ===

    /**
     * Parenthesized expression.
     */
    final class ParenExpr implements Expr {
        private Expr x;

        public ParenExpr(Expr x) {
            this.x = requiredChild(x, "x");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PAREN_EXPR;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }
    }

    /**
     * Expression followed by a selector, {@code x.sel}.
     */
    final class SelectorExpr implements Expr {
        private Expr x;
        private Ident sel;

        public SelectorExpr(Expr x, Ident sel) {
            this.x = requiredChild(x, "x");
            this.sel = requiredChild(sel, "sel");
        }

        public static SelectorExpr of(String x, String sel) {
            return new SelectorExpr(Ident.of(x), Ident.of(sel));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SELECTOR_EXPR;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }

        public Ident sel() {
            return sel;
        }

        public void setSel(Ident sel) {
            this.sel = requiredChild(sel, "sel");
        }
    }

    /**
     * Index expression, {@code x[index]}.
     */
    final class IndexExpr implements Expr {
        private Expr x;
        private Expr index;

        public IndexExpr(Expr x, Expr index) {
            this.x = requiredChild(x, "x");
            this.index = requiredChild(index, "index");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INDEX_EXPR;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }

        public Expr index() {
            return index;
        }

        public void setIndex(Expr index) {
            this.index = requiredChild(index, "index");
        }
    }

    /**
     * Slice expression, {@code x[low:high]} or {@code x[low:high:max]}.
     */
    final class SliceExpr implements Expr {
        private Expr x;
        private @Nullable Expr low;
        private @Nullable Expr high;
        private @Nullable Expr max;
        private final boolean slice3;

        public SliceExpr(Expr x, @Nullable Expr low, @Nullable Expr high, @Nullable Expr max, boolean slice3) {
            this.x = requiredChild(x, "x");
            this.low = low;
            this.high = high;
            this.max = max;
            this.slice3 = slice3;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SLICE_EXPR;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }

        public @Nullable Expr low() {
            return low;
        }

        public void setLow(@Nullable Expr low) {
            this.low = low;
        }

        public @Nullable Expr high() {
            return high;
        }

        public void setHigh(@Nullable Expr high) {
            this.high = high;
        }

        public @Nullable Expr max() {
            return max;
        }

        public void setMax(@Nullable Expr max) {
            this.max = max;
        }

        public boolean slice3() {
            return slice3;
        }
    }

    /**
     * Type assertion, {@code x.(T)}. The type is absent in a type switch guard, {@code x.(type)}.
     */
    final class TypeAssertExpr implements Expr {
        private Expr x;
        private @Nullable Expr type;

        public TypeAssertExpr(Expr x, @Nullable Expr type) {
            this.x = requiredChild(x, "x");
            this.type = type;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_ASSERT_EXPR;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }

        public @Nullable Expr type() {
            return type;
        }

        public void setType(@Nullable Expr type) {
            this.type = type;
        }
    }

    /**
     * Function call, {@code fun(args...)}.
     */
    final class CallExpr implements Expr {
        private Expr fun;
        private List<Expr> args;
        private final boolean hasEllipsis;

        public CallExpr(Expr fun, List<Expr> args, boolean hasEllipsis) {
            this.fun = requiredChild(fun, "fun");
            this.args = childList(args, "args");
            this.hasEllipsis = hasEllipsis;
        }

        public CallExpr(Expr fun, List<Expr> args) {
            this(fun, args, false);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CALL_EXPR;
        }

        public Expr fun() {
            return fun;
        }

        public void setFun(Expr fun) {
            this.fun = requiredChild(fun, "fun");
        }

        public List<Expr> args() {
            return args;
        }

        public void setArgs(List<Expr> args) {
            this.args = childList(args, "args");
        }

        public boolean hasEllipsis() {
            return hasEllipsis;
        }
    }

    /**
     * Pointer dereference {@code *x} or pointer type {@code *T}.
     */
    final class StarExpr implements Expr {
        private Expr x;

        public StarExpr(Expr x) {
            this.x = requiredChild(x, "x");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STAR_EXPR;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }
    }

    /**
     * Unary expression. Dereference is a {@link StarExpr}.
     */
    final class UnaryExpr implements Expr {
        private final Token op;
        private Expr x;

        public UnaryExpr(Token op, Expr x) {
            this.op = checkNotNull(op);
            this.x = requiredChild(x, "x");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UNARY_EXPR;
        }

        public Token op() {
            return op;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }
    }

    /**
     * Binary expression.
     */
    final class BinaryExpr implements Expr {
        private Expr x;
        private final Token op;
        private Expr y;

        public BinaryExpr(Expr x, Token op, Expr y) {
            this.x = requiredChild(x, "x");
            this.op = checkNotNull(op);
            this.y = requiredChild(y, "y");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BINARY_EXPR;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }

        public Token op() {
            return op;
        }

        public Expr y() {
            return y;
        }

        public void setY(Expr y) {
            this.y = requiredChild(y, "y");
        }
    }

    /**
     * {@code key: value} pair in a composite literal.
     */
    final class KeyValueExpr implements Expr {
        private Expr key;
        private Expr value;

        public KeyValueExpr(Expr key, Expr value) {
            this.key = requiredChild(key, "key");
            this.value = requiredChild(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.KEY_VALUE_EXPR;
        }

        public Expr key() {
            return key;
        }

        public void setKey(Expr key) {
            this.key = requiredChild(key, "key");
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = requiredChild(value, "value");
        }
    }

    // === Types ===

    /**
     * Array or slice type. A slice type has no length.
     */
    final class ArrayType implements Expr {
        private @Nullable Expr len;
        private Expr elt;

        public ArrayType(@Nullable Expr len, Expr elt) {
            this.len = len;
            this.elt = requiredChild(elt, "elt");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ARRAY_TYPE;
        }

        public @Nullable Expr len() {
            return len;
        }

        public void setLen(@Nullable Expr len) {
            this.len = len;
        }

        public Expr elt() {
            return elt;
        }

        public void setElt(Expr elt) {
            this.elt = requiredChild(elt, "elt");
        }
    }

    final class StructType implements Expr {
        private FieldList fields;

        public StructType(FieldList fields) {
            this.fields = requiredChild(fields, "fields");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.STRUCT_TYPE;
        }

        public FieldList fields() {
            return fields;
        }

        public void setFields(FieldList fields) {
            this.fields = requiredChild(fields, "fields");
        }
    }

    /**
     * Function signature. Params are absent only in method specs of interface types.
     */
    final class FuncType implements Expr {
        private @Nullable FieldList params;
        private @Nullable FieldList results;

        public FuncType(@Nullable FieldList params, @Nullable FieldList results) {
            this.params = params;
            this.results = results;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNC_TYPE;
        }

        public @Nullable FieldList params() {
            return params;
        }

        public void setParams(@Nullable FieldList params) {
            this.params = params;
        }

        public @Nullable FieldList results() {
            return results;
        }

        public void setResults(@Nullable FieldList results) {
            this.results = results;
        }
    }

    final class InterfaceType implements Expr {
        private FieldList methods;

        public InterfaceType(FieldList methods) {
            this.methods = requiredChild(methods, "methods");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INTERFACE_TYPE;
        }

        public FieldList methods() {
            return methods;
        }

        public void setMethods(FieldList methods) {
            this.methods = requiredChild(methods, "methods");
        }
    }

    final class MapType implements Expr {
        private Expr key;
        private Expr value;

        public MapType(Expr key, Expr value) {
            this.key = requiredChild(key, "key");
            this.value = requiredChild(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.MAP_TYPE;
        }

        public Expr key() {
            return key;
        }

        public void setKey(Expr key) {
            this.key = requiredChild(key, "key");
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = requiredChild(value, "value");
        }
    }

    final class ChanType implements Expr {
        private final ChanDir dir;
        private Expr value;

        public ChanType(ChanDir dir, Expr value) {
            this.dir = checkNotNull(dir);
            this.value = requiredChild(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CHAN_TYPE;
        }

        public ChanDir dir() {
            return dir;
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = requiredChild(value, "value");
        }
    }
}
