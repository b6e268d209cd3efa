package org.pragmatica.astor;

import org.pragmatica.astor.tree.ChanDir;
import org.pragmatica.astor.tree.Decl;
import org.pragmatica.astor.tree.Expr;
import org.pragmatica.astor.tree.Node;
import org.pragmatica.astor.tree.Spec;
import org.pragmatica.astor.tree.Stmt;
import org.pragmatica.astor.tree.Token;
import org.pragmatica.astor.tree.Expr.Ident;
import org.pragmatica.astor.tree.Node.CommentGroup;
import org.pragmatica.astor.tree.Node.Field;
import org.pragmatica.astor.tree.Node.FieldList;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Hand-built trees standing in for parser output. Every call returns a fresh tree.
 */
public final class SampleTrees {
    private SampleTrees() {}

    /**
     * <pre>
     * package widgets
     *
     * // Widget builds a widget.
     * func Widget(name string, size int) *Widget {
     *     return &amp;Widget{Name: name, Size: size}
     * }
     * </pre>
     */
    public static Node.File widgetFile() {
        var doc = CommentGroup.of("// Widget builds a widget.");
        var params = new FieldList(List.of(new Field(Ident.list("name"), Ident.of("string")),
                                           new Field(Ident.list("size"), Ident.of("int"))));
        var results = new FieldList(List.of(new Field(List.of(), new Expr.StarExpr(Ident.of("Widget")))));
        var literal = new Expr.CompositeLit(Ident.of("Widget"),
                                            List.of(new Expr.KeyValueExpr(Ident.of("Name"), Ident.of("name")),
                                                    new Expr.KeyValueExpr(Ident.of("Size"), Ident.of("size"))));
        var body = new Stmt.BlockStmt(List.of(new Stmt.ReturnStmt(List.of(new Expr.UnaryExpr(Token.AND, literal)))));
        var func = new Decl.FuncDecl(doc, null, Ident.of("Widget"), new Expr.FuncType(params, results), body);

        return new Node.File(null, Ident.of("widgets"), List.of(func), List.of(doc));
    }

    /**
     * {@code a + f(b, 1)}
     */
    public static Expr.BinaryExpr smallExpr() {
        var call = new Expr.CallExpr(Ident.of("f"), List.of(Ident.of("b"), intLit("1")));
        return new Expr.BinaryExpr(Ident.of("a"), Token.ADD, call);
    }

    /**
     * Statements dereferencing pointers: {@code x := *p; use(*q, *r)}.
     */
    public static Stmt.BlockStmt derefBlock() {
        var assign = new Stmt.AssignStmt(List.of(Ident.of("x")),
                                         Token.DEFINE,
                                         List.of(new Expr.StarExpr(Ident.of("p"))));
        var use = new Stmt.ExprStmt(new Expr.CallExpr(Ident.of("use"),
                                                      List.of(new Expr.StarExpr(Ident.of("q")),
                                                              new Expr.StarExpr(Ident.of("r")))));
        return new Stmt.BlockStmt(List.of(assign, use));
    }

    /**
     * A two-file package holding at least one node of every kind.
     */
    public static Node.Package everyKind() {
        var files = new LinkedHashMap<String, Node.File>();
        files.put("types.go", typesFile());
        files.put("run.go", runFile());
        return new Node.Package("sample", files);
    }

    private static Node.File typesFile() {
        var fileDoc = CommentGroup.of("// Package sample exercises every node.");

        var imports = new Decl.GenDecl(null, Token.IMPORT, true,
                                       List.of(new Spec.ImportSpec(null, Ident.of("fmt"), stringLit("\"fmt\""), null)));

        var constDoc = CommentGroup.of("// Answer is the answer.");
        var constants = new Decl.GenDecl(constDoc, Token.CONST, false,
                                         List.of(new Spec.ValueSpec(null, Ident.list("Answer"), null,
                                                                    List.of(intLit("42")), null)));

        var variables = new Decl.GenDecl(null, Token.VAR, false,
                                         List.of(new Spec.ValueSpec(null, Ident.list("x", "y"), Ident.of("int"),
                                                                    List.of(intLit("1"), intLit("2")), null)));

        var coordsComment = CommentGroup.of("// coordinates");
        var point = new Spec.TypeSpec(null, Ident.of("Point"), false,
                                      new Expr.StructType(new FieldList(List.of(
                                          new Field(null, Ident.list("X", "Y"), Ident.of("int"),
                                                    stringLit("`json:\"xy\"`"), coordsComment)))),
                                      null);

        var area = new Field(Ident.list("Area"),
                             new Expr.FuncType(FieldList.empty(),
                                               new FieldList(List.of(new Field(List.of(), Ident.of("float64"))))));
        var shape = new Spec.TypeSpec(null, Ident.of("Shape"), false,
                                      new Expr.InterfaceType(new FieldList(List.of(area))), null);

        var handlerParams = new FieldList(List.of(
            new Field(Ident.list("ch"), new Expr.ChanType(ChanDir.SEND, Ident.of("int"))),
            new Field(Ident.list("m"), new Expr.MapType(Ident.of("string"), new Expr.ArrayType(null, Ident.of("int")))),
            new Field(Ident.list("args"), new Expr.Ellipsis(Ident.of("int")))));
        var handler = new Spec.TypeSpec(null, Ident.of("Handler"), false, new Expr.FuncType(handlerParams, null), null);

        var types = new Decl.GenDecl(null, Token.TYPE, true, List.of(point, shape, handler));

        return new Node.File(fileDoc,
                             Ident.of("sample"),
                             List.of(imports, constants, variables, types, new Decl.BadDecl()),
                             List.of(fileDoc, constDoc, coordsComment));
    }

    private static Node.File runFile() {
        var recv = new FieldList(List.of(new Field(Ident.list("p"), new Expr.StarExpr(Ident.of("Point")))));
        var params = new FieldList(List.of(new Field(Ident.list("n"), Ident.of("int"))));
        var results = new FieldList(List.of(new Field(Ident.list("err"), Ident.of("error"))));

        var declareArray = new Stmt.DeclStmt(new Decl.GenDecl(null, Token.VAR, false, List.of(
            new Spec.ValueSpec(null, Ident.list("z"), new Expr.ArrayType(intLit("3"), Ident.of("int")), List.of(), null))));
        var total = define("total", intLit("0"));
        var increment = new Stmt.IncDecStmt(Ident.of("total"), Token.INC);
        var spawn = new Stmt.GoStmt(new Expr.CallExpr(Expr.SelectorExpr.of("fmt", "Println"), List.of(Ident.of("total"))));
        var closeLater = new Stmt.DeferStmt(new Expr.CallExpr(Ident.of("close"), List.of(Ident.of("ch"))));
        var send = new Stmt.SendStmt(Ident.of("ch"), new Expr.UnaryExpr(Token.SUB, Ident.of("total")));
        var closure = define("f", new Expr.FuncLit(new Expr.FuncType(FieldList.empty(), null),
                                                   new Stmt.BlockStmt(List.of())));
        var slice = define("s", new Expr.SliceExpr(Ident.of("z"), intLit("1"), intLit("2"), intLit("3"), true));
        var index = define("v", new Expr.IndexExpr(Ident.of("z"), intLit("0")));
        var assertion = new Stmt.AssignStmt(List.of(Ident.of("w"), Ident.of("ok")), Token.DEFINE,
                                            List.of(new Expr.TypeAssertExpr(Ident.of("x"), Ident.of("int"))));
        var composite = define("pt", new Expr.CompositeLit(Ident.of("Point"), List.of(
            new Expr.KeyValueExpr(Ident.of("X"),
                                  new Expr.ParenExpr(new Expr.BinaryExpr(intLit("1"), Token.ADD, intLit("2")))))));

        var loopBody = new Stmt.BlockStmt(List.of(
            new Stmt.IfStmt(null,
                            new Expr.BinaryExpr(Ident.of("i"), Token.EQL, intLit("2")),
                            new Stmt.BlockStmt(List.of(new Stmt.BranchStmt(Token.CONTINUE, Ident.of("loop")))),
                            new Stmt.BlockStmt(List.of(new Stmt.BranchStmt(Token.BREAK, null))))));
        var loop = new Stmt.LabeledStmt(Ident.of("loop"),
                                        new Stmt.ForStmt(define("i", intLit("0")),
                                                         new Expr.BinaryExpr(Ident.of("i"), Token.LSS, Ident.of("n")),
                                                         new Stmt.IncDecStmt(Ident.of("i"), Token.INC),
                                                         loopBody));
        var ranging = new Stmt.RangeStmt(Ident.of("k"), Ident.of("e"), Token.DEFINE, Ident.of("m"),
                                         new Stmt.BlockStmt(List.of()));

        var switching = new Stmt.SwitchStmt(define("t", Ident.of("n")), Ident.of("t"), new Stmt.BlockStmt(List.of(
            new Stmt.CaseClause(List.of(intLit("1")), List.of(new Stmt.BranchStmt(Token.FALLTHROUGH, null))),
            new Stmt.CaseClause(List.of(), List.of()))));
        var typeSwitching = new Stmt.TypeSwitchStmt(null,
                                                    define("y", new Expr.TypeAssertExpr(Ident.of("x"), null)),
                                                    new Stmt.BlockStmt(List.of(
                                                        new Stmt.CaseClause(List.of(Ident.of("int")), List.of()))));
        var selecting = new Stmt.SelectStmt(new Stmt.BlockStmt(List.of(
            new Stmt.CommClause(define("r", new Expr.UnaryExpr(Token.ARROW, Ident.of("ch"))),
                                List.of(new Stmt.EmptyStmt(false))),
            new Stmt.CommClause(null, List.of()))));

        var body = new Stmt.BlockStmt(List.of(
            declareArray, total, increment, spawn, closeLater, send, closure, slice, index, assertion, composite,
            new Stmt.BadStmt(), loop, ranging, switching, typeSwitching, selecting,
            new Stmt.ExprStmt(new Expr.CallExpr(Ident.of("g"), List.of(new Expr.BadExpr()))),
            new Stmt.ReturnStmt(List.of(Ident.of("nil")))));

        var run = new Decl.FuncDecl(null, recv, Ident.of("Run"), new Expr.FuncType(params, results), body);
        return new Node.File(Ident.of("sample"), List.of(run));
    }

    private static Stmt.AssignStmt define(String name, Expr value) {
        return new Stmt.AssignStmt(List.of(Ident.of(name)), Token.DEFINE, List.of(value));
    }

    private static Expr.BasicLit intLit(String value) {
        return new Expr.BasicLit(Token.INT, value);
    }

    private static Expr.BasicLit stringLit(String value) {
        return new Expr.BasicLit(Token.STRING, value);
    }
}
