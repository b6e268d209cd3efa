package org.pragmatica.astor.tree;

import org.jetbrains.annotations.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static org.pragmatica.astor.tree.Children.childList;
import static org.pragmatica.astor.tree.Children.requiredChild;

/**
 * Top-level and statement-level declarations.
 */
public sealed interface Decl extends Node {

    /**
     * Placeholder for a declaration containing syntax errors.
     */
    final class BadDecl implements Decl {
        @Override
        public NodeKind kind() {
            return NodeKind.BAD_DECL;
        }
    }

    /**
     * {@code import}, {@code const}, {@code type} or {@code var} declaration, possibly grouped.
     */
    final class GenDecl implements Decl {
        private @Nullable CommentGroup doc;
        private final Token tok;
        private final boolean grouped;
        private List<Spec> specs;

        public GenDecl(@Nullable CommentGroup doc, Token tok, boolean grouped, List<Spec> specs) {
            checkArgument(tok == Token.IMPORT || tok == Token.CONST || tok == Token.TYPE || tok == Token.VAR,
                          "Not a declaration keyword: %s", tok);
            this.doc = doc;
            this.tok = tok;
            this.grouped = grouped;
            this.specs = childList(specs, "specs");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GEN_DECL;
        }

        public @Nullable CommentGroup doc() {
            return doc;
        }

        public void setDoc(@Nullable CommentGroup doc) {
            this.doc = doc;
        }

        public Token tok() {
            return tok;
        }

        /**
         * Whether the specs are enclosed in parentheses.
         */
        public boolean grouped() {
            return grouped;
        }

        public List<Spec> specs() {
            return specs;
        }

        public void setSpecs(List<Spec> specs) {
            this.specs = childList(specs, "specs");
        }
    }

    /**
     * Function or method declaration. External functions have no body.
     */
    final class FuncDecl implements Decl {
        private @Nullable CommentGroup doc;
        private @Nullable FieldList recv;
        private Expr.Ident name;
        private Expr.FuncType type;
        private Stmt.@Nullable BlockStmt body;

        public FuncDecl(@Nullable CommentGroup doc,
                        @Nullable FieldList recv,
                        Expr.Ident name,
                        Expr.FuncType type,
                        Stmt.@Nullable BlockStmt body) {
            this.doc = doc;
            this.recv = recv;
            this.name = requiredChild(name, "name");
            this.type = requiredChild(type, "type");
            this.body = body;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNC_DECL;
        }

        public @Nullable CommentGroup doc() {
            return doc;
        }

        public void setDoc(@Nullable CommentGroup doc) {
            this.doc = doc;
        }

        public @Nullable FieldList recv() {
            return recv;
        }

        public void setRecv(@Nullable FieldList recv) {
            this.recv = recv;
        }

        public Expr.Ident name() {
            return name;
        }

        public void setName(Expr.Ident name) {
            this.name = requiredChild(name, "name");
        }

        public Expr.FuncType type() {
            return type;
        }

        public void setType(Expr.FuncType type) {
            this.type = requiredChild(type, "type");
        }

        public Stmt.@Nullable BlockStmt body() {
            return body;
        }

        public void setBody(Stmt.@Nullable BlockStmt body) {
            this.body = body;
        }
    }
}
