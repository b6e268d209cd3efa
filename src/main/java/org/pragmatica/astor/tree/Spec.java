package org.pragmatica.astor.tree;

import org.jetbrains.annotations.Nullable;

import java.util.List;

import static org.pragmatica.astor.tree.Children.childList;
import static org.pragmatica.astor.tree.Children.requiredChild;

/**
 * Specs of a general declaration: imports, constants or variables, and types.
 */
public sealed interface Spec extends Node {

    /**
     * Single package import. The name is present for renamed, dot and blank imports.
     */
    final class ImportSpec implements Spec {
        private @Nullable CommentGroup doc;
        private Expr.@Nullable Ident name;
        private Expr.BasicLit path;
        private @Nullable CommentGroup comment;

        public ImportSpec(@Nullable CommentGroup doc,
                          Expr.@Nullable Ident name,
                          Expr.BasicLit path,
                          @Nullable CommentGroup comment) {
            this.doc = doc;
            this.name = name;
            this.path = requiredChild(path, "path");
            this.comment = comment;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IMPORT_SPEC;
        }

        public @Nullable CommentGroup doc() {
            return doc;
        }

        public void setDoc(@Nullable CommentGroup doc) {
            this.doc = doc;
        }

        public Expr.@Nullable Ident name() {
            return name;
        }

        public void setName(Expr.@Nullable Ident name) {
            this.name = name;
        }

        public Expr.BasicLit path() {
            return path;
        }

        public void setPath(Expr.BasicLit path) {
            this.path = requiredChild(path, "path");
        }

        public @Nullable CommentGroup comment() {
            return comment;
        }

        public void setComment(@Nullable CommentGroup comment) {
            this.comment = comment;
        }
    }

    /**
     * Constant or variable declaration.
     */
    final class ValueSpec implements Spec {
        private @Nullable CommentGroup doc;
        private List<Expr.Ident> names;
        private @Nullable Expr type;
        private List<Expr> values;
        private @Nullable CommentGroup comment;

        public ValueSpec(@Nullable CommentGroup doc,
                         List<Expr.Ident> names,
                         @Nullable Expr type,
                         List<Expr> values,
                         @Nullable CommentGroup comment) {
            this.doc = doc;
            this.names = childList(names, "names");
            this.type = type;
            this.values = childList(values, "values");
            this.comment = comment;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.VALUE_SPEC;
        }

        public @Nullable CommentGroup doc() {
            return doc;
        }

        public void setDoc(@Nullable CommentGroup doc) {
            this.doc = doc;
        }

        public List<Expr.Ident> names() {
            return names;
        }

        public void setNames(List<Expr.Ident> names) {
            this.names = childList(names, "names");
        }

        public @Nullable Expr type() {
            return type;
        }

        public void setType(@Nullable Expr type) {
            this.type = type;
        }

        public List<Expr> values() {
            return values;
        }

        public void setValues(List<Expr> values) {
            this.values = childList(values, "values");
        }

        public @Nullable CommentGroup comment() {
            return comment;
        }

        public void setComment(@Nullable CommentGroup comment) {
            this.comment = comment;
        }
    }

    /**
     * Type declaration, {@code Name Type} or the alias form {@code Name = Type}.
     */
    final class TypeSpec implements Spec {
        private @Nullable CommentGroup doc;
        private Expr.Ident name;
        private final boolean alias;
        private Expr type;
        private @Nullable CommentGroup comment;

        public TypeSpec(@Nullable CommentGroup doc,
                        Expr.Ident name,
                        boolean alias,
                        Expr type,
                        @Nullable CommentGroup comment) {
            this.doc = doc;
            this.name = requiredChild(name, "name");
            this.alias = alias;
            this.type = requiredChild(type, "type");
            this.comment = comment;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_SPEC;
        }

        public @Nullable CommentGroup doc() {
            return doc;
        }

        public void setDoc(@Nullable CommentGroup doc) {
            this.doc = doc;
        }

        public Expr.Ident name() {
            return name;
        }

        public void setName(Expr.Ident name) {
            this.name = requiredChild(name, "name");
        }

        public boolean alias() {
            return alias;
        }

        public Expr type() {
            return type;
        }

        public void setType(Expr type) {
            this.type = requiredChild(type, "type");
        }

        public @Nullable CommentGroup comment() {
            return comment;
        }

        public void setComment(@Nullable CommentGroup comment) {
            this.comment = comment;
        }
    }
}
