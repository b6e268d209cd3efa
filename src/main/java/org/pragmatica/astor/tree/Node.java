package org.pragmatica.astor.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.pragmatica.astor.tree.Children.childList;
import static org.pragmatica.astor.tree.Children.requiredChild;

/**
 * Syntax tree node of a Go source file or package.
 *
 * <p>The hierarchy is closed: expressions, statements, specs and declarations live in their own
 * sealed families, while comments, fields, files and packages are declared here. Child slots are
 * mutable so that a traversal can install replacement subtrees in place; leaf data is fixed at
 * construction.
 */
public sealed interface Node
    permits Expr, Stmt, Spec, Decl,
            Node.Comment, Node.CommentGroup, Node.Field, Node.FieldList, Node.File, Node.Package {

    /**
     * The kind of this node.
     */
    NodeKind kind();

    // === Comments ===

    /**
     * A single {@code //} or {@code /*} comment.
     */
    final class Comment implements Node {
        private final String text;

        public Comment(String text) {
            this.text = checkNotNull(text);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMMENT;
        }

        public String text() {
            return text;
        }

        @Override
        public String toString() {
            return text;
        }
    }

    /**
     * A sequence of comments with no other tokens and no empty lines between.
     */
    final class CommentGroup implements Node {
        private List<Comment> list;

        public CommentGroup(List<Comment> list) {
            this.list = childList(list, "list");
        }

        public static CommentGroup of(String... lines) {
            return new CommentGroup(Arrays.stream(lines)
                                          .map(Comment::new)
                                          .toList());
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMMENT_GROUP;
        }

        public List<Comment> list() {
            return list;
        }

        public void setList(List<Comment> list) {
            this.list = childList(list, "list");
        }
    }

    // === Fields ===

    /**
     * A field declaration in a struct, interface, parameter or result list.
     * Anonymous fields and unnamed parameters have no names.
     */
    final class Field implements Node {
        private @Nullable CommentGroup doc;
        private List<Expr.Ident> names;
        private Expr type;
        private Expr.@Nullable BasicLit tag;
        private @Nullable CommentGroup comment;

        public Field(@Nullable CommentGroup doc,
                     List<Expr.Ident> names,
                     Expr type,
                     Expr.@Nullable BasicLit tag,
                     @Nullable CommentGroup comment) {
            this.doc = doc;
            this.names = childList(names, "names");
            this.type = requiredChild(type, "type");
            this.tag = tag;
            this.comment = comment;
        }

        public Field(List<Expr.Ident> names, Expr type) {
            this(null, names, type, null, null);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FIELD;
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

        public Expr type() {
            return type;
        }

        public void setType(Expr type) {
            this.type = requiredChild(type, "type");
        }

        public Expr.@Nullable BasicLit tag() {
            return tag;
        }

        public void setTag(Expr.@Nullable BasicLit tag) {
            this.tag = tag;
        }

        public @Nullable CommentGroup comment() {
            return comment;
        }

        public void setComment(@Nullable CommentGroup comment) {
            this.comment = comment;
        }
    }

    /**
     * A list of fields enclosed by parentheses or braces.
     */
    final class FieldList implements Node {
        private List<Field> list;

        public FieldList(List<Field> list) {
            this.list = childList(list, "list");
        }

        public static FieldList empty() {
            return new FieldList(List.of());
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FIELD_LIST;
        }

        public List<Field> list() {
            return list;
        }

        public void setList(List<Field> list) {
            this.list = childList(list, "list");
        }
    }

    // === Files and packages ===

    /**
     * A Go source file.
     *
     * <p>{@link #comments()} lists every comment group of the file, including those attached to
     * declarations and fields. It is bookkeeping rather than a child slot, so traversals do not
     * walk it.
     */
    final class File implements Node {
        private @Nullable CommentGroup doc;
        private Expr.Ident name;
        private List<Decl> decls;
        private List<CommentGroup> comments;

        public File(@Nullable CommentGroup doc, Expr.Ident name, List<Decl> decls, List<CommentGroup> comments) {
            this.doc = doc;
            this.name = requiredChild(name, "name");
            this.decls = childList(decls, "decls");
            this.comments = childList(comments, "comments");
        }

        public File(Expr.Ident name, List<Decl> decls) {
            this(null, name, decls, List.of());
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FILE;
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

        public List<Decl> decls() {
            return decls;
        }

        public void setDecls(List<Decl> decls) {
            this.decls = childList(decls, "decls");
        }

        public List<CommentGroup> comments() {
            return comments;
        }

        public void setComments(List<CommentGroup> comments) {
            this.comments = childList(comments, "comments");
        }
    }

    /**
     * A set of source files building a Go package. Files are kept in insertion order.
     */
    final class Package implements Node {
        private final String name;
        private final Map<String, File> files;

        public Package(String name, Map<String, File> files) {
            this.name = checkNotNull(name);
            this.files = new LinkedHashMap<>();
            checkNotNull(files).forEach((fileName, file) -> this.files.put(fileName, requiredChild(file, fileName)));
        }

        @Override
        public NodeKind kind() {
            return NodeKind.PACKAGE;
        }

        public String name() {
            return name;
        }

        /**
         * Files keyed by file name. Replacing the value of an existing key keeps its position.
         */
        public Map<String, File> files() {
            return files;
        }
    }
}
