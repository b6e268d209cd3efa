package org.pragmatica.astor.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.astor.SampleTrees;
import org.pragmatica.astor.inspect.InspectorEngine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    @Test
    void nodeKind_typesAreDistinctConcreteClasses() {
        var types = Arrays.stream(NodeKind.values()).map(NodeKind::type).toList();

        assertThat(types).doesNotHaveDuplicates();
        assertThat(types).allSatisfy(type -> assertThat(Node.class).isAssignableFrom(type));
    }

    @Test
    void nodeKind_reportedByEachNodeMatchesItsClass() {
        var mismatched = new ArrayList<String>();

        InspectorEngine.create((cursor, node) -> {
            if (node != null && node.kind().type() != node.getClass()) {
                mismatched.add(node.getClass().getSimpleName() + " reports " + node.kind());
            }
            return true;
        }).inspect(SampleTrees.everyKind());

        assertThat(mismatched).isEmpty();
    }

    @Test
    void requiredChild_null_rejected() {
        assertThatThrownBy(() -> new Expr.BinaryExpr(null, Token.ADD, Expr.Ident.of("b")))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("'x'");

        var expr = SampleTrees.smallExpr();
        assertThatThrownBy(() -> expr.setY(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void childList_nullElement_rejected() {
        var names = new ArrayList<Expr.Ident>();
        names.add(null);

        assertThatThrownBy(() -> new Node.Field(names, Expr.Ident.of("int")))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void childList_isMutableCopy() {
        var original = List.<Stmt>of(new Stmt.EmptyStmt(true));
        var block = new Stmt.BlockStmt(original);

        block.list().add(new Stmt.BadStmt());

        assertThat(block.list()).hasSize(2);
        assertThat(original).hasSize(1);
    }

    @Test
    void basicLit_requiresLiteralKind() {
        assertThatThrownBy(() -> new Expr.BasicLit(Token.ADD, "+"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Not a literal kind");
    }

    @Test
    void statementTokens_restrictedToTheirKeywords() {
        assertThatThrownBy(() -> new Stmt.IncDecStmt(Expr.Ident.of("i"), Token.ADD))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Stmt.BranchStmt(Token.IMPORT, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Decl.GenDecl(null, Token.BREAK, false, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void caseClause_withEmptyList_isDefault() {
        assertThat(new Stmt.CaseClause(List.of(), List.of()).isDefault()).isTrue();
        assertThat(new Stmt.CaseClause(List.of(Expr.Ident.of("x")), List.of()).isDefault()).isFalse();
    }

    @Test
    void package_keepsFileInsertionOrder() {
        var files = new LinkedHashMap<String, Node.File>();
        files.put("z.go", new Node.File(Expr.Ident.of("p"), List.of()));
        files.put("a.go", new Node.File(Expr.Ident.of("p"), List.of()));
        files.put("m.go", new Node.File(Expr.Ident.of("p"), List.of()));

        var pkg = new Node.Package("p", files);

        assertThat(pkg.files().keySet()).containsExactly("z.go", "a.go", "m.go");
    }

    @Test
    void token_spellingAndClassification() {
        assertThat(Token.AND_NOT.text()).isEqualTo("&^");
        assertThat(Token.STRING.isLiteral()).isTrue();
        assertThat(Token.ADD.isLiteral()).isFalse();
        assertThat(Token.GOTO.isKeyword()).isTrue();
        assertThat(Token.DEFINE.isKeyword()).isFalse();
    }
}
