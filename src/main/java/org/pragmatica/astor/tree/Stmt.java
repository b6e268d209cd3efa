package org.pragmatica.astor.tree;

import org.jetbrains.annotations.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.pragmatica.astor.tree.Children.childList;
import static org.pragmatica.astor.tree.Children.requiredChild;

/**
 * Statement nodes.
 */
public sealed interface Stmt extends Node {

    /**
     * Placeholder for a statement containing syntax errors.
     */
    final class BadStmt implements Stmt {
        @Override
        public NodeKind kind() {
            return NodeKind.BAD_STMT;
        }
    }

    /**
     * Declaration in a statement list.
     */
    final class DeclStmt implements Stmt {
        private Decl decl;

        public DeclStmt(Decl decl) {
            this.decl = requiredChild(decl, "decl");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DECL_STMT;
        }

        public Decl decl() {
            return decl;
        }

        public void setDecl(Decl decl) {
            this.decl = requiredChild(decl, "decl");
        }
    }

    /**
     * Explicit or implicit (inserted before a closing brace) empty statement.
     */
    final class EmptyStmt implements Stmt {
        private final boolean implicit;

        public EmptyStmt(boolean implicit) {
            this.implicit = implicit;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EMPTY_STMT;
        }

        public boolean implicit() {
            return implicit;
        }
    }

    final class LabeledStmt implements Stmt {
        private Expr.Ident label;
        private Stmt stmt;

        public LabeledStmt(Expr.Ident label, Stmt stmt) {
            this.label = requiredChild(label, "label");
            this.stmt = requiredChild(stmt, "stmt");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LABELED_STMT;
        }

        public Expr.Ident label() {
            return label;
        }

        public void setLabel(Expr.Ident label) {
            this.label = requiredChild(label, "label");
        }

        public Stmt stmt() {
            return stmt;
        }

        public void setStmt(Stmt stmt) {
            this.stmt = requiredChild(stmt, "stmt");
        }
    }

    /**
     * Stand-alone expression in a statement list.
     */
    final class ExprStmt implements Stmt {
        private Expr x;

        public ExprStmt(Expr x) {
            this.x = requiredChild(x, "x");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.EXPR_STMT;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }
    }

    /**
     * Channel send, {@code chan <- value}.
     */
    final class SendStmt implements Stmt {
        private Expr chan;
        private Expr value;

        public SendStmt(Expr chan, Expr value) {
            this.chan = requiredChild(chan, "chan");
            this.value = requiredChild(value, "value");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SEND_STMT;
        }

        public Expr chan() {
            return chan;
        }

        public void setChan(Expr chan) {
            this.chan = requiredChild(chan, "chan");
        }

        public Expr value() {
            return value;
        }

        public void setValue(Expr value) {
            this.value = requiredChild(value, "value");
        }
    }

    final class IncDecStmt implements Stmt {
        private Expr x;
        private final Token tok;

        public IncDecStmt(Expr x, Token tok) {
            checkArgument(tok == Token.INC || tok == Token.DEC, "Not an increment or decrement: %s", tok);
            this.x = requiredChild(x, "x");
            this.tok = tok;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.INC_DEC_STMT;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }

        public Token tok() {
            return tok;
        }
    }

    /**
     * Assignment or short variable declaration.
     */
    final class AssignStmt implements Stmt {
        private List<Expr> lhs;
        private final Token tok;
        private List<Expr> rhs;

        public AssignStmt(List<Expr> lhs, Token tok, List<Expr> rhs) {
            this.lhs = childList(lhs, "lhs");
            this.tok = checkNotNull(tok);
            this.rhs = childList(rhs, "rhs");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.ASSIGN_STMT;
        }

        public List<Expr> lhs() {
            return lhs;
        }

        public void setLhs(List<Expr> lhs) {
            this.lhs = childList(lhs, "lhs");
        }

        public Token tok() {
            return tok;
        }

        public List<Expr> rhs() {
            return rhs;
        }

        public void setRhs(List<Expr> rhs) {
            this.rhs = childList(rhs, "rhs");
        }
    }

    final class GoStmt implements Stmt {
        private Expr.CallExpr call;

        public GoStmt(Expr.CallExpr call) {
            this.call = requiredChild(call, "call");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.GO_STMT;
        }

        public Expr.CallExpr call() {
            return call;
        }

        public void setCall(Expr.CallExpr call) {
            this.call = requiredChild(call, "call");
        }
    }

    final class DeferStmt implements Stmt {
        private Expr.CallExpr call;

        public DeferStmt(Expr.CallExpr call) {
            this.call = requiredChild(call, "call");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.DEFER_STMT;
        }

        public Expr.CallExpr call() {
            return call;
        }

        public void setCall(Expr.CallExpr call) {
            this.call = requiredChild(call, "call");
        }
    }

    final class ReturnStmt implements Stmt {
        private List<Expr> results;

        public ReturnStmt(List<Expr> results) {
            this.results = childList(results, "results");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RETURN_STMT;
        }

        public List<Expr> results() {
            return results;
        }

        public void setResults(List<Expr> results) {
            this.results = childList(results, "results");
        }
    }

    /**
     * {@code break}, {@code continue}, {@code goto} or {@code fallthrough}, with optional label.
     */
    final class BranchStmt implements Stmt {
        private final Token tok;
        private Expr.@Nullable Ident label;

        public BranchStmt(Token tok, Expr.@Nullable Ident label) {
            checkArgument(tok == Token.BREAK || tok == Token.CONTINUE || tok == Token.GOTO || tok == Token.FALLTHROUGH,
                          "Not a branch keyword: %s", tok);
            this.tok = tok;
            this.label = label;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BRANCH_STMT;
        }

        public Token tok() {
            return tok;
        }

        public Expr.@Nullable Ident label() {
            return label;
        }

        public void setLabel(Expr.@Nullable Ident label) {
            this.label = label;
        }
    }

    /**
     * Braced statement list.
     */
    final class BlockStmt implements Stmt {
        private List<Stmt> list;

        public BlockStmt(List<Stmt> list) {
            this.list = childList(list, "list");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BLOCK_STMT;
        }

        public List<Stmt> list() {
            return list;
        }

        public void setList(List<Stmt> list) {
            this.list = childList(list, "list");
        }
    }

    /**
     * {@code if} statement. The else branch is either a block or another {@code if}.
     */
    final class IfStmt implements Stmt {
        private @Nullable Stmt init;
        private Expr cond;
        private BlockStmt body;
        private @Nullable Stmt elseStmt;

        public IfStmt(@Nullable Stmt init, Expr cond, BlockStmt body, @Nullable Stmt elseStmt) {
            this.init = init;
            this.cond = requiredChild(cond, "cond");
            this.body = requiredChild(body, "body");
            this.elseStmt = elseStmt;
        }

        @Override
        public NodeKind kind() {
            return NodeKind.IF_STMT;
        }

        public @Nullable Stmt init() {
            return init;
        }

        public void setInit(@Nullable Stmt init) {
            this.init = init;
        }

        public Expr cond() {
            return cond;
        }

        public void setCond(Expr cond) {
            this.cond = requiredChild(cond, "cond");
        }

        public BlockStmt body() {
            return body;
        }

        public void setBody(BlockStmt body) {
            this.body = requiredChild(body, "body");
        }

        public @Nullable Stmt elseStmt() {
            return elseStmt;
        }

        public void setElseStmt(@Nullable Stmt elseStmt) {
            this.elseStmt = elseStmt;
        }
    }

    /**
     * Case of an expression or type switch. An empty list marks the default case.
     */
    final class CaseClause implements Stmt {
        private List<Expr> list;
        private List<Stmt> body;

        public CaseClause(List<Expr> list, List<Stmt> body) {
            this.list = childList(list, "list");
            this.body = childList(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CASE_CLAUSE;
        }

        public List<Expr> list() {
            return list;
        }

        public void setList(List<Expr> list) {
            this.list = childList(list, "list");
        }

        public List<Stmt> body() {
            return body;
        }

        public void setBody(List<Stmt> body) {
            this.body = childList(body, "body");
        }

        public boolean isDefault() {
            return list.isEmpty();
        }
    }

    final class SwitchStmt implements Stmt {
        private @Nullable Stmt init;
        private @Nullable Expr tag;
        private BlockStmt body;

        public SwitchStmt(@Nullable Stmt init, @Nullable Expr tag, BlockStmt body) {
            this.init = init;
            this.tag = tag;
            this.body = requiredChild(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SWITCH_STMT;
        }

        public @Nullable Stmt init() {
            return init;
        }

        public void setInit(@Nullable Stmt init) {
            this.init = init;
        }

        public @Nullable Expr tag() {
            return tag;
        }

        public void setTag(@Nullable Expr tag) {
            this.tag = tag;
        }

        public BlockStmt body() {
            return body;
        }

        public void setBody(BlockStmt body) {
            this.body = requiredChild(body, "body");
        }
    }

    /**
     * Type switch. The assign slot holds {@code x := y.(type)} or {@code y.(type)}.
     */
    final class TypeSwitchStmt implements Stmt {
        private @Nullable Stmt init;
        private Stmt assign;
        private BlockStmt body;

        public TypeSwitchStmt(@Nullable Stmt init, Stmt assign, BlockStmt body) {
            this.init = init;
            this.assign = requiredChild(assign, "assign");
            this.body = requiredChild(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.TYPE_SWITCH_STMT;
        }

        public @Nullable Stmt init() {
            return init;
        }

        public void setInit(@Nullable Stmt init) {
            this.init = init;
        }

        public Stmt assign() {
            return assign;
        }

        public void setAssign(Stmt assign) {
            this.assign = requiredChild(assign, "assign");
        }

        public BlockStmt body() {
            return body;
        }

        public void setBody(BlockStmt body) {
            this.body = requiredChild(body, "body");
        }
    }

    /**
     * Case of a select statement. An absent comm marks the default case.
     */
    final class CommClause implements Stmt {
        private @Nullable Stmt comm;
        private List<Stmt> body;

        public CommClause(@Nullable Stmt comm, List<Stmt> body) {
            this.comm = comm;
            this.body = childList(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.COMM_CLAUSE;
        }

        public @Nullable Stmt comm() {
            return comm;
        }

        public void setComm(@Nullable Stmt comm) {
            this.comm = comm;
        }

        public List<Stmt> body() {
            return body;
        }

        public void setBody(List<Stmt> body) {
            this.body = childList(body, "body");
        }
    }

    final class SelectStmt implements Stmt {
        private BlockStmt body;

        public SelectStmt(BlockStmt body) {
            this.body = requiredChild(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.SELECT_STMT;
        }

        public BlockStmt body() {
            return body;
        }

        public void setBody(BlockStmt body) {
            this.body = requiredChild(body, "body");
        }
    }

    final class ForStmt implements Stmt {
        private @Nullable Stmt init;
        private @Nullable Expr cond;
        private @Nullable Stmt post;
        private BlockStmt body;

        public ForStmt(@Nullable Stmt init, @Nullable Expr cond, @Nullable Stmt post, BlockStmt body) {
            this.init = init;
            this.cond = cond;
            this.post = post;
            this.body = requiredChild(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FOR_STMT;
        }

        public @Nullable Stmt init() {
            return init;
        }

        public void setInit(@Nullable Stmt init) {
            this.init = init;
        }

        public @Nullable Expr cond() {
            return cond;
        }

        public void setCond(@Nullable Expr cond) {
            this.cond = cond;
        }

        public @Nullable Stmt post() {
            return post;
        }

        public void setPost(@Nullable Stmt post) {
            this.post = post;
        }

        public BlockStmt body() {
            return body;
        }

        public void setBody(BlockStmt body) {
            this.body = requiredChild(body, "body");
        }
    }

    /**
     * {@code for key, value := range x}. The token is {@link Token#DEFINE} or {@link Token#ASSIGN},
     * or {@code null} when key and value are both absent.
     */
    final class RangeStmt implements Stmt {
        private @Nullable Expr key;
        private @Nullable Expr value;
        private final @Nullable Token tok;
        private Expr x;
        private BlockStmt body;

        public RangeStmt(@Nullable Expr key, @Nullable Expr value, @Nullable Token tok, Expr x, BlockStmt body) {
            this.key = key;
            this.value = value;
            this.tok = tok;
            this.x = requiredChild(x, "x");
            this.body = requiredChild(body, "body");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.RANGE_STMT;
        }

        public @Nullable Expr key() {
            return key;
        }

        public void setKey(@Nullable Expr key) {
            this.key = key;
        }

        public @Nullable Expr value() {
            return value;
        }

        public void setValue(@Nullable Expr value) {
            this.value = value;
        }

        public @Nullable Token tok() {
            return tok;
        }

        public Expr x() {
            return x;
        }

        public void setX(Expr x) {
            this.x = requiredChild(x, "x");
        }

        public BlockStmt body() {
            return body;
        }

        public void setBody(BlockStmt body) {
            this.body = requiredChild(body, "body");
        }
    }
}
