package org.pragmatica.astor.tree;

/**
 * The closed set of node kinds. Every concrete node class reports exactly one constant
 * and every constant maps back to exactly one node class.
 */
public enum NodeKind {
    // Comments and fields
    COMMENT(Node.Comment.class),
    COMMENT_GROUP(Node.CommentGroup.class),
    FIELD(Node.Field.class),
    FIELD_LIST(Node.FieldList.class),

    // Expressions
    BAD_EXPR(Expr.BadExpr.class),
    IDENT(Expr.Ident.class),
    ELLIPSIS(Expr.Ellipsis.class),
    BASIC_LIT(Expr.BasicLit.class),
    FUNC_LIT(Expr.FuncLit.class),
    COMPOSITE_LIT(Expr.CompositeLit.class),
    PAREN_EXPR(Expr.ParenExpr.class),
    SELECTOR_EXPR(Expr.SelectorExpr.class),
    INDEX_EXPR(Expr.IndexExpr.class),
    SLICE_EXPR(Expr.SliceExpr.class),
    TYPE_ASSERT_EXPR(Expr.TypeAssertExpr.class),
    CALL_EXPR(Expr.CallExpr.class),
    STAR_EXPR(Expr.StarExpr.class),
    UNARY_EXPR(Expr.UnaryExpr.class),
    BINARY_EXPR(Expr.BinaryExpr.class),
    KEY_VALUE_EXPR(Expr.KeyValueExpr.class),

    // Types
    ARRAY_TYPE(Expr.ArrayType.class),
    STRUCT_TYPE(Expr.StructType.class),
    FUNC_TYPE(Expr.FuncType.class),
    INTERFACE_TYPE(Expr.InterfaceType.class),
    MAP_TYPE(Expr.MapType.class),
    CHAN_TYPE(Expr.ChanType.class),

    // Statements
    BAD_STMT(Stmt.BadStmt.class),
    DECL_STMT(Stmt.DeclStmt.class),
    EMPTY_STMT(Stmt.EmptyStmt.class),
    LABELED_STMT(Stmt.LabeledStmt.class),
    EXPR_STMT(Stmt.ExprStmt.class),
    SEND_STMT(Stmt.SendStmt.class),
    INC_DEC_STMT(Stmt.IncDecStmt.class),
    ASSIGN_STMT(Stmt.AssignStmt.class),
    GO_STMT(Stmt.GoStmt.class),
    DEFER_STMT(Stmt.DeferStmt.class),
    RETURN_STMT(Stmt.ReturnStmt.class),
    BRANCH_STMT(Stmt.BranchStmt.class),
    BLOCK_STMT(Stmt.BlockStmt.class),
    IF_STMT(Stmt.IfStmt.class),
    CASE_CLAUSE(Stmt.CaseClause.class),
    SWITCH_STMT(Stmt.SwitchStmt.class),
    TYPE_SWITCH_STMT(Stmt.TypeSwitchStmt.class),
    COMM_CLAUSE(Stmt.CommClause.class),
    SELECT_STMT(Stmt.SelectStmt.class),
    FOR_STMT(Stmt.ForStmt.class),
    RANGE_STMT(Stmt.RangeStmt.class),

    // Declarations
    IMPORT_SPEC(Spec.ImportSpec.class),
    VALUE_SPEC(Spec.ValueSpec.class),
    TYPE_SPEC(Spec.TypeSpec.class),
    BAD_DECL(Decl.BadDecl.class),
    GEN_DECL(Decl.GenDecl.class),
    FUNC_DECL(Decl.FuncDecl.class),

    // Files and packages
    FILE(Node.File.class),
    PACKAGE(Node.Package.class);

    private final Class<? extends Node> type;

    NodeKind(Class<? extends Node> type) {
        this.type = type;
    }

    /**
     * The node class of this kind.
     */
    public Class<? extends Node> type() {
        return type;
    }
}
