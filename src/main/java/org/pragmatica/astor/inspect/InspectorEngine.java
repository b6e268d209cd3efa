package org.pragmatica.astor.inspect;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.astor.error.InspectError;
import org.pragmatica.astor.error.InspectionException;
import org.pragmatica.astor.tree.Decl;
import org.pragmatica.astor.tree.Expr;
import org.pragmatica.astor.tree.Node;
import org.pragmatica.astor.tree.Spec;
import org.pragmatica.astor.tree.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Inspection engine - dispatches on the node kind to walk every child slot in source order.
 *
 * <p>Each child is inspected recursively and the result is written back into its slot, so a
 * replacement requested by the visitor lands in the parent as soon as the recursive call
 * returns. Results are checked against the slot type before they are installed.
 */
public final class InspectorEngine implements Inspector {
    private static final Logger LOG = LoggerFactory.getLogger(InspectorEngine.class);

    private final Visitor visitor;
    private final InspectorConfig config;
    private final @Nullable ReentrantLock visitLock;

    private InspectorEngine(Visitor visitor, InspectorConfig config) {
        this.visitor = visitor;
        this.config = config;
        this.visitLock = config.serializeVisits() ? new ReentrantLock() : null;
    }

    public static InspectorEngine create(Visitor visitor) {
        return create(visitor, InspectorConfig.DEFAULT);
    }

    public static InspectorEngine create(Visitor visitor, InspectorConfig config) {
        return new InspectorEngine(checkNotNull(visitor, "visitor"), checkNotNull(config, "config"));
    }

    @Override
    public Node inspect(Node root) {
        checkNotNull(root, "root");
        LOG.debug("Inspecting tree rooted at {}", root.kind());

        var result = inspectNode(root);

        LOG.debug("Finished inspecting tree rooted at {}, resulting root is {}", root.kind(), result.kind());
        return result;
    }

    @Override
    public <T extends Node> T inspect(T root, Class<T> expected) {
        return conform(inspect(root), expected, "root", -1);
    }

    @Override
    public Visited visit(@Nullable Node node) {
        if (visitLock == null) {
            return invokeVisitor(node);
        }

        visitLock.lock();
        try {
            return invokeVisitor(node);
        } finally {
            visitLock.unlock();
        }
    }

    private Visited invokeVisitor(@Nullable Node node) {
        var cursor = new VisitCursor(node);
        boolean recurse;

        try {
            recurse = visitor.visit(cursor, node);
        } finally {
            cursor.close();
        }

        var result = cursor.current();

        if (config.traceVisits() && LOG.isTraceEnabled()) {
            LOG.trace("Visited {}, recurse: {}", node == null ? "<close>" : node.kind(), recurse);
        }
        if (cursor.replaced() && node != null && result != null) {
            LOG.debug("Replaced {} with {}", node.kind(), result.kind());
        }
        return new Visited(result, recurse);
    }

    // === Dispatch ===

    private Node inspectNode(Node node) {
        var visited = visit(node);
        var current = checkNotNull(visited.node());

        if (!visited.recurse()) {
            return current;
        }

        var inspected = inspectChildren(current);
        visit(null);

        return inspected;
    }

    // Cases follow the declaration order of NodeKind. No default branch: a kind without a case
    // does not compile. Returns the node with its inspected children installed.
    private Node inspectChildren(Node node) {
        return switch (node.kind()) {
            // Comments and fields
            case COMMENT -> node;
            case COMMENT_GROUP -> commentGroup((Node.CommentGroup) node);
            case FIELD -> field((Node.Field) node);
            case FIELD_LIST -> fieldList((Node.FieldList) node);

            // Expressions
            case BAD_EXPR, IDENT -> node;
            case ELLIPSIS -> ellipsis((Expr.Ellipsis) node);
            case BASIC_LIT -> node;
            case FUNC_LIT -> funcLit((Expr.FuncLit) node);
            case COMPOSITE_LIT -> compositeLit((Expr.CompositeLit) node);
            case PAREN_EXPR -> parenExpr((Expr.ParenExpr) node);
            case SELECTOR_EXPR -> selectorExpr((Expr.SelectorExpr) node);
            case INDEX_EXPR -> indexExpr((Expr.IndexExpr) node);
            case SLICE_EXPR -> sliceExpr((Expr.SliceExpr) node);
            case TYPE_ASSERT_EXPR -> typeAssertExpr((Expr.TypeAssertExpr) node);
            case CALL_EXPR -> callExpr((Expr.CallExpr) node);
            case STAR_EXPR -> starExpr((Expr.StarExpr) node);
            case UNARY_EXPR -> unaryExpr((Expr.UnaryExpr) node);
            case BINARY_EXPR -> binaryExpr((Expr.BinaryExpr) node);
            case KEY_VALUE_EXPR -> keyValueExpr((Expr.KeyValueExpr) node);

            // Types
            case ARRAY_TYPE -> arrayType((Expr.ArrayType) node);
            case STRUCT_TYPE -> structType((Expr.StructType) node);
            case FUNC_TYPE -> funcType((Expr.FuncType) node);
            case INTERFACE_TYPE -> interfaceType((Expr.InterfaceType) node);
            case MAP_TYPE -> mapType((Expr.MapType) node);
            case CHAN_TYPE -> chanType((Expr.ChanType) node);

            // Statements
            case BAD_STMT -> node;
            case DECL_STMT -> declStmt((Stmt.DeclStmt) node);
            case EMPTY_STMT -> node;
            case LABELED_STMT -> labeledStmt((Stmt.LabeledStmt) node);
            case EXPR_STMT -> exprStmt((Stmt.ExprStmt) node);
            case SEND_STMT -> sendStmt((Stmt.SendStmt) node);
            case INC_DEC_STMT -> incDecStmt((Stmt.IncDecStmt) node);
            case ASSIGN_STMT -> assignStmt((Stmt.AssignStmt) node);
            case GO_STMT -> goStmt((Stmt.GoStmt) node);
            case DEFER_STMT -> deferStmt((Stmt.DeferStmt) node);
            case RETURN_STMT -> returnStmt((Stmt.ReturnStmt) node);
            case BRANCH_STMT -> branchStmt((Stmt.BranchStmt) node);
            case BLOCK_STMT -> blockStmt((Stmt.BlockStmt) node);
            case IF_STMT -> ifStmt((Stmt.IfStmt) node);
            case CASE_CLAUSE -> caseClause((Stmt.CaseClause) node);
            case SWITCH_STMT -> switchStmt((Stmt.SwitchStmt) node);
            case TYPE_SWITCH_STMT -> typeSwitchStmt((Stmt.TypeSwitchStmt) node);
            case COMM_CLAUSE -> commClause((Stmt.CommClause) node);
            case SELECT_STMT -> selectStmt((Stmt.SelectStmt) node);
            case FOR_STMT -> forStmt((Stmt.ForStmt) node);
            case RANGE_STMT -> rangeStmt((Stmt.RangeStmt) node);

            // Declarations
            case IMPORT_SPEC -> importSpec((Spec.ImportSpec) node);
            case VALUE_SPEC -> valueSpec((Spec.ValueSpec) node);
            case TYPE_SPEC -> typeSpec((Spec.TypeSpec) node);
            case BAD_DECL -> node;
            case GEN_DECL -> genDecl((Decl.GenDecl) node);
            case FUNC_DECL -> funcDecl((Decl.FuncDecl) node);

            // Files and packages
            case FILE -> file((Node.File) node);
            case PACKAGE -> pkg((Node.Package) node);
        };
    }

    // === Comments and fields ===

    private Node commentGroup(Node.CommentGroup n) {
        replaceEach(n.list(), Node.Comment.class, "CommentGroup.list");
        return n;
    }

    private Node field(Node.Field n) {
        n.setDoc(optionalChild(n.doc(), Node.CommentGroup.class, "Field.doc"));
        n.setNames(inspectIdentList(n.names(), "Field.names"));
        n.setType(child(n.type(), Expr.class, "Field.type"));
        n.setTag(optionalChild(n.tag(), Expr.BasicLit.class, "Field.tag"));
        n.setComment(optionalChild(n.comment(), Node.CommentGroup.class, "Field.comment"));
        return n;
    }

    private Node fieldList(Node.FieldList n) {
        replaceEach(n.list(), Node.Field.class, "FieldList.list");
        return n;
    }

    // === Expressions ===

    private Node ellipsis(Expr.Ellipsis n) {
        n.setElt(optionalChild(n.elt(), Expr.class, "Ellipsis.elt"));
        return n;
    }

    private Node funcLit(Expr.FuncLit n) {
        n.setType(child(n.type(), Expr.FuncType.class, "FuncLit.type"));
        n.setBody(child(n.body(), Stmt.BlockStmt.class, "FuncLit.body"));
        return n;
    }

    private Node compositeLit(Expr.CompositeLit n) {
        n.setType(optionalChild(n.type(), Expr.class, "CompositeLit.type"));
        n.setElts(inspectExprList(n.elts(), "CompositeLit.elts"));
        return n;
    }

    private Node parenExpr(Expr.ParenExpr n) {
        n.setX(child(n.x(), Expr.class, "ParenExpr.x"));
        return n;
    }

    private Node selectorExpr(Expr.SelectorExpr n) {
        n.setX(child(n.x(), Expr.class, "SelectorExpr.x"));
        n.setSel(child(n.sel(), Expr.Ident.class, "SelectorExpr.sel"));
        return n;
    }

    private Node indexExpr(Expr.IndexExpr n) {
        n.setX(child(n.x(), Expr.class, "IndexExpr.x"));
        n.setIndex(child(n.index(), Expr.class, "IndexExpr.index"));
        return n;
    }

    private Node sliceExpr(Expr.SliceExpr n) {
        n.setX(child(n.x(), Expr.class, "SliceExpr.x"));
        n.setLow(optionalChild(n.low(), Expr.class, "SliceExpr.low"));
        n.setHigh(optionalChild(n.high(), Expr.class, "SliceExpr.high"));
        n.setMax(optionalChild(n.max(), Expr.class, "SliceExpr.max"));
        return n;
    }

    private Node typeAssertExpr(Expr.TypeAssertExpr n) {
        n.setX(child(n.x(), Expr.class, "TypeAssertExpr.x"));
        n.setType(optionalChild(n.type(), Expr.class, "TypeAssertExpr.type"));
        return n;
    }

    private Node callExpr(Expr.CallExpr n) {
        n.setFun(child(n.fun(), Expr.class, "CallExpr.fun"));
        n.setArgs(inspectExprList(n.args(), "CallExpr.args"));
        return n;
    }

    private Node starExpr(Expr.StarExpr n) {
        n.setX(child(n.x(), Expr.class, "StarExpr.x"));
        return n;
    }

    private Node unaryExpr(Expr.UnaryExpr n) {
        n.setX(child(n.x(), Expr.class, "UnaryExpr.x"));
        return n;
    }

    private Node binaryExpr(Expr.BinaryExpr n) {
        n.setX(child(n.x(), Expr.class, "BinaryExpr.x"));
        n.setY(child(n.y(), Expr.class, "BinaryExpr.y"));
        return n;
    }

    private Node keyValueExpr(Expr.KeyValueExpr n) {
        n.setKey(child(n.key(), Expr.class, "KeyValueExpr.key"));
        n.setValue(child(n.value(), Expr.class, "KeyValueExpr.value"));
        return n;
    }

    // === Types ===

    private Node arrayType(Expr.ArrayType n) {
        n.setLen(optionalChild(n.len(), Expr.class, "ArrayType.len"));
        n.setElt(child(n.elt(), Expr.class, "ArrayType.elt"));
        return n;
    }

    private Node structType(Expr.StructType n) {
        n.setFields(child(n.fields(), Node.FieldList.class, "StructType.fields"));
        return n;
    }

    private Node funcType(Expr.FuncType n) {
        n.setParams(optionalChild(n.params(), Node.FieldList.class, "FuncType.params"));
        n.setResults(optionalChild(n.results(), Node.FieldList.class, "FuncType.results"));
        return n;
    }

    private Node interfaceType(Expr.InterfaceType n) {
        n.setMethods(child(n.methods(), Node.FieldList.class, "InterfaceType.methods"));
        return n;
    }

    private Node mapType(Expr.MapType n) {
        n.setKey(child(n.key(), Expr.class, "MapType.key"));
        n.setValue(child(n.value(), Expr.class, "MapType.value"));
        return n;
    }

    private Node chanType(Expr.ChanType n) {
        n.setValue(child(n.value(), Expr.class, "ChanType.value"));
        return n;
    }

    // === Statements ===

    private Node declStmt(Stmt.DeclStmt n) {
        n.setDecl(child(n.decl(), Decl.class, "DeclStmt.decl"));
        return n;
    }

    private Node labeledStmt(Stmt.LabeledStmt n) {
        n.setLabel(child(n.label(), Expr.Ident.class, "LabeledStmt.label"));
        n.setStmt(child(n.stmt(), Stmt.class, "LabeledStmt.stmt"));
        return n;
    }

    private Node exprStmt(Stmt.ExprStmt n) {
        n.setX(child(n.x(), Expr.class, "ExprStmt.x"));
        return n;
    }

    private Node sendStmt(Stmt.SendStmt n) {
        n.setChan(child(n.chan(), Expr.class, "SendStmt.chan"));
        n.setValue(child(n.value(), Expr.class, "SendStmt.value"));
        return n;
    }

    private Node incDecStmt(Stmt.IncDecStmt n) {
        n.setX(child(n.x(), Expr.class, "IncDecStmt.x"));
        return n;
    }

    private Node assignStmt(Stmt.AssignStmt n) {
        n.setLhs(inspectExprList(n.lhs(), "AssignStmt.lhs"));
        n.setRhs(inspectExprList(n.rhs(), "AssignStmt.rhs"));
        return n;
    }

    private Node goStmt(Stmt.GoStmt n) {
        n.setCall(child(n.call(), Expr.CallExpr.class, "GoStmt.call"));
        return n;
    }

    private Node deferStmt(Stmt.DeferStmt n) {
        n.setCall(child(n.call(), Expr.CallExpr.class, "DeferStmt.call"));
        return n;
    }

    private Node returnStmt(Stmt.ReturnStmt n) {
        n.setResults(inspectExprList(n.results(), "ReturnStmt.results"));
        return n;
    }

    private Node branchStmt(Stmt.BranchStmt n) {
        n.setLabel(optionalChild(n.label(), Expr.Ident.class, "BranchStmt.label"));
        return n;
    }

    private Node blockStmt(Stmt.BlockStmt n) {
        n.setList(inspectStmtList(n.list(), "BlockStmt.list"));
        return n;
    }

    private Node ifStmt(Stmt.IfStmt n) {
        n.setInit(optionalChild(n.init(), Stmt.class, "IfStmt.init"));
        n.setCond(child(n.cond(), Expr.class, "IfStmt.cond"));
        n.setBody(child(n.body(), Stmt.BlockStmt.class, "IfStmt.body"));
        n.setElseStmt(optionalChild(n.elseStmt(), Stmt.class, "IfStmt.else"));
        return n;
    }

    private Node caseClause(Stmt.CaseClause n) {
        n.setList(inspectExprList(n.list(), "CaseClause.list"));
        n.setBody(inspectStmtList(n.body(), "CaseClause.body"));
        return n;
    }

    private Node switchStmt(Stmt.SwitchStmt n) {
        n.setInit(optionalChild(n.init(), Stmt.class, "SwitchStmt.init"));
        n.setTag(optionalChild(n.tag(), Expr.class, "SwitchStmt.tag"));
        n.setBody(child(n.body(), Stmt.BlockStmt.class, "SwitchStmt.body"));
        return n;
    }

    private Node typeSwitchStmt(Stmt.TypeSwitchStmt n) {
        n.setInit(optionalChild(n.init(), Stmt.class, "TypeSwitchStmt.init"));
        n.setAssign(child(n.assign(), Stmt.class, "TypeSwitchStmt.assign"));
        n.setBody(child(n.body(), Stmt.BlockStmt.class, "TypeSwitchStmt.body"));
        return n;
    }

    private Node commClause(Stmt.CommClause n) {
        n.setComm(optionalChild(n.comm(), Stmt.class, "CommClause.comm"));
        n.setBody(inspectStmtList(n.body(), "CommClause.body"));
        return n;
    }

    private Node selectStmt(Stmt.SelectStmt n) {
        n.setBody(child(n.body(), Stmt.BlockStmt.class, "SelectStmt.body"));
        return n;
    }

    private Node forStmt(Stmt.ForStmt n) {
        n.setInit(optionalChild(n.init(), Stmt.class, "ForStmt.init"));
        n.setCond(optionalChild(n.cond(), Expr.class, "ForStmt.cond"));
        n.setPost(optionalChild(n.post(), Stmt.class, "ForStmt.post"));
        n.setBody(child(n.body(), Stmt.BlockStmt.class, "ForStmt.body"));
        return n;
    }

    private Node rangeStmt(Stmt.RangeStmt n) {
        n.setKey(optionalChild(n.key(), Expr.class, "RangeStmt.key"));
        n.setValue(optionalChild(n.value(), Expr.class, "RangeStmt.value"));
        n.setX(child(n.x(), Expr.class, "RangeStmt.x"));
        n.setBody(child(n.body(), Stmt.BlockStmt.class, "RangeStmt.body"));
        return n;
    }

    // === Declarations ===

    private Node importSpec(Spec.ImportSpec n) {
        n.setDoc(optionalChild(n.doc(), Node.CommentGroup.class, "ImportSpec.doc"));
        n.setName(optionalChild(n.name(), Expr.Ident.class, "ImportSpec.name"));
        n.setPath(child(n.path(), Expr.BasicLit.class, "ImportSpec.path"));
        n.setComment(optionalChild(n.comment(), Node.CommentGroup.class, "ImportSpec.comment"));
        return n;
    }

    private Node valueSpec(Spec.ValueSpec n) {
        n.setDoc(optionalChild(n.doc(), Node.CommentGroup.class, "ValueSpec.doc"));
        n.setNames(inspectIdentList(n.names(), "ValueSpec.names"));
        n.setType(optionalChild(n.type(), Expr.class, "ValueSpec.type"));
        n.setValues(inspectExprList(n.values(), "ValueSpec.values"));
        n.setComment(optionalChild(n.comment(), Node.CommentGroup.class, "ValueSpec.comment"));
        return n;
    }

    private Node typeSpec(Spec.TypeSpec n) {
        n.setDoc(optionalChild(n.doc(), Node.CommentGroup.class, "TypeSpec.doc"));
        n.setName(child(n.name(), Expr.Ident.class, "TypeSpec.name"));
        n.setType(child(n.type(), Expr.class, "TypeSpec.type"));
        n.setComment(optionalChild(n.comment(), Node.CommentGroup.class, "TypeSpec.comment"));
        return n;
    }

    private Node genDecl(Decl.GenDecl n) {
        n.setDoc(optionalChild(n.doc(), Node.CommentGroup.class, "GenDecl.doc"));
        replaceEach(n.specs(), Spec.class, "GenDecl.specs");
        return n;
    }

    private Node funcDecl(Decl.FuncDecl n) {
        n.setDoc(optionalChild(n.doc(), Node.CommentGroup.class, "FuncDecl.doc"));
        n.setRecv(optionalChild(n.recv(), Node.FieldList.class, "FuncDecl.recv"));
        n.setName(child(n.name(), Expr.Ident.class, "FuncDecl.name"));
        n.setType(child(n.type(), Expr.FuncType.class, "FuncDecl.type"));
        n.setBody(optionalChild(n.body(), Stmt.BlockStmt.class, "FuncDecl.body"));
        return n;
    }

    // === Files and packages ===

    private Node file(Node.File n) {
        n.setDoc(optionalChild(n.doc(), Node.CommentGroup.class, "File.doc"));
        n.setName(child(n.name(), Expr.Ident.class, "File.name"));
        n.setDecls(inspectDeclList(n.decls(), "File.decls"));
        // File.comments is not walked: every group in it is reached through the node owning it.
        return n;
    }

    private Node pkg(Node.Package n) {
        for (var entry : n.files().entrySet()) {
            entry.setValue(child(entry.getValue(), Node.File.class, "Package.files[" + entry.getKey() + "]"));
        }
        return n;
    }

    // === Child lists ===

    private List<Expr.Ident> inspectIdentList(List<Expr.Ident> list, String slot) {
        return inspectList(list, Expr.Ident.class, slot);
    }

    private List<Expr> inspectExprList(List<Expr> list, String slot) {
        return inspectList(list, Expr.class, slot);
    }

    private List<Stmt> inspectStmtList(List<Stmt> list, String slot) {
        return inspectList(list, Stmt.class, slot);
    }

    private List<Decl> inspectDeclList(List<Decl> list, String slot) {
        return inspectList(list, Decl.class, slot);
    }

    /**
     * New list of the same length where element k is the inspected element k of {@code list}.
     */
    private <T extends Node> List<T> inspectList(List<T> list, Class<T> slotType, String slot) {
        var inspected = new ArrayList<T>(list.size());

        for (int i = 0; i < list.size(); i++) {
            var element = checkNotNull(list.get(i), "Child slot %s[%s] holds null", slot, i);
            inspected.add(conform(inspectNode(element), slotType, slot, i));
        }
        return inspected;
    }

    /**
     * Inspect the elements of {@code list}, writing each result back into its position.
     */
    private <T extends Node> void replaceEach(List<T> list, Class<T> slotType, String slot) {
        for (int i = 0; i < list.size(); i++) {
            var element = checkNotNull(list.get(i), "Child slot %s[%s] holds null", slot, i);
            list.set(i, conform(inspectNode(element), slotType, slot, i));
        }
    }

    // === Slots ===

    private <T extends Node> T child(@Nullable T child, Class<T> slotType, String slot) {
        checkNotNull(child, "Child slot %s holds null", slot);
        return conform(inspectNode(child), slotType, slot, -1);
    }

    private <T extends Node> @Nullable T optionalChild(@Nullable T child, Class<T> slotType, String slot) {
        return child == null ? null : child(child, slotType, slot);
    }

    private static <T extends Node> T conform(Node node, Class<T> slotType, String slot, int index) {
        if (!slotType.isInstance(node)) {
            var slotName = index < 0 ? slot : slot + "[" + index + "]";
            throw new InspectionException(new InspectError.SlotMismatch(slotName, slotType, node.kind()));
        }
        return slotType.cast(node);
    }
}
