package org.gopy.source;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.gopy.source.ast.AssignStmt;
import org.gopy.source.ast.BasicLit;
import org.gopy.source.ast.BinaryExpr;
import org.gopy.source.ast.BlockStmt;
import org.gopy.source.ast.BranchStmt;
import org.gopy.source.ast.CallExpr;
import org.gopy.source.ast.CaseClause;
import org.gopy.source.ast.CommentGroup;
import org.gopy.source.ast.CompositeLit;
import org.gopy.source.ast.DeclStmt;
import org.gopy.source.ast.DeferStmt;
import org.gopy.source.ast.Expr;
import org.gopy.source.ast.ExprStmt;
import org.gopy.source.ast.Field;
import org.gopy.source.ast.FieldList;
import org.gopy.source.ast.ForStmt;
import org.gopy.source.ast.FuncDecl;
import org.gopy.source.ast.FuncLit;
import org.gopy.source.ast.FuncTypeExpr;
import org.gopy.source.ast.GenDecl;
import org.gopy.source.ast.Ident;
import org.gopy.source.ast.IfStmt;
import org.gopy.source.ast.IncDecStmt;
import org.gopy.source.ast.IndexExpr;
import org.gopy.source.ast.KeyValueExpr;
import org.gopy.source.ast.LitKind;
import org.gopy.source.ast.Position;
import org.gopy.source.ast.RangeStmt;
import org.gopy.source.ast.ReturnStmt;
import org.gopy.source.ast.SelectorExpr;
import org.gopy.source.ast.Spec;
import org.gopy.source.ast.Stmt;
import org.gopy.source.ast.SwitchStmt;
import org.gopy.source.ast.Token;
import org.gopy.source.ast.TypeAssertExpr;
import org.gopy.source.ast.TypeSpec;
import org.gopy.source.ast.TypeSwitchStmt;
import org.gopy.source.ast.UnaryExpr;
import org.gopy.source.ast.ValueSpec;
import org.gopy.source.types.ArrayType;
import org.gopy.source.types.BasicType;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.GoType;
import org.gopy.source.types.MapType;
import org.gopy.source.types.NamedType;
import org.gopy.source.types.SignatureType;
import org.gopy.source.types.SliceType;
import org.gopy.source.types.TupleType;
import org.gopy.source.types.TypeInfo;
import org.gopy.source.types.Universe;

/**
 * Builds resolved syntax trees by hand, recording each node's type and object facts in a
 * {@link TypeInfo} as it goes. Every node gets its own line in file {@code file}.
 */
public class ResolvedTreeBuilder {

    private final TypeInfo info;
    private final String file;
    private int line;

    public ResolvedTreeBuilder(TypeInfo info) {
        this(info, "main.go");
    }

    public ResolvedTreeBuilder(TypeInfo info, String file) {
        this.info = info;
        this.file = file;
    }

    public TypeInfo info() {
        return info;
    }

    public Position pos() {
        return Position.of(file, ++line, 1);
    }

    // ── identifiers ──

    /**
     * An identifier that declares {@code obj}.
     */
    public Ident def(GoObject obj) {
        Ident ident = new Ident(pos(), obj.name());
        info.recordDef(ident, obj);
        return ident;
    }

    /**
     * An identifier that refers to {@code obj}.
     */
    public Ident use(GoObject obj) {
        Ident ident = new Ident(pos(), obj.name());
        info.recordUse(ident, obj);
        return ident;
    }

    /**
     * A reference to a predeclared name such as {@code int}, {@code len} or {@code nil}.
     */
    public Ident predeclared(String name) {
        GoObject obj = Universe.lookup(name);
        if (obj == null) {
            throw new IllegalArgumentException("not predeclared: " + name);
        }
        return use(obj);
    }

    public Ident blank() {
        return new Ident(pos(), "_");
    }

    public Ident typeName(NamedType type) {
        return use(type.obj());
    }

    // ── literals ──

    public BasicLit intLit(long value) {
        return literal(LitKind.INT, Long.toString(value), BasicType.UNTYPED_INT);
    }

    public BasicLit literal(LitKind kind, String text, GoType type) {
        BasicLit lit = new BasicLit(pos(), kind, text);
        info.recordType(lit, type);
        return lit;
    }

    /**
     * An interpreted string literal; quotes are added.
     */
    public BasicLit stringLit(String text) {
        return literal(LitKind.STRING, "\"" + text + "\"", BasicType.UNTYPED_STRING);
    }

    // ── expressions ──

    public <E extends Expr> E typed(E expr, GoType type) {
        info.recordType(expr, type);
        return expr;
    }

    public BinaryExpr binary(Expr x, Token op, Expr y) {
        GoType type = switch (op) {
            case EQL, NEQ, LSS, LEQ, GTR, GEQ, LAND, LOR -> BasicType.UNTYPED_BOOL;
            default -> info.typeOf(x);
        };
        return typed(new BinaryExpr(pos(), x, op, y), type);
    }

    public UnaryExpr unary(Token op, Expr x) {
        return typed(new UnaryExpr(pos(), op, x), op == Token.NOT ? BasicType.BOOL : info.typeOf(x));
    }

    /**
     * A call whose type comes from the callee's signature: nothing, the single result, or a
     * tuple of results.
     */
    public CallExpr call(Expr fun, Expr... args) {
        CallExpr call = new CallExpr(pos(), fun, List.of(args), false);
        if (info.typeOf(fun) instanceof SignatureType sig && !sig.results().isEmpty()) {
            info.recordType(call, resultType(sig));
        }
        return call;
    }

    public CallExpr spreadCall(Expr fun, Expr... args) {
        return new CallExpr(pos(), fun, List.of(args), true);
    }

    public CallExpr builtinCall(String builtin, GoType resultType, Expr... args) {
        CallExpr call = new CallExpr(pos(), predeclared(builtin), List.of(args), false);
        if (resultType != null) {
            info.recordType(call, resultType);
        }
        return call;
    }

    public SelectorExpr select(Expr x, GoObject member) {
        return typed(new SelectorExpr(pos(), x, use(member)), member.type());
    }

    /**
     * {@code x[index]}, typed from the indexed collection.
     */
    public IndexExpr index(Expr x, Expr index) {
        GoType collection = info.typeOf(x);
        GoType underlying = collection == null ? null : collection.underlying();
        GoType elem = null;
        if (underlying instanceof SliceType slice) {
            elem = slice.elem();
        } else if (underlying instanceof ArrayType array) {
            elem = array.elem();
        } else if (underlying instanceof MapType map) {
            elem = map.value();
        } else if (underlying instanceof BasicType basic && basic.isString()) {
            elem = BasicType.UINT8;
        }
        return typed(new IndexExpr(pos(), x, index), elem);
    }

    /**
     * {@code m[k]} in comma-ok position.
     */
    public IndexExpr commaOkIndex(Expr map, Expr key) {
        MapType type = (MapType) info.typeOf(map).underlying();
        return typed(new IndexExpr(pos(), map, key), new TupleType(List.of(type.value(), BasicType.BOOL)));
    }

    public TypeAssertExpr typeAssert(Expr x, Expr type, boolean commaOk) {
        GoType asserted = info.typeOf(type);
        return typed(new TypeAssertExpr(pos(), x, type),
                commaOk ? new TupleType(List.of(asserted, BasicType.BOOL)) : asserted);
    }

    public CompositeLit composite(GoType type, Expr typeExpr, Expr... elements) {
        return typed(new CompositeLit(pos(), typeExpr, List.of(elements)), type);
    }

    public KeyValueExpr keyValue(Expr key, Expr value) {
        return new KeyValueExpr(pos(), key, value);
    }

    public FuncLit funcLit(FuncTypeExpr type, SignatureType signature, Stmt... body) {
        return typed(new FuncLit(pos(), type, block(body)), signature);
    }

    // ── statements ──

    public ExprStmt exprStmt(Expr x) {
        return new ExprStmt(pos(), x);
    }

    public AssignStmt assign(Expr lhs, Expr rhs) {
        return new AssignStmt(pos(), List.of(lhs), Token.ASSIGN, List.of(rhs));
    }

    public AssignStmt define(Expr lhs, Expr rhs) {
        return new AssignStmt(pos(), List.of(lhs), Token.DEFINE, List.of(rhs));
    }

    public AssignStmt assign(List<Expr> lhs, Token tok, List<Expr> rhs) {
        return new AssignStmt(pos(), lhs, tok, rhs);
    }

    public IncDecStmt inc(Expr x) {
        return new IncDecStmt(pos(), x, Token.INC);
    }

    public BlockStmt block(Stmt... stmts) {
        return new BlockStmt(pos(), List.of(stmts));
    }

    public IfStmt ifStmt(Expr cond, BlockStmt body, Stmt elseStmt) {
        return new IfStmt(pos(), null, cond, body, elseStmt);
    }

    public ForStmt forStmt(Stmt init, Expr cond, Stmt post, Stmt... body) {
        return new ForStmt(pos(), init, cond, post, block(body));
    }

    public RangeStmt range(Expr key, Expr value, Expr x, Stmt... body) {
        return new RangeStmt(pos(), key, value, key == null ? null : Token.DEFINE, x, block(body));
    }

    public SwitchStmt switchStmt(Expr tag, CaseClause... clauses) {
        return new SwitchStmt(pos(), null, tag, List.of(clauses));
    }

    public CaseClause caseClause(List<Expr> values, Stmt... body) {
        return new CaseClause(pos(), values, List.of(body));
    }

    public CaseClause defaultClause(Stmt... body) {
        return new CaseClause(pos(), List.of(), List.of(body));
    }

    /**
     * {@code switch binding := x.(type)}; pass a null binding for the unbound form.
     */
    public TypeSwitchStmt typeSwitch(Ident binding, Expr x, CaseClause... clauses) {
        TypeAssertExpr guard = new TypeAssertExpr(pos(), x, null);
        Stmt assign = binding == null
                ? new ExprStmt(pos(), guard)
                : new AssignStmt(pos(), List.of(binding), Token.DEFINE, List.of(guard));
        return new TypeSwitchStmt(pos(), null, assign, List.of(clauses));
    }

    public ReturnStmt ret(Expr... results) {
        return new ReturnStmt(pos(), List.of(results));
    }

    public BranchStmt branch(Token tok) {
        return new BranchStmt(pos(), tok, null);
    }

    public DeferStmt defer(CallExpr call) {
        return new DeferStmt(pos(), call);
    }

    public DeclStmt declStmt(GenDecl decl) {
        return new DeclStmt(pos(), decl);
    }

    // ── declarations ──

    public ValueSpec valueSpec(List<Ident> names, Expr type, Expr... values) {
        return new ValueSpec(pos(), null, names, type, List.of(values));
    }

    public GenDecl varDecl(Spec... specs) {
        return new GenDecl(pos(), null, Token.VAR, List.of(specs));
    }

    public GenDecl typeDecl(CommentGroup doc, Ident name, Expr type) {
        return new GenDecl(pos(), doc, Token.TYPE, List.of(new TypeSpec(pos(), null, name, false, type)));
    }

    public Field field(Expr type, Ident... names) {
        return new Field(pos(), Arrays.asList(names), type);
    }

    public FuncTypeExpr funcType(FieldList params, FieldList results) {
        return new FuncTypeExpr(pos(), params, results);
    }

    public FuncDecl funcDecl(CommentGroup doc, Field receiver, Ident name, FuncTypeExpr type, Stmt... body) {
        FieldList recv = receiver == null ? null : FieldList.of(receiver);
        return new FuncDecl(pos(), doc, recv, name, type, block(body));
    }

    // ── objects ──

    /**
     * A signature for the given parameter and result types; results are unnamed.
     */
    public static SignatureType signature(List<GoType> params, List<GoType> results) {
        List<GoObject> paramObjects = new ArrayList<>();
        for (GoType param : params) {
            paramObjects.add(GoObject.localVar("", param));
        }
        List<GoObject> resultObjects = new ArrayList<>();
        for (GoType result : results) {
            resultObjects.add(GoObject.localVar("", result));
        }
        return new SignatureType(paramObjects, resultObjects, false);
    }

    private static GoType resultType(SignatureType sig) {
        if (sig.results().size() == 1) {
            return sig.results().get(0).type();
        }
        List<GoType> types = new ArrayList<>();
        for (GoObject result : sig.results()) {
            types.add(result.type());
        }
        return new TupleType(types);
    }
}
