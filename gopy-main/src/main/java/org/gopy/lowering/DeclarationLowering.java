package org.gopy.lowering;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.gopy.LoweringException;
import org.gopy.UnresolvedSymbolException;
import org.gopy.UnsupportedConstructException;
import org.gopy.source.ast.BlockStmt;
import org.gopy.source.ast.CommentGroup;
import org.gopy.source.ast.Decl;
import org.gopy.source.ast.Ellipsis;
import org.gopy.source.ast.Expr;
import org.gopy.source.ast.Field;
import org.gopy.source.ast.FuncDecl;
import org.gopy.source.ast.FuncTypeExpr;
import org.gopy.source.ast.GenDecl;
import org.gopy.source.ast.Ident;
import org.gopy.source.ast.ImportSpec;
import org.gopy.source.ast.Spec;
import org.gopy.source.ast.StarExpr;
import org.gopy.source.ast.TypeSpec;
import org.gopy.source.ast.ValueSpec;
import org.gopy.source.types.ArrayType;
import org.gopy.source.types.BasicType;
import org.gopy.source.types.ChanType;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.GoType;
import org.gopy.source.types.InterfaceType;
import org.gopy.source.types.MapType;
import org.gopy.source.types.NamedType;
import org.gopy.source.types.ObjectKind;
import org.gopy.source.types.SignatureType;
import org.gopy.source.types.SliceType;
import org.gopy.source.types.StructType;
import org.gopy.source.types.TypeOracle;
import org.gopy.target.CmpOperator;
import org.gopy.target.Py;
import org.gopy.target.PyArg;
import org.gopy.target.PyArguments;
import org.gopy.target.PyAssign;
import org.gopy.target.PyClassDef;
import org.gopy.target.PyConstant;
import org.gopy.target.PyDocString;
import org.gopy.target.PyExpr;
import org.gopy.target.PyFunctionDef;
import org.gopy.target.PyGlobal;
import org.gopy.target.PyIfExp;
import org.gopy.target.PyName;
import org.gopy.target.PyNonlocal;
import org.gopy.target.PyStmt;
import org.gopy.util.AstUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers declarations: functions and methods, variable and constant specs, and type specs.
 * Struct types become classes with an {@code __init__} taking every field.
 */
public class DeclarationLowering {

    private static final Logger log = LoggerFactory.getLogger(DeclarationLowering.class);

    private final LoweringEngine engine;

    public DeclarationLowering(LoweringEngine engine) {
        this.engine = engine;
    }

    public List<LoweredDecl> lower(Decl decl, LoweringContext ctx) {
        if (decl instanceof FuncDecl funcDecl) {
            return List.of(lowerFuncDecl(funcDecl, ctx));
        }
        if (decl instanceof GenDecl genDecl) {
            return lowerGenDecl(genDecl, ctx);
        }
        throw new LoweringException("unknown declaration: " + decl.describe(), decl.describe(), decl.position());
    }

    private List<LoweredDecl> lowerGenDecl(GenDecl decl, LoweringContext ctx) {
        List<LoweredDecl> result = new ArrayList<>();
        for (Spec spec : decl.specs()) {
            if (spec instanceof ImportSpec importSpec) {
                log.debug("{}: import {} skipped", spec.position(), importSpec.path().value());
            } else if (spec instanceof ValueSpec valueSpec) {
                for (PyStmt stmt : lowerValueSpec(valueSpec, ctx)) {
                    result.add(LoweredDecl.of(LoweredDecl.Kind.VALUE, stmt));
                }
            } else if (spec instanceof TypeSpec typeSpec) {
                CommentGroup doc = decl.specs().size() == 1 ? decl.doc() : null;
                lowerTypeSpec(typeSpec, doc, ctx).ifPresent(stmt -> result.add(LoweredDecl.of(
                        stmt instanceof PyClassDef ? LoweredDecl.Kind.CLASS : LoweredDecl.Kind.TYPE_BINDING, stmt)));
            } else {
                throw new LoweringException("unknown spec: " + spec.describe(), spec.describe(), spec.position());
            }
        }
        return result;
    }

    // ── values ──

    /**
     * {@code var a, b int} → {@code a, b = 0, 0}. With one initializer per name the values pair
     * up; a single initializer for several names is a multi-value call.
     */
    public List<PyStmt> lowerValueSpec(ValueSpec spec, LoweringContext ctx) {
        HoistedStatements hoisted = new HoistedStatements();
        List<PyExpr> targets = hoisted.addAll(engine.expressions().lowerTargets(spec.names(), ctx));

        PyExpr value;
        if (spec.values().isEmpty()) {
            List<PyExpr> values = new ArrayList<>();
            for (Ident name : spec.names()) {
                values.add(hoisted.add(implicitValue(name, spec, ctx)));
            }
            value = Py.tupleOrSingle(values);
        } else if (spec.values().size() == spec.names().size() || spec.values().size() == 1) {
            value = hoisted.add(engine.expressions().lowerTuple(spec.values(), ctx));
        } else {
            throw new LoweringException("declaration count mismatch: " + spec.names().size() + " names, "
                    + spec.values().size() + " values", spec.describe(), spec.position());
        }
        return hoisted.emit(new PyAssign(List.of(Py.tupleOrSingle(targets)), value));
    }

    // a constant repeating an earlier initializer carries its folded value; anything else is zeroed
    private LoweredExpr implicitValue(Ident name, ValueSpec spec, LoweringContext ctx) {
        GoObject obj = ctx.oracle().objectOf(name);
        if (obj != null && obj.kind() == ObjectKind.CONST && obj.constValue() != null) {
            return engine.expressions().lower(obj.constValue(), ctx);
        }
        GoType type = ctx.oracle().typeOf(name);
        if (type == null && spec.type() != null) {
            type = ctx.oracle().typeOf(spec.type());
        }
        if (type == null) {
            throw new LoweringException("no type for '" + name.name() + "'", spec.describe(), name.position());
        }
        return LoweredExpr.of(ZeroValues.of(type));
    }

    // ── types ──

    /**
     * A class, a name binding, or nothing for types that have no runtime representation.
     *
     * @param declDoc doc comment of the enclosing declaration, used when the spec has none
     */
    public Optional<PyStmt> lowerTypeSpec(TypeSpec spec, CommentGroup declDoc, LoweringContext ctx) {
        GoObject obj = ctx.oracle().objectOf(spec.name());
        if (obj == null) {
            throw new UnresolvedSymbolException(spec.name().name(), spec.name().position());
        }
        GoType declared = declaredType(spec, obj, ctx.oracle());
        CommentGroup doc = spec.doc() != null ? spec.doc() : declDoc;

        if (declared instanceof StructType struct) {
            return Optional.of(classDef(obj, struct, doc, ctx));
        }
        if (declared instanceof NamedType target) {
            if (hasNoClass(target)) {
                return dropped(spec, target, ctx);
            }
            return Optional.of(Py.assign(Py.name(ctx.scope().name(obj)), Py.name(ctx.scope().name(target.obj()))));
        }
        if (declared instanceof BasicType || declared instanceof SliceType || declared instanceof ArrayType) {
            StructType wrapper = new StructType(List.of(GoObject.field("value", declared)));
            return Optional.of(classDef(obj, wrapper, doc, ctx));
        }
        if (declared instanceof InterfaceType || declared instanceof SignatureType
                || declared instanceof MapType || declared instanceof ChanType) {
            return dropped(spec, declared, ctx);
        }
        throw new LoweringException("unknown type declaration: " + declared, spec.describe(), spec.position());
    }

    private static GoType declaredType(TypeSpec spec, GoObject obj, TypeOracle oracle) {
        GoType declared = oracle.typeOf(spec.type());
        if (declared != null) {
            return declared;
        }
        if (obj.type() instanceof NamedType named && named.obj() == obj) {
            return named.underlying();
        }
        if (obj.type() == null) {
            throw new LoweringException("type '" + spec.name().name() + "' is not resolved", spec.describe(), spec.position());
        }
        return obj.type();
    }

    private static boolean hasNoClass(NamedType named) {
        GoType underlying = named.underlying();
        return underlying instanceof InterfaceType || underlying instanceof SignatureType
                || underlying instanceof MapType || underlying instanceof ChanType;
    }

    private static Optional<PyStmt> dropped(TypeSpec spec, GoType type, LoweringContext ctx) {
        if (ctx.options().strictUnsupported()) {
            throw new UnsupportedConstructException("type declaration of " + type, spec.position());
        }
        log.debug("{}: type {} ({}) has no Python class, skipped", spec.position(), spec.name().name(), type);
        return Optional.empty();
    }

    private PyClassDef classDef(GoObject obj, StructType struct, CommentGroup doc, LoweringContext ctx) {
        List<PyStmt> body = new ArrayList<>();
        if (ctx instanceof FileContext && ctx.options().emitDocStrings()) {
            docString(doc).ifPresent(body::add);
        }
        if (struct.numFields() > 0) {
            body.add(initMethod(struct, ctx));
        }
        return new PyClassDef(ctx.scope().name(obj), List.of(), Py.orPass(body));
    }

    /**
     * <pre>
     * def __init__(self, x=0, p=None):
     *     self.x = x
     *     self.p = p if p is not None else Point()
     * </pre>
     * Zero values that build objects are created per call rather than shared as defaults.
     */
    private PyFunctionDef initMethod(StructType struct, LoweringContext ctx) {
        NamingScope scope = ctx.scope().nested();
        List<String> attrs = new ArrayList<>();
        for (GoObject field : struct.fields()) {
            String attr = NamingScope.attributeName(field.name());
            attrs.add(attr);
            scope.claim(attr);
        }
        PyName self = Py.name(scope.fresh(ctx.options().receiverName()));

        List<PyArg> args = new ArrayList<>();
        List<PyExpr> defaults = new ArrayList<>();
        List<PyStmt> body = new ArrayList<>();
        args.add(new PyArg(self.id()));
        for (int i = 0; i < struct.numFields(); i++) {
            String attr = attrs.get(i);
            PyName param = Py.name(attr);
            PyExpr zero = ZeroValues.of(struct.field(i).type());
            args.add(new PyArg(attr));
            PyExpr value = param;
            if (ZeroValues.isFresh(zero)) {
                defaults.add(PyConstant.NONE);
                value = new PyIfExp(Py.compare(param, CmpOperator.IS_NOT, PyConstant.NONE), param, zero);
            } else {
                defaults.add(zero);
            }
            body.add(Py.assign(Py.attr(self, attr), value));
        }
        return new PyFunctionDef("__init__", new PyArguments(args, null, defaults), body);
    }

    // ── functions ──

    public LoweredDecl lowerFuncDecl(FuncDecl decl, LoweringContext ctx) {
        GoObject obj = ctx.oracle().objectOf(decl.name());
        if (obj == null) {
            throw new UnresolvedSymbolException(decl.name().name(), decl.name().position());
        }
        if (decl.recv() == null) {
            log.debug("lowering function {}", decl.name().name());
            PyFunctionDef def = function(ctx.scope().name(obj), false, null, decl.type(), decl.body(), decl.doc(), ctx);
            return LoweredDecl.of(LoweredDecl.Kind.FUNCTION, def);
        }

        List<Field> receivers = decl.recv().list();
        if (receivers.size() != 1 || receivers.get(0).names().size() > 1) {
            throw new LoweringException("multiple receivers", decl.describe(), decl.position());
        }
        Field receiver = receivers.get(0);
        Ident receiverName = receiver.names().isEmpty() ? null : receiver.names().get(0);
        String owner = receiverTypeName(receiver.type(), ctx);
        log.debug("lowering method {}.{}", owner, decl.name().name());
        PyFunctionDef def = function(ctx.scope().name(obj), true, receiverName, decl.type(), decl.body(), decl.doc(), ctx);
        return new LoweredDecl(LoweredDecl.Kind.METHOD, def, owner);
    }

    /**
     * Lowers a function literal or any other receiver-less function body.
     */
    public PyFunctionDef lowerFunction(String name, FuncTypeExpr type, BlockStmt body, LoweringContext ctx) {
        return function(name, false, null, type, body, null, ctx);
    }

    private PyFunctionDef function(String name, boolean method, Ident receiver, FuncTypeExpr type,
                                   BlockStmt body, CommentGroup doc, LoweringContext parent) {
        FunctionContext fn = parent.enterFunction();
        NamingScope scope = fn.scope();

        List<PyArg> args = new ArrayList<>();
        if (method) {
            boolean named = receiver != null && !AstUtils.isBlank(receiver);
            args.add(new PyArg(named ? localName(receiver, "self", fn) : scope.fresh(fn.options().receiverName())));
        }
        String vararg = null;
        List<Field> params = type.params().list();
        for (int i = 0; i < params.size(); i++) {
            Field param = params.get(i);
            List<String> names = new ArrayList<>();
            if (param.names().isEmpty()) {
                names.add(scope.temp("arg"));
            } else {
                for (Ident ident : param.names()) {
                    names.add(localName(ident, "arg", fn));
                }
            }
            if (i == params.size() - 1 && param.type() instanceof Ellipsis) {
                if (names.size() != 1) {
                    throw new LoweringException("variadic parameter group with several names", "Field", param.position());
                }
                vararg = names.get(0);
            } else {
                names.forEach(n -> args.add(new PyArg(n)));
            }
        }

        List<PyStmt> resultInit = new ArrayList<>();
        if (type.results() != null) {
            for (Field result : type.results().list()) {
                for (Ident ident : result.names()) {
                    PyName resultName = Py.name(localName(ident, "result", fn));
                    fn.addNamedResult(resultName);
                    GoType resultType = fn.oracle().typeOf(ident);
                    if (resultType == null) {
                        resultType = fn.oracle().typeOf(result.type());
                    }
                    if (resultType == null) {
                        throw new LoweringException("no type for result '" + ident.name() + "'", "Field", result.position());
                    }
                    resultInit.add(Py.assign(resultName, ZeroValues.of(resultType)));
                }
            }
        }

        if (DeferEmulation.containsDefer(body)) {
            fn.setCaptureList(Py.name(scope.temp("defers")));
        }
        List<PyStmt> lowered = body == null ? List.of() : engine.statements().lower(body, fn);

        List<PyStmt> stmts = new ArrayList<>();
        if (fn.options().emitDocStrings()) {
            docString(doc).ifPresent(stmts::add);
        }
        if (!fn.globals().isEmpty()) {
            stmts.add(new PyGlobal(fn.globals()));
        }
        if (!fn.nonlocals().isEmpty()) {
            stmts.add(new PyNonlocal(fn.nonlocals()));
        }
        stmts.addAll(resultInit);
        if (fn.captureList() != null) {
            stmts.add(DeferEmulation.initCaptureList(fn.captureList()));
            stmts.add(DeferEmulation.wrap(fn.captureList(), lowered, scope));
        } else {
            stmts.addAll(lowered);
        }
        return new PyFunctionDef(name, new PyArguments(args, vararg, List.of()), Py.orPass(stmts));
    }

    private static String localName(Ident ident, String blankBase, FunctionContext fn) {
        if (AstUtils.isBlank(ident)) {
            return fn.scope().temp(blankBase);
        }
        GoObject obj = fn.oracle().objectOf(ident);
        if (obj == null) {
            throw new UnresolvedSymbolException(ident.name(), ident.position());
        }
        return fn.scope().name(obj);
    }

    private static String receiverTypeName(Expr type, LoweringContext ctx) {
        Expr base = AstUtils.unparen(type);
        if (base instanceof StarExpr star) {
            base = AstUtils.unparen(star.x());
        }
        if (base instanceof Ident ident) {
            GoObject obj = ctx.oracle().objectOf(ident);
            if (obj != null && obj.kind() == ObjectKind.TYPE_NAME) {
                return ctx.scope().name(obj);
            }
        }
        throw new LoweringException("unknown receiver type: " + type.describe(), type.describe(), type.position());
    }

    private static Optional<PyStmt> docString(CommentGroup doc) {
        if (doc == null) {
            return Optional.empty();
        }
        List<String> lines = doc.lines();
        return lines.isEmpty() ? Optional.empty() : Optional.of(new PyDocString(lines));
    }
}
