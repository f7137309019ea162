package org.gopy.lowering.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.gopy.LoweringException;
import org.gopy.UnresolvedSymbolException;
import org.gopy.lowering.ExpressionLowering;
import org.gopy.lowering.LoweredExpr;
import org.gopy.lowering.LoweringContext;
import org.gopy.lowering.LoweringEngine;
import org.gopy.lowering.NamingScope;
import org.gopy.lowering.TypeTests;
import org.gopy.lowering.ZeroValues;
import org.gopy.source.ast.ArrayTypeExpr;
import org.gopy.source.ast.BasicLit;
import org.gopy.source.ast.BinaryExpr;
import org.gopy.source.ast.CallExpr;
import org.gopy.source.ast.CaseClause;
import org.gopy.source.ast.ChanTypeExpr;
import org.gopy.source.ast.CompositeLit;
import org.gopy.source.ast.Expr;
import org.gopy.source.ast.FuncLit;
import org.gopy.source.ast.FuncTypeExpr;
import org.gopy.source.ast.Ident;
import org.gopy.source.ast.IndexExpr;
import org.gopy.source.ast.InterfaceTypeExpr;
import org.gopy.source.ast.KeyValueExpr;
import org.gopy.source.ast.MapTypeExpr;
import org.gopy.source.ast.Node;
import org.gopy.source.ast.ParenExpr;
import org.gopy.source.ast.SelectorExpr;
import org.gopy.source.ast.SliceExpr;
import org.gopy.source.ast.StarExpr;
import org.gopy.source.ast.StructTypeExpr;
import org.gopy.source.ast.Token;
import org.gopy.source.ast.TypeAssertExpr;
import org.gopy.source.ast.UnaryExpr;
import org.gopy.source.ast.visitor.GoGenericVisitorWithDefaults;
import org.gopy.source.types.ArrayType;
import org.gopy.source.types.BasicKind;
import org.gopy.source.types.BasicType;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.GoType;
import org.gopy.source.types.InterfaceType;
import org.gopy.source.types.MapType;
import org.gopy.source.types.NamedType;
import org.gopy.source.types.ObjectKind;
import org.gopy.source.types.PointerType;
import org.gopy.source.types.SliceType;
import org.gopy.source.types.StructType;
import org.gopy.source.types.TupleType;
import org.gopy.source.types.TypeOracle;
import org.gopy.source.types.Universe;
import org.gopy.target.BinaryOperator;
import org.gopy.target.BoolOperator;
import org.gopy.target.CmpOperator;
import org.gopy.target.Py;
import org.gopy.target.PyBinOp;
import org.gopy.target.PyBoolOp;
import org.gopy.target.PyCall;
import org.gopy.target.PyComprehension;
import org.gopy.target.PyConstant;
import org.gopy.target.PyDict;
import org.gopy.target.PyExpr;
import org.gopy.target.PyFunctionDef;
import org.gopy.target.PyIfExp;
import org.gopy.target.PyKeyword;
import org.gopy.target.PyList;
import org.gopy.target.PyListComp;
import org.gopy.target.PyName;
import org.gopy.target.PySlice;
import org.gopy.target.PyStarred;
import org.gopy.target.PyStmt;
import org.gopy.target.PySubscript;
import org.gopy.target.PyUnaryOp;
import org.gopy.target.UnaryOperator;
import org.gopy.util.AstUtils;

/**
 * Reference {@link ExpressionLowering}. Covers the expression forms of ordinary sequential Go
 * code; channel operations and most reflection-like builtins abort.
 */
public class BasicExpressionLowering implements ExpressionLowering {

    private static final PyName STR = Py.name("str");
    private static final PyName INT = Py.name("int");
    private static final PyName FLOAT = Py.name("float");
    private static final PyName COMPLEX = Py.name("complex");
    private static final PyName BOOL = Py.name("bool");
    private static final PyName LIST = Py.name("list");
    private static final PyName DICT = Py.name("dict");
    private static final PyName CHR = Py.name("chr");
    private static final PyName BYTES = Py.name("bytes");

    private final LoweringEngine engine;

    public BasicExpressionLowering(LoweringEngine engine) {
        this.engine = engine;
    }

    @Override
    public LoweredExpr lower(Expr expr, LoweringContext ctx) {
        Lowerer lowerer = new Lowerer(ctx);
        PyExpr result = lowerer.lower(expr);
        return new LoweredExpr(result, lowerer.hoisted);
    }

    @Override
    public LoweredExpr lowerTarget(Expr expr, LoweringContext ctx) {
        Lowerer lowerer = new Lowerer(ctx);
        PyExpr result = lowerer.target(expr);
        return new LoweredExpr(result, lowerer.hoisted);
    }

    @Override
    public Optional<LoweredExpr> caseClauseTest(CaseClause clause, PyExpr tag, LoweringContext ctx) {
        if (clause.list().isEmpty()) {
            return Optional.empty();
        }
        Lowerer lowerer = new Lowerer(ctx);
        List<PyExpr> tests = new ArrayList<>();
        for (Expr value : clause.list()) {
            PyExpr lowered = lowerer.lower(value);
            if (tag == null) {
                tests.add(lowered);
            } else {
                tests.add(Py.compare(tag, isNil(value, ctx.oracle()) ? CmpOperator.IS : CmpOperator.EQ, lowered));
            }
        }
        PyExpr test = tests.size() == 1 ? tests.get(0) : new PyBoolOp(BoolOperator.OR, tests);
        return Optional.of(new LoweredExpr(test, lowerer.hoisted));
    }

    @Override
    public PyExpr typeExpr(GoType type, LoweringContext ctx) {
        if (type instanceof BasicType basic) {
            if (basic.kind() == BasicKind.UNTYPED_NIL) {
                return Py.call(Py.TYPE, PyConstant.NONE);
            }
            if (basic.isBoolean()) {
                return BOOL;
            }
            if (basic.isInteger()) {
                return INT;
            }
            if (basic.isFloat()) {
                return FLOAT;
            }
            if (basic.isComplex()) {
                return COMPLEX;
            }
            if (basic.isString()) {
                return STR;
            }
        }
        if (type instanceof NamedType named && !Universe.isPredeclared(named.obj())) {
            return Py.name(ctx.scope().name(named.obj()));
        }
        if (type instanceof PointerType pointer) {
            return typeExpr(pointer.elem(), ctx);
        }
        if (type instanceof SliceType || type instanceof ArrayType) {
            return LIST;
        }
        if (type instanceof MapType) {
            return DICT;
        }
        throw new LoweringException("no runtime class for type " + type, String.valueOf(type), null);
    }

    private static boolean isNil(Expr expr, TypeOracle oracle) {
        return AstUtils.unparen(expr) instanceof Ident ident && oracle.objectOf(ident) == Universe.NIL;
    }

    /**
     * One lowering pass over an expression tree; collects the statements it hoists.
     */
    private final class Lowerer extends GoGenericVisitorWithDefaults<PyExpr, Void> {

        private final LoweringContext ctx;
        private final TypeOracle oracle;
        private final NamingScope scope;
        private final List<PyStmt> hoisted = new ArrayList<>();

        Lowerer(LoweringContext ctx) {
            this.ctx = ctx;
            this.oracle = ctx.oracle();
            this.scope = ctx.scope();
        }

        PyExpr lower(Expr expr) {
            return expr.accept(this, null);
        }

        PyExpr lowerOrNull(Expr expr) {
            return expr == null ? null : lower(expr);
        }

        List<PyExpr> lowerEach(List<Expr> exprs) {
            List<PyExpr> result = new ArrayList<>(exprs.size());
            for (Expr expr : exprs) {
                result.add(lower(expr));
            }
            return result;
        }

        /**
         * Assignment targets: indexing stays a subscript even on maps.
         */
        PyExpr target(Expr expr) {
            Expr base = AstUtils.unparen(expr);
            if (base instanceof IndexExpr index) {
                PyExpr x = lower(index.x());
                return new PySubscript(x, lower(index.index()));
            }
            if (base instanceof StarExpr star) {
                return target(star.x());
            }
            return lower(base);
        }

        @Override
        public PyExpr defaultAction(Node n, Void arg) {
            throw new LoweringException("unknown expression: " + n.describe(), n.describe(), n.position());
        }

        // ── names and literals ──

        @Override
        public PyExpr visit(Ident n, Void arg) {
            GoObject obj = oracle.objectOf(n);
            if (obj == null) {
                if (AstUtils.isBlank(n)) {
                    return Py.DISCARD;
                }
                throw new UnresolvedSymbolException(n.name(), n.position());
            }
            switch (obj.kind()) {
                case NIL:
                    return PyConstant.NONE;
                case CONST:
                    if (obj == Universe.TRUE) {
                        return PyConstant.TRUE;
                    }
                    if (obj == Universe.FALSE) {
                        return PyConstant.FALSE;
                    }
                    return Py.name(scope.name(obj));
                case BUILTIN:
                    return builtinValue(obj, n);
                case TYPE_NAME:
                    return typeExpr(obj.type(), ctx);
                case PACKAGE:
                    return Py.name(obj.name());
                default:
                    return Py.name(scope.name(obj));
            }
        }

        // builtins referenced without being called, e.g. as a deferred function
        private PyExpr builtinValue(GoObject obj, Node n) {
            if (obj == Universe.LEN || obj == Universe.CAP) {
                return Py.LEN;
            }
            if (obj == Universe.PRINTLN) {
                return Py.PRINT;
            }
            if (obj == Universe.COMPLEX) {
                return COMPLEX;
            }
            throw new LoweringException("builtin " + obj.name() + " cannot be used as a value", n.describe(), n.position());
        }

        @Override
        public PyExpr visit(BasicLit n, Void arg) {
            return Literals.lower(n);
        }

        @Override
        public PyExpr visit(ParenExpr n, Void arg) {
            return lower(n.x());
        }

        // ── composite values ──

        @Override
        public PyExpr visit(CompositeLit n, Void arg) {
            GoType type = oracle.typeOf(n);
            if (type == null && n.type() != null) {
                type = oracle.typeOf(n.type());
            }
            if (type == null) {
                throw new LoweringException("composite literal type is not resolved", n.describe(), n.position());
            }
            GoType underlying = type.underlying();

            if (underlying instanceof StructType) {
                if (!(type instanceof NamedType named)) {
                    throw new LoweringException("anonymous struct literal", n.describe(), n.position());
                }
                List<PyExpr> args = new ArrayList<>();
                List<PyKeyword> keywords = new ArrayList<>();
                for (Expr element : n.elements()) {
                    if (element instanceof KeyValueExpr kv && kv.key() instanceof Ident key) {
                        keywords.add(new PyKeyword(NamingScope.attributeName(key.name()), lower(kv.value())));
                    } else {
                        args.add(lower(element));
                    }
                }
                return new PyCall(Py.name(scope.name(named.obj())), args, keywords);
            }

            if (underlying instanceof SliceType || underlying instanceof ArrayType) {
                List<PyExpr> elements = new ArrayList<>();
                for (Expr element : n.elements()) {
                    if (element instanceof KeyValueExpr) {
                        throw new LoweringException("indexed elements in slice literal", element.describe(), element.position());
                    }
                    elements.add(lower(element));
                }
                if (underlying instanceof ArrayType array) {
                    while (elements.size() < array.length()) {
                        elements.add(ZeroValues.of(array.elem()));
                    }
                }
                PyExpr list = new PyList(elements);
                return type instanceof NamedType named ? Py.call(Py.name(scope.name(named.obj())), list) : list;
            }

            if (underlying instanceof MapType) {
                List<PyExpr> keys = new ArrayList<>();
                List<PyExpr> values = new ArrayList<>();
                for (Expr element : n.elements()) {
                    if (!(element instanceof KeyValueExpr kv)) {
                        throw new LoweringException("map literal element without key", element.describe(), element.position());
                    }
                    keys.add(lower(kv.key()));
                    values.add(lower(kv.value()));
                }
                return new PyDict(keys, values);
            }
            throw new LoweringException("unknown composite literal of type " + type, n.describe(), n.position());
        }

        @Override
        public PyExpr visit(FuncLit n, Void arg) {
            String name = scope.temp("func");
            PyFunctionDef def = engine.declarations().lowerFunction(name, n.type(), n.body(), ctx);
            hoisted.add(def);
            return Py.name(name);
        }

        // ── access ──

        @Override
        public PyExpr visit(SelectorExpr n, Void arg) {
            if (AstUtils.unparen(n.x()) instanceof Ident pkg) {
                GoObject pkgObj = oracle.objectOf(pkg);
                if (pkgObj != null && pkgObj.kind() == ObjectKind.PACKAGE) {
                    return Py.attr(Py.name(pkgObj.name()), NamingScope.attributeName(n.sel().name()));
                }
            }
            GoObject member = oracle.objectOf(n.sel());
            String attr = member != null && member.isAttribute()
                    ? scope.name(member)
                    : NamingScope.attributeName(n.sel().name());
            return Py.attr(lower(n.x()), attr);
        }

        @Override
        public PyExpr visit(IndexExpr n, Void arg) {
            GoType xType = oracle.typeOf(n.x());
            GoType underlying = xType == null ? null : xType.underlying();
            if (underlying instanceof MapType map) {
                return mapIndex(n, map);
            }
            PyExpr x = lower(n.x());
            PyExpr element = new PySubscript(x, lower(n.index()));
            // indexing a string yields a byte
            if (underlying instanceof BasicType basic && basic.isString()) {
                return Py.call(Py.ORD, element);
            }
            return element;
        }

        /**
         * {@code m[k]} reads the zero value for a missing key; {@code v, ok := m[k]} also
         * reports presence.
         */
        private PyExpr mapIndex(IndexExpr n, MapType map) {
            PyExpr x = lower(n.x());
            PyExpr key = lower(n.index());
            PyExpr zero = ZeroValues.of(map.value());
            if (!(oracle.typeOf(n) instanceof TupleType)) {
                return zero == PyConstant.NONE
                        ? Py.call(Py.attr(x, "get"), key)
                        : Py.call(Py.attr(x, "get"), key, zero);
            }
            if (!(x instanceof PyName)) {
                PyName mapTemp = Py.name(scope.temp("map"));
                hoisted.add(Py.assign(mapTemp, x));
                x = mapTemp;
            }
            PyName keyTemp = Py.name(scope.temp("key"));
            hoisted.add(Py.assign(keyTemp, key));
            return new PyIfExp(Py.compare(keyTemp, CmpOperator.IN, x),
                    Py.tuple(new PySubscript(x, keyTemp), PyConstant.TRUE),
                    Py.tuple(zero, PyConstant.FALSE));
        }

        @Override
        public PyExpr visit(SliceExpr n, Void arg) {
            PyExpr x = lower(n.x());
            return new PySubscript(x, new PySlice(lowerOrNull(n.low()), lowerOrNull(n.high()), null));
        }

        @Override
        public PyExpr visit(StarExpr n, Void arg) {
            return lower(n.x());
        }

        @Override
        public PyExpr visit(TypeAssertExpr n, Void arg) {
            if (n.type() == null) {
                throw new LoweringException("x.(type) outside a type switch", n.describe(), n.position());
            }
            if (!(oracle.typeOf(n) instanceof TupleType)) {
                return lower(n.x());
            }
            GoType asserted = oracle.typeOf(n.type());
            if (asserted == null) {
                throw new LoweringException("asserted type is not resolved", n.describe(), n.position());
            }
            PyName candidate = Py.name(scope.temp("asserted"));
            hoisted.add(Py.assign(candidate, lower(n.x())));
            PyExpr test = asserted.underlying() instanceof InterfaceType iface
                    ? TypeTests.satisfies(candidate, iface)
                    : Py.call(Py.ISINSTANCE, candidate, typeExpr(asserted, ctx));
            return new PyIfExp(test,
                    Py.tuple(candidate, PyConstant.TRUE),
                    Py.tuple(ZeroValues.of(asserted), PyConstant.FALSE));
        }

        // ── operators ──

        @Override
        public PyExpr visit(UnaryExpr n, Void arg) {
            switch (n.op()) {
                case AND:
                    return lower(n.x());
                case SUB:
                    return new PyUnaryOp(UnaryOperator.USUB, lower(n.x()));
                case ADD:
                    return new PyUnaryOp(UnaryOperator.UADD, lower(n.x()));
                case NOT:
                    return new PyUnaryOp(UnaryOperator.NOT, lower(n.x()));
                case XOR:
                    return new PyUnaryOp(UnaryOperator.INVERT, lower(n.x()));
                case ARROW:
                    throw new LoweringException("channel receive has no Python lowering", n.describe(), n.position());
                default:
                    throw new LoweringException("unknown unary operator " + n.op().text(), n.describe(), n.position());
            }
        }

        @Override
        public PyExpr visit(BinaryExpr n, Void arg) {
            PyExpr left = lower(n.x());
            PyExpr right = lower(n.y());
            Token op = n.op();
            if (op == Token.LAND || op == Token.LOR) {
                return new PyBoolOp(op == Token.LAND ? BoolOperator.AND : BoolOperator.OR, List.of(left, right));
            }
            if (AstUtils.isComparison(op)) {
                if ((op == Token.EQL || op == Token.NEQ) && (isNil(n.x(), oracle) || isNil(n.y(), oracle))) {
                    return Py.compare(left, op == Token.EQL ? CmpOperator.IS : CmpOperator.IS_NOT, right);
                }
                return Py.compare(left, AstUtils.getComparisonOperator(op), right);
            }
            if (op == Token.AND_NOT) {
                return new PyBinOp(left, BinaryOperator.BIT_AND, new PyUnaryOp(UnaryOperator.INVERT, right));
            }
            if (op == Token.QUO && isInteger(oracle.typeOf(n))) {
                return new PyBinOp(left, BinaryOperator.FLOOR_DIV, right);
            }
            try {
                return new PyBinOp(left, AstUtils.getBinaryOperator(op), right);
            } catch (IllegalArgumentException e) {
                throw new LoweringException(e.getMessage(), n.describe(), n.position(), e);
            }
        }

        // ── calls ──

        @Override
        public PyExpr visit(CallExpr n, Void arg) {
            Expr fun = AstUtils.unparen(n.fun());
            if (fun instanceof Ident ident) {
                GoObject obj = oracle.objectOf(ident);
                if (obj != null && obj.kind() == ObjectKind.BUILTIN) {
                    return builtin(n, obj);
                }
            }
            if (isTypeExpr(fun)) {
                return conversion(n, fun);
            }
            PyExpr func = lower(fun);
            List<PyExpr> args = new ArrayList<>();
            for (int i = 0; i < n.args().size(); i++) {
                Expr argExpr = n.args().get(i);
                PyExpr lowered = lower(argExpr);
                boolean spread = n.ellipsis() && i == n.args().size() - 1;
                // f(g()) where g returns several values
                boolean multiValue = n.args().size() == 1 && oracle.typeOf(argExpr) instanceof TupleType;
                args.add(spread || multiValue ? new PyStarred(lowered) : lowered);
            }
            return Py.call(func, args);
        }

        private boolean isTypeExpr(Expr expr) {
            Expr e = AstUtils.unparen(expr);
            if (e instanceof Ident ident) {
                GoObject obj = oracle.objectOf(ident);
                return obj != null && obj.kind() == ObjectKind.TYPE_NAME;
            }
            if (e instanceof SelectorExpr sel) {
                GoObject obj = oracle.objectOf(sel.sel());
                return obj != null && obj.kind() == ObjectKind.TYPE_NAME;
            }
            if (e instanceof StarExpr star) {
                return isTypeExpr(star.x());
            }
            return e instanceof ArrayTypeExpr || e instanceof MapTypeExpr || e instanceof ChanTypeExpr
                    || e instanceof FuncTypeExpr || e instanceof InterfaceTypeExpr || e instanceof StructTypeExpr;
        }

        private PyExpr conversion(CallExpr n, Expr fun) {
            if (n.args().size() != 1) {
                throw new LoweringException("conversion takes exactly one argument", n.describe(), n.position());
            }
            GoType target = oracle.typeOf(fun);
            if (target == null) {
                throw new LoweringException("conversion target is not resolved", n.describe(), n.position());
            }
            Expr argExpr = n.args().get(0);
            PyExpr value = lower(argExpr);
            GoType from = oracle.typeOf(argExpr);
            GoType source = from == null ? null : from.underlying();
            GoType underlying = target.underlying();

            if (target instanceof NamedType named) {
                if (underlying instanceof StructType || underlying instanceof BasicType
                        || underlying instanceof SliceType || underlying instanceof ArrayType) {
                    return Py.call(Py.name(scope.name(named.obj())), value);
                }
                return value;
            }
            if (underlying instanceof BasicType basic) {
                if (basic.isString()) {
                    return toString(value, source);
                }
                if (basic.isInteger()) {
                    return isInteger(source) ? value : Py.call(INT, value);
                }
                if (basic.isFloat()) {
                    return source instanceof BasicType b && b.isFloat() ? value : Py.call(FLOAT, value);
                }
                if (basic.isComplex()) {
                    return source instanceof BasicType b && b.isComplex() ? value : Py.call(COMPLEX, value);
                }
                return value;
            }
            if (underlying instanceof SliceType slice && source instanceof BasicType b && b.isString()) {
                if (isKind(slice.elem(), BasicKind.UINT8)) {
                    return Py.call(LIST, Py.call(Py.attr(value, "encode")));
                }
                return Py.call(LIST, Py.call(Py.MAP, Py.ORD, value));
            }
            return value;
        }

        private PyExpr toString(PyExpr value, GoType source) {
            if (isInteger(source)) {
                return Py.call(CHR, value);
            }
            if (source instanceof SliceType slice) {
                if (isKind(slice.elem(), BasicKind.UINT8)) {
                    return Py.call(Py.attr(Py.call(BYTES, value), "decode"));
                }
                return Py.call(Py.attr(Py.str("\"\""), "join"), Py.call(Py.MAP, CHR, value));
            }
            if (source instanceof BasicType basic && basic.isString()) {
                return value;
            }
            return Py.call(STR, value);
        }

        private PyExpr builtin(CallExpr n, GoObject builtin) {
            List<Expr> args = n.args();
            switch (builtin.name()) {
                case "len":
                case "cap":
                    requireArgs(n, 1);
                    return Py.call(Py.LEN, lower(args.get(0)));
                case "append": {
                    if (args.isEmpty()) {
                        throw new LoweringException("append needs a slice", n.describe(), n.position());
                    }
                    PyExpr slice = lower(args.get(0));
                    if (args.size() == 1) {
                        return slice;
                    }
                    if (n.ellipsis()) {
                        return new PyBinOp(slice, BinaryOperator.ADD, lower(args.get(args.size() - 1)));
                    }
                    return new PyBinOp(slice, BinaryOperator.ADD, new PyList(lowerEach(args.subList(1, args.size()))));
                }
                case "make":
                    return make(n);
                case "new":
                    requireArgs(n, 1);
                    return ZeroValues.of(resolvedType(args.get(0)));
                case "print":
                    return new PyCall(Py.PRINT, lowerEach(args), List.of(
                            new PyKeyword("sep", Py.str("\"\"")),
                            new PyKeyword("end", Py.str("\"\""))));
                case "println":
                    return Py.call(Py.PRINT, lowerEach(args));
                case "complex":
                    requireArgs(n, 2);
                    return Py.call(COMPLEX, lower(args.get(0)), lower(args.get(1)));
                case "real":
                    requireArgs(n, 1);
                    return Py.attr(lower(args.get(0)), "real");
                case "imag":
                    requireArgs(n, 1);
                    return Py.attr(lower(args.get(0)), "imag");
                default:
                    throw new LoweringException("builtin " + builtin.name() + " has no Python lowering",
                            n.describe(), n.position());
            }
        }

        private PyExpr make(CallExpr n) {
            if (n.args().isEmpty()) {
                throw new LoweringException("make needs a type", n.describe(), n.position());
            }
            GoType type = resolvedType(n.args().get(0));
            GoType underlying = type.underlying();
            if (underlying instanceof SliceType slice) {
                if (n.args().size() < 2) {
                    throw new LoweringException("make of a slice needs a length", n.describe(), n.position());
                }
                PyExpr length = lower(n.args().get(1));
                PyExpr list = new PyListComp(ZeroValues.of(slice.elem()),
                        List.of(new PyComprehension(Py.DISCARD, Py.call(Py.RANGE, length))));
                return type instanceof NamedType named ? Py.call(Py.name(scope.name(named.obj())), list) : list;
            }
            if (underlying instanceof MapType) {
                return new PyDict(List.of(), List.of());
            }
            throw new LoweringException("make of " + type + " has no Python lowering", n.describe(), n.position());
        }

        private GoType resolvedType(Expr typeExpr) {
            GoType type = oracle.typeOf(typeExpr);
            if (type == null) {
                throw new LoweringException("type is not resolved", typeExpr.describe(), typeExpr.position());
            }
            return type;
        }

        private void requireArgs(CallExpr n, int count) {
            if (n.args().size() != count) {
                throw new LoweringException("expected " + count + " argument(s), got " + n.args().size(),
                        n.describe(), n.position());
            }
        }
    }

    private static boolean isInteger(GoType type) {
        return type != null && type.underlying() instanceof BasicType basic && basic.isInteger();
    }

    private static boolean isKind(GoType type, BasicKind kind) {
        return type instanceof BasicType basic && basic.kind() == kind;
    }
}
