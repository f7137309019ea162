package org.gopy.lowering;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.gopy.LoweringException;
import org.gopy.source.ast.AssignStmt;
import org.gopy.source.ast.BlockStmt;
import org.gopy.source.ast.BranchStmt;
import org.gopy.source.ast.CallExpr;
import org.gopy.source.ast.CaseClause;
import org.gopy.source.ast.CommentGroup;
import org.gopy.source.ast.CommentIndex;
import org.gopy.source.ast.DeclStmt;
import org.gopy.source.ast.DeferStmt;
import org.gopy.source.ast.EmptyStmt;
import org.gopy.source.ast.Expr;
import org.gopy.source.ast.ExprStmt;
import org.gopy.source.ast.ForStmt;
import org.gopy.source.ast.GoStmt;
import org.gopy.source.ast.Ident;
import org.gopy.source.ast.IfStmt;
import org.gopy.source.ast.IncDecStmt;
import org.gopy.source.ast.IndexExpr;
import org.gopy.source.ast.LabeledStmt;
import org.gopy.source.ast.Node;
import org.gopy.source.ast.RangeStmt;
import org.gopy.source.ast.ReturnStmt;
import org.gopy.source.ast.SendStmt;
import org.gopy.source.ast.Spec;
import org.gopy.source.ast.Stmt;
import org.gopy.source.ast.SwitchStmt;
import org.gopy.source.ast.Token;
import org.gopy.source.ast.TypeAssertExpr;
import org.gopy.source.ast.TypeSpec;
import org.gopy.source.ast.TypeSwitchStmt;
import org.gopy.source.ast.ValueSpec;
import org.gopy.source.ast.visitor.GoGenericVisitorWithDefaults;
import org.gopy.source.types.BasicType;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.GoType;
import org.gopy.source.types.InterfaceType;
import org.gopy.source.types.MapType;
import org.gopy.source.types.ObjectKind;
import org.gopy.source.types.TypeOracle;
import org.gopy.source.types.Universe;
import org.gopy.target.BinaryOperator;
import org.gopy.target.BoolOperator;
import org.gopy.target.CmpOperator;
import org.gopy.target.Py;
import org.gopy.target.PyAssign;
import org.gopy.target.PyAugAssign;
import org.gopy.target.PyBinOp;
import org.gopy.target.PyBoolOp;
import org.gopy.target.PyBreak;
import org.gopy.target.PyComment;
import org.gopy.target.PyConstant;
import org.gopy.target.PyContinue;
import org.gopy.target.PyDelete;
import org.gopy.target.PyExceptHandler;
import org.gopy.target.PyExpr;
import org.gopy.target.PyFor;
import org.gopy.target.PyIf;
import org.gopy.target.PyName;
import org.gopy.target.PyNum;
import org.gopy.target.PyRaise;
import org.gopy.target.PyReturn;
import org.gopy.target.PyStarred;
import org.gopy.target.PyStmt;
import org.gopy.target.PyStr;
import org.gopy.target.PySubscript;
import org.gopy.target.PyTry;
import org.gopy.target.PyTuple;
import org.gopy.target.PyUnaryOp;
import org.gopy.target.PyWhile;
import org.gopy.target.UnaryOperator;
import org.gopy.util.AstUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers one Go statement into zero or more Python statements. Expressions are delegated to
 * the engine's {@link ExpressionLowering}; their hoisted statements are emitted first.
 */
public class StatementLowering extends GoGenericVisitorWithDefaults<List<PyStmt>, LoweringContext> {

    private static final Logger log = LoggerFactory.getLogger(StatementLowering.class);

    static final PyName FALLTHROUGH_MARKER = Py.name("_unsupported_fallthrough");

    private final LoweringEngine engine;

    public StatementLowering(LoweringEngine engine) {
        this.engine = engine;
    }

    public List<PyStmt> lower(Stmt stmt, LoweringContext ctx) {
        List<PyStmt> lowered = stmt.accept(this, ctx);
        List<PyStmt> comments = comments(stmt, ctx);
        return comments.isEmpty() ? lowered : Py.concat(comments, lowered);
    }

    public List<PyStmt> lowerAll(List<? extends Stmt> stmts, LoweringContext ctx) {
        List<PyStmt> result = new ArrayList<>();
        for (Stmt stmt : stmts) {
            result.addAll(lower(stmt, ctx));
        }
        return result;
    }

    @Override
    public List<PyStmt> defaultAction(Node n, LoweringContext ctx) {
        throw new LoweringException("unknown statement: " + n.describe(), n.describe(), n.position());
    }

    @Override
    public List<PyStmt> visit(BlockStmt n, LoweringContext ctx) {
        return lowerAll(n.list(), ctx);
    }

    @Override
    public List<PyStmt> visit(EmptyStmt n, LoweringContext ctx) {
        return List.of();
    }

    @Override
    public List<PyStmt> visit(DeclStmt n, LoweringContext ctx) {
        List<PyStmt> result = new ArrayList<>();
        for (Spec spec : n.decl().specs()) {
            if (spec instanceof ValueSpec valueSpec) {
                result.addAll(engine.declarations().lowerValueSpec(valueSpec, ctx));
            } else if (spec instanceof TypeSpec typeSpec) {
                engine.declarations().lowerTypeSpec(typeSpec, n.decl().doc(), ctx).ifPresent(result::add);
            } else {
                throw new LoweringException("unknown spec in declaration statement: " + spec.describe(),
                        spec.describe(), spec.position());
            }
        }
        return result;
    }

    @Override
    public List<PyStmt> visit(IncDecStmt n, LoweringContext ctx) {
        HoistedStatements hoisted = new HoistedStatements();
        BinaryOperator op = n.tok() == Token.INC ? BinaryOperator.ADD : BinaryOperator.SUB;
        Optional<MapElement> element = mapElement(n.x(), hoisted, ctx);
        if (element.isPresent()) {
            return hoisted.emit(element.get().update(op, Py.num(1)));
        }
        PyExpr target = hoisted.add(expressions().lowerTarget(n.x(), ctx));
        noteAssigned(n.x(), ctx);
        return hoisted.emit(new PyAugAssign(target, op, Py.num(1)));
    }

    @Override
    public List<PyStmt> visit(AssignStmt n, LoweringContext ctx) {
        if (n.tok() == Token.ASSIGN || n.tok() == Token.DEFINE) {
            return assignment(n, ctx);
        }
        if (n.lhs().size() != 1 || n.rhs().size() != 1) {
            throw new LoweringException("compound assignment needs exactly one operand on each side",
                    n.describe(), n.position());
        }
        Expr lhs = n.lhs().get(0);
        BinaryOperator op;
        if (n.tok() == Token.AND_NOT_ASSIGN) {
            op = BinaryOperator.BIT_AND;
        } else {
            try {
                op = AstUtils.getAugmentedOperator(n.tok());
            } catch (IllegalArgumentException e) {
                throw new LoweringException(e.getMessage(), n.describe(), n.position(), e);
            }
            if (op == BinaryOperator.FLOOR_DIV && isFloatingPoint(ctx.oracle().typeOf(lhs))) {
                op = BinaryOperator.DIV;
            }
        }

        HoistedStatements hoisted = new HoistedStatements();
        Optional<MapElement> element = mapElement(lhs, hoisted, ctx);
        PyExpr target = null;
        if (element.isEmpty()) {
            target = hoisted.add(expressions().lowerTarget(lhs, ctx));
            noteAssigned(lhs, ctx);
        }
        PyExpr value = hoisted.add(expressions().lower(n.rhs().get(0), ctx));
        if (n.tok() == Token.AND_NOT_ASSIGN) {
            value = new PyUnaryOp(UnaryOperator.INVERT, value);
        }
        if (element.isPresent()) {
            return hoisted.emit(element.get().update(op, value));
        }
        return hoisted.emit(new PyAugAssign(target, op, value));
    }

    /**
     * A map element on the left of {@code ++} or {@code op=}. Python's in-place form raises
     * {@code KeyError} for a missing key, so the update reads through {@code get} with the
     * element's zero value and stores the result back.
     */
    private record MapElement(PyExpr map, PyExpr key, PyExpr zero) {

        PyStmt update(BinaryOperator op, PyExpr value) {
            PyExpr current = zero == PyConstant.NONE
                    ? Py.call(Py.attr(map, "get"), key)
                    : Py.call(Py.attr(map, "get"), key, zero);
            return Py.assign(new PySubscript(map, key), new PyBinOp(current, op, value));
        }
    }

    /**
     * Lowers {@code target} as a map element when it indexes a map, binding a computed map or
     * key to a temporary so each is evaluated once.
     */
    private Optional<MapElement> mapElement(Expr target, HoistedStatements hoisted, LoweringContext ctx) {
        if (!(AstUtils.unparen(target) instanceof IndexExpr index)) {
            return Optional.empty();
        }
        GoType type = ctx.oracle().typeOf(index.x());
        if (type == null || !(type.underlying() instanceof MapType map)) {
            return Optional.empty();
        }
        PyExpr x = hoisted.add(expressions().lower(index.x(), ctx));
        if (!(x instanceof PyName)) {
            PyName mapTemp = Py.name(ctx.scope().temp("map"));
            hoisted.addStatement(Py.assign(mapTemp, x));
            x = mapTemp;
        }
        PyExpr key = hoisted.add(expressions().lower(index.index(), ctx));
        if (!(key instanceof PyName || key instanceof PyNum || key instanceof PyStr || key instanceof PyConstant)) {
            PyName keyTemp = Py.name(ctx.scope().temp("key"));
            hoisted.addStatement(Py.assign(keyTemp, key));
            key = keyTemp;
        }
        return Optional.of(new MapElement(x, key, ZeroValues.of(map.value())));
    }

    private List<PyStmt> assignment(AssignStmt n, LoweringContext ctx) {
        if (n.lhs().size() != n.rhs().size() && n.rhs().size() != 1) {
            throw new LoweringException("assignment count mismatch: " + n.lhs().size() + " targets, "
                    + n.rhs().size() + " values", n.describe(), n.position());
        }
        HoistedStatements hoisted = new HoistedStatements();
        List<PyExpr> targets = hoisted.addAll(expressions().lowerTargets(n.lhs(), ctx));
        for (Expr lhs : n.lhs()) {
            noteAssigned(lhs, ctx);
        }
        PyExpr value = hoisted.add(expressions().lowerTuple(n.rhs(), ctx));
        return hoisted.emit(new PyAssign(List.of(Py.tupleOrSingle(targets)), value));
    }

    @Override
    public List<PyStmt> visit(RangeStmt n, LoweringContext ctx) {
        boolean hasKey = n.key() != null && !AstUtils.isBlank(n.key());
        boolean hasValue = n.value() != null && !AstUtils.isBlank(n.value());
        if (n.key() == null && n.value() != null) {
            throw new LoweringException("range with a value but no key", n.describe(), n.position());
        }

        HoistedStatements hoisted = new HoistedStatements();
        PyExpr key = hasKey ? hoisted.add(expressions().lowerTarget(n.key(), ctx)) : Py.DISCARD;
        PyExpr value = hasValue ? hoisted.add(expressions().lowerTarget(n.value(), ctx)) : Py.DISCARD;
        noteAssigned(n.key(), ctx);
        noteAssigned(n.value(), ctx);
        PyExpr collection = hoisted.add(expressions().lower(n.x(), ctx));

        GoType type = ctx.oracle().typeOf(n.x());
        GoType underlying = type == null ? null : type.underlying();

        PyExpr target;
        PyExpr iter;
        if (underlying instanceof MapType) {
            if (hasValue) {
                target = Py.tuple(key, value);
                iter = Py.call(Py.attr(collection, "items"));
            } else {
                target = key;
                iter = collection;
            }
        } else if (underlying instanceof BasicType basic && basic.isInteger()) {
            if (hasValue) {
                throw new LoweringException("range over an integer has no value", n.describe(), n.position());
            }
            target = key;
            iter = Py.call(Py.RANGE, collection);
        } else if (underlying instanceof BasicType basic && basic.isString() && hasValue) {
            // values are code points; keys count characters rather than UTF-8 byte offsets
            PyExpr codePoints = Py.call(Py.MAP, Py.ORD, collection);
            target = hasKey ? Py.tuple(key, value) : value;
            iter = hasKey ? Py.call(Py.ENUMERATE, codePoints) : codePoints;
        } else if (hasKey && hasValue) {
            target = Py.tuple(key, value);
            iter = Py.call(Py.ENUMERATE, collection);
        } else if (hasKey) {
            target = key;
            iter = Py.call(Py.RANGE, Py.call(Py.LEN, collection));
        } else if (hasValue) {
            target = value;
            iter = collection;
        } else {
            target = Py.DISCARD;
            iter = collection;
        }

        ctx.enterLoop(List.of());
        List<PyStmt> body;
        try {
            body = lower(n.body(), ctx);
        } finally {
            ctx.exitLoop();
        }
        return hoisted.emit(new PyFor(target, iter, Py.orPass(body)));
    }

    @Override
    public List<PyStmt> visit(ForStmt n, LoweringContext ctx) {
        List<PyStmt> result = new ArrayList<>();
        if (n.init() != null) {
            result.addAll(lower(n.init(), ctx));
        }
        PyExpr test = PyConstant.TRUE;
        if (n.cond() != null) {
            LoweredExpr cond = expressions().lower(n.cond(), ctx);
            if (!cond.hoisted().isEmpty()) {
                log.debug("{}: loop condition hoists statements; they run once before the loop", n.position());
            }
            result.addAll(cond.hoisted());
            test = cond.expr();
        }
        List<PyStmt> post = n.post() == null ? List.of() : lower(n.post(), ctx);

        ctx.enterLoop(post);
        List<PyStmt> body;
        try {
            body = lower(n.body(), ctx);
        } finally {
            ctx.exitLoop();
        }
        result.add(new PyWhile(test, Py.orPass(Py.concat(body, post))));
        return result;
    }

    @Override
    public List<PyStmt> visit(IfStmt n, LoweringContext ctx) {
        List<PyStmt> result = new ArrayList<>();
        if (n.init() != null) {
            result.addAll(lower(n.init(), ctx));
        }
        LoweredExpr test = expressions().lower(n.cond(), ctx);
        result.addAll(test.hoisted());
        List<PyStmt> body = Py.orPass(lower(n.body(), ctx));
        List<PyStmt> orelse = n.elseStmt() == null ? List.of() : lower(n.elseStmt(), ctx);
        result.add(new PyIf(test.expr(), body, orelse));
        return result;
    }

    @Override
    public List<PyStmt> visit(SwitchStmt n, LoweringContext ctx) {
        List<PyStmt> result = new ArrayList<>();
        if (n.init() != null) {
            result.addAll(lower(n.init(), ctx));
        }
        HoistedStatements hoisted = new HoistedStatements();
        PyExpr tag = null;
        if (n.tag() != null) {
            PyExpr value = hoisted.add(expressions().lower(n.tag(), ctx));
            tag = Py.name(ctx.scope().temp("tag"));
            hoisted.addStatement(Py.assign(tag, value));
        }

        List<Branch> branches = new ArrayList<>();
        List<PyStmt> defaultBody = null;
        for (CaseClause clause : n.clauses()) {
            Optional<LoweredExpr> test = expressions().caseClauseTest(clause, tag, ctx);
            List<PyStmt> body = lowerAll(clause.body(), ctx);
            if (test.isPresent()) {
                branches.add(new Branch(hoisted.add(test.get()), body));
            } else {
                defaultBody = checkSingleDefault(defaultBody, body, clause);
            }
        }
        result.addAll(hoisted.emit());
        result.addAll(fold(branches, defaultBody));
        return result;
    }

    @Override
    public List<PyStmt> visit(TypeSwitchStmt n, LoweringContext ctx) {
        List<PyStmt> result = new ArrayList<>();
        if (n.init() != null) {
            result.addAll(lower(n.init(), ctx));
        }

        Ident binding = null;
        TypeAssertExpr guard;
        if (n.assign() instanceof AssignStmt assign && assign.lhs().size() == 1 && assign.rhs().size() == 1
                && assign.lhs().get(0) instanceof Ident ident
                && AstUtils.unparen(assign.rhs().get(0)) instanceof TypeAssertExpr assertion) {
            binding = ident;
            guard = assertion;
        } else if (n.assign() instanceof ExprStmt stmt && AstUtils.unparen(stmt.x()) instanceof TypeAssertExpr assertion) {
            guard = assertion;
        } else {
            throw new LoweringException("unknown type switch guard", n.describe(), n.position());
        }

        HoistedStatements hoisted = new HoistedStatements();
        PyExpr switched = hoisted.add(expressions().lower(guard.x(), ctx));
        PyName subject = Py.name(ctx.scope().temp(binding != null ? binding.name() : "subject"));
        hoisted.addStatement(Py.assign(subject, switched));
        PyName tag = Py.name(ctx.scope().temp("tag"));
        hoisted.addStatement(Py.assign(tag, Py.call(Py.TYPE, subject)));

        List<Branch> branches = new ArrayList<>();
        List<PyStmt> defaultBody = null;
        for (CaseClause clause : n.clauses()) {
            List<PyStmt> body = new ArrayList<>();
            GoObject implicit = binding == null ? null : ctx.oracle().implicitOf(clause);
            if (implicit != null) {
                body.add(Py.assign(Py.name(ctx.scope().name(implicit)), subject));
            }
            body.addAll(lowerAll(clause.body(), ctx));
            if (clause.list().isEmpty()) {
                defaultBody = checkSingleDefault(defaultBody, body, clause);
                continue;
            }
            List<PyExpr> tests = new ArrayList<>();
            for (Expr caseType : clause.list()) {
                tests.add(typeCaseTest(caseType, tag, subject, ctx));
            }
            PyExpr test = tests.size() == 1 ? tests.get(0) : new PyBoolOp(BoolOperator.OR, tests);
            branches.add(new Branch(test, body));
        }
        result.addAll(hoisted.emit());
        result.addAll(fold(branches, defaultBody));
        return result;
    }

    private PyExpr typeCaseTest(Expr caseType, PyName tag, PyName subject, LoweringContext ctx) {
        GoType type = ctx.oracle().typeOf(caseType);
        if (type == null) {
            throw new LoweringException("case type is not resolved", caseType.describe(), caseType.position());
        }
        if (!type.equals(BasicType.UNTYPED_NIL) && type.underlying() instanceof InterfaceType iface) {
            return TypeTests.satisfies(subject, iface);
        }
        return Py.compare(tag, CmpOperator.EQ, expressions().typeExpr(type, ctx));
    }

    private static List<PyStmt> checkSingleDefault(List<PyStmt> existing, List<PyStmt> body, CaseClause clause) {
        if (existing != null) {
            throw new LoweringException("multiple defaults in switch", clause.describe(), clause.position());
        }
        return body;
    }

    /**
     * Right-folds the case branches into an if/else chain whose last else is the default body.
     */
    private static List<PyStmt> fold(List<Branch> branches, List<PyStmt> defaultBody) {
        List<PyStmt> tail = defaultBody == null ? List.of() : defaultBody;
        if (branches.isEmpty()) {
            return tail;
        }
        for (int i = branches.size() - 1; i >= 0; i--) {
            Branch branch = branches.get(i);
            tail = List.of(new PyIf(branch.test(), Py.orPass(branch.body()), tail));
        }
        return tail;
    }

    private record Branch(PyExpr test, List<PyStmt> body) {
    }

    @Override
    public List<PyStmt> visit(BranchStmt n, LoweringContext ctx) {
        if (n.label() != null && (n.tok() == Token.BREAK || n.tok() == Token.CONTINUE)) {
            log.warn("{}: label '{}' on {} dropped; it applies to the innermost loop", n.position(),
                    n.label().name(), n.tok().text());
        }
        switch (n.tok()) {
            case BREAK:
                return List.of(new PyBreak());
            case CONTINUE:
                return Py.concat(ctx.continuePrefix(), List.of(new PyContinue()));
            case FALLTHROUGH:
                Unsupported.report("fallthrough", n, ctx, log);
                return List.of(Py.expr(Py.call(FALLTHROUGH_MARKER)));
            case GOTO:
                Unsupported.report("goto", n, ctx, log);
                return List.of(Py.PASS);
            default:
                throw new LoweringException("unknown branch statement: " + n.tok().text(), n.describe(), n.position());
        }
    }

    @Override
    public List<PyStmt> visit(ReturnStmt n, LoweringContext ctx) {
        if (n.results().isEmpty()) {
            if (ctx instanceof FunctionContext fn && !fn.namedResults().isEmpty()) {
                return List.of(new PyReturn(Py.tupleOrSingle(List.<PyExpr>copyOf(fn.namedResults()))));
            }
            return List.of(new PyReturn(null));
        }
        HoistedStatements hoisted = new HoistedStatements();
        PyExpr value = hoisted.add(expressions().lowerTuple(n.results(), ctx));
        return hoisted.emit(new PyReturn(value));
    }

    @Override
    public List<PyStmt> visit(ExprStmt n, LoweringContext ctx) {
        if (AstUtils.unparen(n.x()) instanceof CallExpr call) {
            GoObject builtin = builtinOf(call, ctx.oracle());
            if (builtin == Universe.DELETE && call.args().size() == 2) {
                return delete(call, ctx);
            }
            if (builtin == Universe.PANIC && call.args().size() == 1) {
                HoistedStatements hoisted = new HoistedStatements();
                PyExpr value = hoisted.add(expressions().lower(call.args().get(0), ctx));
                return hoisted.emit(new PyRaise(Py.call(Py.EXCEPTION, value)));
            }
        }
        HoistedStatements hoisted = new HoistedStatements();
        PyExpr value = hoisted.add(expressions().lower(n.x(), ctx));
        return hoisted.emit(Py.expr(value));
    }

    /**
     * {@code delete(m, k)} tolerates a missing key; {@code del m[k]} does not.
     */
    private List<PyStmt> delete(CallExpr call, LoweringContext ctx) {
        HoistedStatements hoisted = new HoistedStatements();
        PyExpr map = hoisted.add(expressions().lower(call.args().get(0), ctx));
        PyExpr key = hoisted.add(expressions().lower(call.args().get(1), ctx));
        PyDelete del = new PyDelete(List.of(new PySubscript(map, key)));
        PyExceptHandler missing = new PyExceptHandler(Py.KEY_ERROR, List.of(Py.PASS));
        return hoisted.emit(new PyTry(List.of(del), List.of(missing), List.of()));
    }

    @Override
    public List<PyStmt> visit(DeferStmt n, LoweringContext ctx) {
        if (!(ctx instanceof FunctionContext fn) || fn.captureList() == null) {
            Unsupported.report("defer outside a function body", n, ctx, log);
            return List.of();
        }
        HoistedStatements hoisted = new HoistedStatements();
        PyExpr fun = hoisted.add(expressions().lower(n.call().fun(), ctx));
        List<PyExpr> args = hoisted.addAll(expressions().lowerAll(n.call().args(), ctx));
        if (n.call().ellipsis() && !args.isEmpty()) {
            int last = args.size() - 1;
            args.set(last, new PyStarred(args.get(last)));
        }
        PyExpr entry = Py.tuple(fun, new PyTuple(args));
        return hoisted.emit(Py.expr(Py.call(Py.attr(fn.captureList(), "append"), entry)));
    }

    @Override
    public List<PyStmt> visit(LabeledStmt n, LoweringContext ctx) {
        log.debug("{}: label '{}' dropped", n.position(), n.label().name());
        return lower(n.stmt(), ctx);
    }

    @Override
    public List<PyStmt> visit(SendStmt n, LoweringContext ctx) {
        Unsupported.report("channel send", n, ctx, log);
        return List.of();
    }

    @Override
    public List<PyStmt> visit(GoStmt n, LoweringContext ctx) {
        Unsupported.report("go statement", n, ctx, log);
        return List.of();
    }

    private ExpressionLowering expressions() {
        return engine.expressions();
    }

    private List<PyStmt> comments(Node node, LoweringContext ctx) {
        if (!ctx.options().attachComments() || ctx.comments().isEmpty()) {
            return List.of();
        }
        CommentIndex index = ctx.comments().get();
        List<PyStmt> result = new ArrayList<>();
        for (CommentGroup group : index.commentsFor(node)) {
            for (String line : group.lines()) {
                result.add(new PyComment(line.isEmpty() ? "" : " " + line));
            }
        }
        return result;
    }

    private static void noteAssigned(Expr target, LoweringContext ctx) {
        if (target == null || AstUtils.isBlank(target)) {
            return;
        }
        if (AstUtils.unparen(target) instanceof Ident ident) {
            GoObject obj = ctx.oracle().objectOf(ident);
            if (obj != null && obj.kind() == ObjectKind.VAR) {
                ctx.noteAssigned(obj);
            }
        }
    }

    private static GoObject builtinOf(CallExpr call, TypeOracle oracle) {
        if (AstUtils.unparen(call.fun()) instanceof Ident ident) {
            GoObject obj = oracle.objectOf(ident);
            if (obj != null && obj.kind() == ObjectKind.BUILTIN) {
                return obj;
            }
        }
        return null;
    }

    private static boolean isFloatingPoint(GoType type) {
        return type != null && type.underlying() instanceof BasicType basic && (basic.isFloat() || basic.isComplex());
    }
}
