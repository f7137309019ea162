package org.gopy.lowering;

import java.util.Arrays;
import java.util.List;

import org.gopy.LoweringException;
import org.gopy.LoweringOptions;
import org.gopy.UnresolvedSymbolException;
import org.gopy.UnsupportedConstructException;
import org.gopy.source.ResolvedTreeBuilder;
import org.gopy.source.ast.CommentGroup;
import org.gopy.source.ast.Decl;
import org.gopy.source.ast.Ellipsis;
import org.gopy.source.ast.Expr;
import org.gopy.source.ast.FieldList;
import org.gopy.source.ast.FuncDecl;
import org.gopy.source.ast.Ident;
import org.gopy.source.ast.InterfaceTypeExpr;
import org.gopy.source.ast.MapTypeExpr;
import org.gopy.source.ast.StarExpr;
import org.gopy.source.ast.StructTypeExpr;
import org.gopy.source.ast.Token;
import org.gopy.source.types.BasicType;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.InterfaceType;
import org.gopy.source.types.MapType;
import org.gopy.source.types.NamedType;
import org.gopy.source.types.PointerType;
import org.gopy.source.types.SignatureType;
import org.gopy.source.types.SliceType;
import org.gopy.source.types.StructType;
import org.gopy.source.types.TypeInfo;
import org.gopy.source.types.Universe;
import org.gopy.target.BinaryOperator;
import org.gopy.target.CmpOperator;
import org.gopy.target.Py;
import org.gopy.target.PyArg;
import org.gopy.target.PyArguments;
import org.gopy.target.PyAugAssign;
import org.gopy.target.PyBinOp;
import org.gopy.target.PyCall;
import org.gopy.target.PyClassDef;
import org.gopy.target.PyConstant;
import org.gopy.target.PyDocString;
import org.gopy.target.PyFor;
import org.gopy.target.PyFunctionDef;
import org.gopy.target.PyGlobal;
import org.gopy.target.PyIfExp;
import org.gopy.target.PyList;
import org.gopy.target.PyReturn;
import org.gopy.target.PyStarred;
import org.gopy.target.PyStmt;
import org.gopy.target.PyTry;
import org.gopy.target.PyTuple;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeclarationLoweringTest {

    private static final LoweringOptions OPTIONS = new LoweringOptions(true, true, false, "self");
    private static final SignatureType NO_ARGS = ResolvedTreeBuilder.signature(List.of(), List.of());

    private final TypeInfo info = new TypeInfo();
    private final ResolvedTreeBuilder b = new ResolvedTreeBuilder(info);
    private final LoweringEngine engine = new LoweringEngine();
    private final FileContext file = new FileContext(info, OPTIONS);

    private List<LoweredDecl> lower(Decl decl) {
        return engine.declarations().lower(decl, file);
    }

    private LoweredDecl lowerOne(Decl decl) {
        List<LoweredDecl> lowered = lower(decl);
        assertThat(lowered).hasSize(1);
        return lowered.get(0);
    }

    private Expr structExpr(StructType type) {
        return b.typed(new StructTypeExpr(b.pos(), FieldList.EMPTY), type);
    }

    private static PyArguments args(String... names) {
        return new PyArguments(Arrays.stream(names).map(PyArg::new).toList(), null, List.of());
    }

    // ── type declarations ─────────────────────────────────────────────────

    @Test
    void struct_becomesClassWithInit() {
        NamedType vec = NamedType.declare("Vec", new StructType(List.of()), true);
        StructType struct = new StructType(List.of(
                GoObject.field("X", BasicType.INT),
                GoObject.field("Label", BasicType.STRING),
                GoObject.field("Pos", vec)));
        NamedType point = NamedType.declare("Point", struct, true);

        LoweredDecl decl = lowerOne(b.typeDecl(CommentGroup.of("// Point is a location."),
                b.def(point.obj()), structExpr(struct)));

        PyFunctionDef init = new PyFunctionDef("__init__",
                new PyArguments(List.of(new PyArg("self"), new PyArg("X"), new PyArg("Label"), new PyArg("Pos")), null,
                        List.of(Py.num(0), Py.str("\"\""), PyConstant.NONE)),
                List.of(
                        Py.assign(Py.attr(Py.name("self"), "X"), Py.name("X")),
                        Py.assign(Py.attr(Py.name("self"), "Label"), Py.name("Label")),
                        Py.assign(Py.attr(Py.name("self"), "Pos"), new PyIfExp(
                                Py.compare(Py.name("Pos"), CmpOperator.IS_NOT, PyConstant.NONE),
                                Py.name("Pos"),
                                Py.call(Py.name("Vec"))))));
        assertThat(decl.kind()).isEqualTo(LoweredDecl.Kind.CLASS);
        assertThat(decl.stmt()).isEqualTo(new PyClassDef("Point", List.of(),
                List.of(new PyDocString(List.of("Point is a location.")), init)));
    }

    @Test
    void emptyStruct_hasPassBody() {
        StructType struct = new StructType(List.of());
        NamedType empty = NamedType.declare("Empty", struct, true);

        assertThat(lowerOne(b.typeDecl(null, b.def(empty.obj()), structExpr(struct))).stmt())
                .isEqualTo(new PyClassDef("Empty", List.of(), List.of(Py.PASS)));
    }

    @Test
    void struct_fieldNamedLikeReceiver_getsFreshReceiver() {
        StructType struct = new StructType(List.of(GoObject.field("self", BasicType.INT)));
        NamedType odd = NamedType.declare("Odd", struct, true);

        PyClassDef cls = (PyClassDef) lowerOne(b.typeDecl(null, b.def(odd.obj()), structExpr(struct))).stmt();
        PyFunctionDef init = (PyFunctionDef) cls.body().get(0);

        assertThat(init.args().names()).containsExactly("self_1", "self");
        assertThat(init.body()).containsExactly(Py.assign(Py.attr(Py.name("self_1"), "self"), Py.name("self")));
    }

    @Test
    void struct_keywordFieldIsEscaped() {
        StructType struct = new StructType(List.of(GoObject.field("from", BasicType.STRING)));
        NamedType edge = NamedType.declare("Edge", struct, true);

        PyClassDef cls = (PyClassDef) lowerOne(b.typeDecl(null, b.def(edge.obj()), structExpr(struct))).stmt();

        assertThat(((PyFunctionDef) cls.body().get(0)).args().names()).containsExactly("self", "from_");
    }

    @Test
    void struct_docStringsCanBeDisabled() {
        StructType struct = new StructType(List.of());
        NamedType plain = NamedType.declare("Plain", struct, true);
        FileContext noDocs = new FileContext(info, OPTIONS.toBuilder().emitDocStrings(false).build());

        List<LoweredDecl> lowered = engine.declarations().lower(
                b.typeDecl(CommentGroup.of("// Plain is plain."), b.def(plain.obj()), structExpr(struct)), noDocs);

        assertThat(lowered.get(0).stmt()).isEqualTo(new PyClassDef("Plain", List.of(), List.of(Py.PASS)));
    }

    @Test
    void basicUnderlying_wrapsSingleValueField() {
        NamedType celsius = NamedType.declare("Celsius", BasicType.FLOAT64, true);

        assertThat(lowerOne(b.typeDecl(null, b.def(celsius.obj()), b.predeclared("float64"))).stmt()).isEqualTo(
                new PyClassDef("Celsius", List.of(), List.of(new PyFunctionDef("__init__",
                        new PyArguments(List.of(new PyArg("self"), new PyArg("value")), null, List.of(Py.num("0.0"))),
                        List.of(Py.assign(Py.attr(Py.name("self"), "value"), Py.name("value")))))));
    }

    @Test
    void namedUnderlying_bindsName() {
        NamedType celsius = NamedType.declare("Celsius", BasicType.FLOAT64, true);
        NamedType temp = NamedType.declare("Temp", BasicType.FLOAT64, true);

        LoweredDecl decl = lowerOne(b.typeDecl(null, b.def(temp.obj()), b.typeName(celsius)));

        assertThat(decl.kind()).isEqualTo(LoweredDecl.Kind.TYPE_BINDING);
        assertThat(decl.stmt()).isEqualTo(Py.assign(Py.name("Temp"), Py.name("Celsius")));
    }

    @Test
    void interfaceAndMapTypes_areDropped() {
        NamedType shape = NamedType.declare("Shape", InterfaceType.EMPTY, true);
        MapType index = new MapType(BasicType.STRING, BasicType.INT);
        NamedType lookup = NamedType.declare("Lookup", index, true);
        NamedType failure = NamedType.declare("Failure", Universe.ERROR.underlying(), true);

        assertThat(lower(b.typeDecl(null, b.def(shape.obj()),
                b.typed(new InterfaceTypeExpr(b.pos(), FieldList.EMPTY), InterfaceType.EMPTY)))).isEmpty();
        assertThat(lower(b.typeDecl(null, b.def(lookup.obj()),
                b.typed(new MapTypeExpr(b.pos(), b.predeclared("string"), b.predeclared("int")), index)))).isEmpty();
        assertThat(lower(b.typeDecl(null, b.def(failure.obj()), b.typeName(Universe.ERROR)))).isEmpty();
    }

    @Test
    void droppedType_strictModeThrows() {
        NamedType shape = NamedType.declare("Shape", InterfaceType.EMPTY, true);
        FileContext strict = new FileContext(info, OPTIONS.toBuilder().strictUnsupported(true).build());
        Decl decl = b.typeDecl(null, b.def(shape.obj()),
                b.typed(new InterfaceTypeExpr(b.pos(), FieldList.EMPTY), InterfaceType.EMPTY));

        assertThatThrownBy(() -> engine.declarations().lower(decl, strict))
                .isInstanceOf(UnsupportedConstructException.class);
    }

    @Test
    void pointerType_throws() {
        PointerType ptr = new PointerType(BasicType.INT);
        NamedType ref = NamedType.declare("Ref", ptr, true);

        assertThatThrownBy(() -> lower(b.typeDecl(null, b.def(ref.obj()),
                b.typed(new StarExpr(b.pos(), b.predeclared("int")), ptr))))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("unknown type declaration");
    }

    // ── functions ─────────────────────────────────────────────────────────

    @Test
    void function_parametersAndReturn() {
        GoObject a = GoObject.localVar("a", BasicType.INT);
        GoObject c = GoObject.localVar("b", BasicType.INT);
        GoObject add = GoObject.func("add",
                ResolvedTreeBuilder.signature(List.of(BasicType.INT, BasicType.INT), List.of(BasicType.INT)));

        LoweredDecl decl = lowerOne(b.funcDecl(null, null, b.def(add),
                b.funcType(FieldList.of(b.field(b.predeclared("int"), b.def(a), b.def(c))),
                        FieldList.of(b.field(b.predeclared("int")))),
                b.ret(b.binary(b.use(a), Token.ADD, b.use(c)))));

        assertThat(decl.kind()).isEqualTo(LoweredDecl.Kind.FUNCTION);
        assertThat(decl.stmt()).isEqualTo(new PyFunctionDef("add", args("a", "b"),
                List.of(new PyReturn(new PyBinOp(Py.name("a"), BinaryOperator.ADD, Py.name("b"))))));
    }

    @Test
    void function_emptyBodyIsPass() {
        GoObject noop = GoObject.func("noop", NO_ARGS);

        assertThat(lowerOne(b.funcDecl(null, null, b.def(noop), b.funcType(FieldList.EMPTY, null))).stmt())
                .isEqualTo(new PyFunctionDef("noop", PyArguments.NONE, List.of(Py.PASS)));
    }

    @Test
    void function_variadicParameterBecomesVararg() {
        GoObject xs = GoObject.localVar("xs", new SliceType(BasicType.INT));
        GoObject sum = GoObject.func("sum", NO_ARGS);

        PyFunctionDef def = (PyFunctionDef) lowerOne(b.funcDecl(null, null, b.def(sum),
                b.funcType(FieldList.of(b.field(new Ellipsis(b.pos(), b.predeclared("int")), b.def(xs))), null))).stmt();

        assertThat(def.args()).isEqualTo(new PyArguments(List.of(), "xs", List.of()));
    }

    @Test
    void function_blankParametersGetDistinctNames() {
        GoObject f = GoObject.func("f", NO_ARGS);

        PyFunctionDef def = (PyFunctionDef) lowerOne(b.funcDecl(null, null, b.def(f),
                b.funcType(FieldList.of(b.field(b.predeclared("int"), b.blank(), b.blank()),
                        b.field(b.predeclared("string"))), null))).stmt();

        assertThat(def.args().names()).containsExactly("arg_1", "arg_2", "arg_3");
    }

    @Test
    void function_namedResultsAreInitializedAndReturned() {
        GoObject n = GoObject.localVar("n", BasicType.INT);
        GoObject err = GoObject.localVar("err", Universe.ERROR);
        GoObject parse = GoObject.func("parse", NO_ARGS);

        PyFunctionDef def = (PyFunctionDef) lowerOne(b.funcDecl(null, null, b.def(parse),
                b.funcType(FieldList.EMPTY, FieldList.of(
                        b.field(b.predeclared("int"), b.def(n)),
                        b.field(b.typeName(Universe.ERROR), b.def(err)))),
                b.ret())).stmt();

        assertThat(def.body()).containsExactly(
                Py.assign(Py.name("n"), Py.num(0)),
                Py.assign(Py.name("err"), PyConstant.NONE),
                new PyReturn(Py.tuple(Py.name("n"), Py.name("err"))));
    }

    @Test
    void function_docStringComesFirst() {
        GoObject run = GoObject.func("run", NO_ARGS);
        GoObject counter = GoObject.packageVar("counter", BasicType.INT);

        PyFunctionDef def = (PyFunctionDef) lowerOne(b.funcDecl(CommentGroup.of("// run bumps the counter."), null,
                b.def(run), b.funcType(FieldList.EMPTY, null), b.inc(b.use(counter)))).stmt();

        assertThat(def.body()).containsExactly(
                new PyDocString(List.of("run bumps the counter.")),
                new PyGlobal(List.of("counter")),
                new PyAugAssign(Py.name("counter"), BinaryOperator.ADD, Py.num(1)));
    }

    @Test
    void function_defersUnwindInReverseOrder() {
        GoObject first = GoObject.func("first", NO_ARGS);
        GoObject second = GoObject.func("second", NO_ARGS);
        GoObject cleanup = GoObject.func("cleanup", NO_ARGS);

        PyFunctionDef def = (PyFunctionDef) lowerOne(b.funcDecl(null, null, b.def(cleanup),
                b.funcType(FieldList.EMPTY, null),
                b.defer(b.call(b.use(first))),
                b.defer(b.call(b.use(second))))).stmt();

        PyStmt pushFirst = Py.expr(Py.call(Py.attr(Py.name("defers_1"), "append"),
                Py.tuple(Py.name("first"), new PyTuple(List.of()))));
        PyStmt pushSecond = Py.expr(Py.call(Py.attr(Py.name("defers_1"), "append"),
                Py.tuple(Py.name("second"), new PyTuple(List.of()))));
        PyFor unwind = new PyFor(Py.tuple(Py.name("fun_1"), Py.name("args_1")),
                Py.call(Py.REVERSED, Py.name("defers_1")),
                List.of(Py.expr(new PyCall(Py.name("fun_1"), List.of(new PyStarred(Py.name("args_1"))), List.of()))));
        assertThat(def.body()).containsExactly(
                Py.assign(Py.name("defers_1"), new PyList(List.of())),
                new PyTry(List.of(pushFirst, pushSecond), List.of(), List.of(unwind)));
    }

    @Test
    void function_deferInsideFunctionLiteral_staysWithTheLiteral() {
        GoObject release = GoObject.func("release", NO_ARGS);
        GoObject cleanup = GoObject.localVar("cleanup", NO_ARGS);
        GoObject outer = GoObject.func("outer", NO_ARGS);

        PyFunctionDef def = (PyFunctionDef) lowerOne(b.funcDecl(null, null, b.def(outer),
                b.funcType(FieldList.EMPTY, null),
                b.define(b.def(cleanup), b.funcLit(b.funcType(FieldList.EMPTY, null), NO_ARGS,
                        b.defer(b.call(b.use(release))))))).stmt();

        assertThat(def.body()).hasSize(2).noneMatch(PyTry.class::isInstance);
        assertThat(def.body().get(1)).isEqualTo(Py.assign(Py.name("cleanup"), Py.name("func_1")));
        PyFunctionDef literal = (PyFunctionDef) def.body().get(0);
        assertThat(literal.name()).isEqualTo("func_1");
        assertThat(literal.body().get(0)).isEqualTo(Py.assign(Py.name("defers_1"), new PyList(List.of())));
        assertThat(literal.body().get(1)).isInstanceOf(PyTry.class);
    }

    @Test
    void function_unresolvedNameThrows() {
        FuncDecl ghost = b.funcDecl(null, null, new Ident(b.pos(), "ghost"), b.funcType(FieldList.EMPTY, null));

        assertThatThrownBy(() -> lower(ghost))
                .isInstanceOf(UnresolvedSymbolException.class)
                .satisfies(e -> assertThat(((UnresolvedSymbolException) e).getIdentifier()).isEqualTo("ghost"));
    }

    // ── methods ───────────────────────────────────────────────────────────

    @Test
    void method_pointerReceiverNamesOwner() {
        GoObject x = GoObject.field("X", BasicType.INT);
        NamedType point = NamedType.declare("Point", new StructType(List.of(x)), true);
        GoObject p = GoObject.localVar("p", new PointerType(point));
        GoObject dx = GoObject.localVar("dx", BasicType.INT);
        GoObject move = GoObject.method("Move", ResolvedTreeBuilder.signature(List.of(BasicType.INT), List.of()));

        LoweredDecl decl = lowerOne(b.funcDecl(null,
                b.field(new StarExpr(b.pos(), b.typeName(point)), b.def(p)),
                b.def(move),
                b.funcType(FieldList.of(b.field(b.predeclared("int"), b.def(dx))), null),
                b.assign(List.of(b.select(b.use(p), x)), Token.ADD_ASSIGN, List.of(b.use(dx)))));

        assertThat(decl.kind()).isEqualTo(LoweredDecl.Kind.METHOD);
        assertThat(decl.owner()).contains("Point");
        assertThat(decl.stmt()).isEqualTo(new PyFunctionDef("Move", args("p", "dx"),
                List.of(new PyAugAssign(Py.attr(Py.name("p"), "X"), BinaryOperator.ADD, Py.name("dx")))));
    }

    @Test
    void method_unnamedReceiverUsesConfiguredName() {
        NamedType point = NamedType.declare("Point", new StructType(List.of()), true);
        GoObject reset = GoObject.method("Reset", NO_ARGS);
        FileContext ctx = new FileContext(info, OPTIONS.toBuilder().receiverName("this").build());

        List<LoweredDecl> lowered = engine.declarations().lower(b.funcDecl(null, b.field(b.typeName(point)),
                b.def(reset), b.funcType(FieldList.EMPTY, null)), ctx);

        assertThat(((PyFunctionDef) lowered.get(0).stmt()).args().names()).containsExactly("this");
    }

    @Test
    void method_multipleReceiversThrow() {
        NamedType point = NamedType.declare("Point", new StructType(List.of()), true);
        GoObject p = GoObject.localVar("p", point);
        GoObject q = GoObject.localVar("q", point);
        GoObject m = GoObject.method("M", NO_ARGS);

        assertThatThrownBy(() -> lower(b.funcDecl(null, b.field(b.typeName(point), b.def(p), b.def(q)),
                b.def(m), b.funcType(FieldList.EMPTY, null))))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("multiple receivers");
    }

    @Test
    void method_unknownReceiverTypeThrows() {
        MapType counts = new MapType(BasicType.STRING, BasicType.INT);
        GoObject m = GoObject.method("M", NO_ARGS);
        Expr receiverType = b.typed(new MapTypeExpr(b.pos(), b.predeclared("string"), b.predeclared("int")), counts);

        assertThatThrownBy(() -> lower(b.funcDecl(null, b.field(receiverType), b.def(m), b.funcType(FieldList.EMPTY, null))))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("unknown receiver type: MapTypeExpr");
    }

    // ── values ────────────────────────────────────────────────────────────

    @Test
    void packageVariable_isValueDecl() {
        GoObject limit = GoObject.packageVar("limit", BasicType.INT);

        LoweredDecl decl = lowerOne(b.varDecl(b.valueSpec(List.of(b.def(limit)), null, b.intLit(10))));

        assertThat(decl.kind()).isEqualTo(LoweredDecl.Kind.VALUE);
        assertThat(decl.stmt()).isEqualTo(Py.assign(Py.name("limit"), Py.num(10)));
    }

    @Test
    void valueCountMismatch_throws() {
        GoObject a = GoObject.packageVar("a", BasicType.INT);
        GoObject c = GoObject.packageVar("c", BasicType.INT);
        GoObject d = GoObject.packageVar("d", BasicType.INT);

        assertThatThrownBy(() -> lower(b.varDecl(b.valueSpec(List.of(b.def(a), b.def(c), b.def(d)), null,
                b.intLit(1), b.intLit(2)))))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("declaration count mismatch");
    }
}
