package org.gopy.lowering.expr;

import java.util.List;

import org.gopy.LoweringException;
import org.gopy.LoweringOptions;
import org.gopy.UnresolvedSymbolException;
import org.gopy.lowering.FileContext;
import org.gopy.lowering.LoweredExpr;
import org.gopy.lowering.LoweringEngine;
import org.gopy.source.ResolvedTreeBuilder;
import org.gopy.source.ast.ArrayTypeExpr;
import org.gopy.source.ast.CallExpr;
import org.gopy.source.ast.Expr;
import org.gopy.source.ast.FieldList;
import org.gopy.source.ast.Ident;
import org.gopy.source.ast.MapTypeExpr;
import org.gopy.source.ast.SliceExpr;
import org.gopy.source.ast.Token;
import org.gopy.source.types.ArrayType;
import org.gopy.source.types.BasicType;
import org.gopy.source.types.ChanType;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.InterfaceType;
import org.gopy.source.types.MapType;
import org.gopy.source.types.NamedType;
import org.gopy.source.types.PointerType;
import org.gopy.source.types.SignatureType;
import org.gopy.source.types.SliceType;
import org.gopy.source.types.StructType;
import org.gopy.source.types.TypeInfo;
import org.gopy.target.BinaryOperator;
import org.gopy.target.BoolOperator;
import org.gopy.target.CmpOperator;
import org.gopy.target.Py;
import org.gopy.target.PyArguments;
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
import org.gopy.target.PyReturn;
import org.gopy.target.PySlice;
import org.gopy.target.PyStarred;
import org.gopy.target.PySubscript;
import org.gopy.target.PyUnaryOp;
import org.gopy.target.UnaryOperator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BasicExpressionLoweringTest {

    private static final LoweringOptions OPTIONS = new LoweringOptions(true, true, false, "self");

    private final TypeInfo info = new TypeInfo();
    private final ResolvedTreeBuilder b = new ResolvedTreeBuilder(info);
    private final LoweringEngine engine = new LoweringEngine();
    private final FileContext file = new FileContext(info, OPTIONS);

    private LoweredExpr lowerWithHoists(Expr expr) {
        return engine.expressions().lower(expr, file);
    }

    private PyExpr lower(Expr expr) {
        LoweredExpr lowered = lowerWithHoists(expr);
        assertThat(lowered.hoisted()).isEmpty();
        return lowered.expr();
    }

    private GoObject intVar(String name) {
        return GoObject.localVar(name, BasicType.INT);
    }

    // ── operators ─────────────────────────────────────────────────────────

    @Test
    void integerDivision_floors() {
        GoObject a = intVar("a");
        GoObject c = intVar("c");

        assertThat(lower(b.binary(b.use(a), Token.QUO, b.use(c))))
                .isEqualTo(new PyBinOp(Py.name("a"), BinaryOperator.FLOOR_DIV, Py.name("c")));
    }

    @Test
    void floatDivision_isTrueDivision() {
        GoObject x = GoObject.localVar("x", BasicType.FLOAT64);
        GoObject y = GoObject.localVar("y", BasicType.FLOAT64);

        assertThat(lower(b.binary(b.use(x), Token.QUO, b.use(y))))
                .isEqualTo(new PyBinOp(Py.name("x"), BinaryOperator.DIV, Py.name("y")));
    }

    @Test
    void arithmeticAndBitwiseOperators() {
        GoObject a = intVar("a");
        GoObject c = intVar("c");

        assertThat(lower(b.binary(b.use(a), Token.REM, b.use(c))))
                .isEqualTo(new PyBinOp(Py.name("a"), BinaryOperator.MOD, Py.name("c")));
        assertThat(lower(b.binary(b.use(a), Token.SHL, b.intLit(2))))
                .isEqualTo(new PyBinOp(Py.name("a"), BinaryOperator.LSHIFT, Py.num(2)));
        assertThat(lower(b.binary(b.use(a), Token.AND_NOT, b.use(c))))
                .isEqualTo(new PyBinOp(Py.name("a"), BinaryOperator.BIT_AND, new PyUnaryOp(UnaryOperator.INVERT, Py.name("c"))));
    }

    @Test
    void logicalOperators_becomeBoolOps() {
        GoObject p = GoObject.localVar("p", BasicType.BOOL);
        GoObject q = GoObject.localVar("q", BasicType.BOOL);

        assertThat(lower(b.binary(b.use(p), Token.LAND, b.unary(Token.NOT, b.use(q))))).isEqualTo(
                new PyBoolOp(BoolOperator.AND, List.of(Py.name("p"), new PyUnaryOp(UnaryOperator.NOT, Py.name("q")))));
        assertThat(lower(b.binary(b.use(p), Token.LOR, b.use(q))))
                .isEqualTo(new PyBoolOp(BoolOperator.OR, List.of(Py.name("p"), Py.name("q"))));
    }

    @Test
    void nilComparisons_useIdentity() {
        GoObject p = GoObject.localVar("p", new PointerType(BasicType.INT));

        assertThat(lower(b.binary(b.use(p), Token.EQL, b.predeclared("nil"))))
                .isEqualTo(Py.compare(Py.name("p"), CmpOperator.IS, PyConstant.NONE));
        assertThat(lower(b.binary(b.predeclared("nil"), Token.NEQ, b.use(p))))
                .isEqualTo(Py.compare(PyConstant.NONE, CmpOperator.IS_NOT, Py.name("p")));
    }

    @Test
    void orderedComparison() {
        GoObject a = intVar("a");

        assertThat(lower(b.binary(b.use(a), Token.LEQ, b.intLit(3))))
                .isEqualTo(Py.compare(Py.name("a"), CmpOperator.LT_E, Py.num(3)));
    }

    @Test
    void unaryOperators() {
        GoObject a = intVar("a");

        assertThat(lower(b.unary(Token.SUB, b.use(a)))).isEqualTo(new PyUnaryOp(UnaryOperator.USUB, Py.name("a")));
        assertThat(lower(b.unary(Token.XOR, b.use(a)))).isEqualTo(new PyUnaryOp(UnaryOperator.INVERT, Py.name("a")));
        assertThat(lower(b.unary(Token.AND, b.use(a)))).isEqualTo(Py.name("a"));
    }

    @Test
    void channelReceive_throws() {
        GoObject ch = GoObject.localVar("ch", new ChanType(BasicType.INT));

        assertThatThrownBy(() -> lower(b.unary(Token.ARROW, b.use(ch))))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("channel receive");
    }

    // ── identifiers ───────────────────────────────────────────────────────

    @Test
    void predeclaredConstants() {
        assertThat(lower(b.predeclared("true"))).isEqualTo(PyConstant.TRUE);
        assertThat(lower(b.predeclared("false"))).isEqualTo(PyConstant.FALSE);
        assertThat(lower(b.predeclared("nil"))).isEqualTo(PyConstant.NONE);
    }

    @Test
    void keywordNamedVariable_isEscaped() {
        assertThat(lower(b.use(GoObject.localVar("lambda", BasicType.INT)))).isEqualTo(Py.name("lambda_"));
    }

    @Test
    void unresolvedIdentifier_throws() {
        assertThatThrownBy(() -> lower(new Ident(b.pos(), "mystery")))
                .isInstanceOf(UnresolvedSymbolException.class)
                .hasMessageContaining("Unable to resolve identifier 'mystery'");
    }

    @Test
    void builtinAsValue() {
        assertThat(lower(b.predeclared("len"))).isEqualTo(Py.LEN);
        assertThatThrownBy(() -> lower(b.predeclared("append")))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("cannot be used as a value");
    }

    @Test
    void packageSelector() {
        GoObject fmt = GoObject.pkg("fmt");
        GoObject println = GoObject.func("Println", ResolvedTreeBuilder.signature(List.of(), List.of()));

        assertThat(lower(b.select(b.use(fmt), println))).isEqualTo(Py.attr(Py.name("fmt"), "Println"));
    }

    // ── indexing ──────────────────────────────────────────────────────────

    @Test
    void mapRead_usesGetWithZeroValue() {
        GoObject m = GoObject.localVar("m", new MapType(BasicType.STRING, BasicType.INT));
        GoObject k = GoObject.localVar("k", BasicType.STRING);

        assertThat(lower(b.index(b.use(m), b.use(k))))
                .isEqualTo(Py.call(Py.attr(Py.name("m"), "get"), Py.name("k"), Py.num(0)));
    }

    @Test
    void mapRead_noneZeroValueIsOmitted() {
        GoObject m = GoObject.localVar("m", new MapType(BasicType.STRING, new PointerType(BasicType.INT)));
        GoObject k = GoObject.localVar("k", BasicType.STRING);

        assertThat(lower(b.index(b.use(m), b.use(k))))
                .isEqualTo(Py.call(Py.attr(Py.name("m"), "get"), Py.name("k")));
    }

    @Test
    void mapIndex_asTargetStaysSubscript() {
        GoObject m = GoObject.localVar("m", new MapType(BasicType.STRING, BasicType.INT));
        GoObject k = GoObject.localVar("k", BasicType.STRING);

        assertThat(engine.expressions().lowerTarget(b.index(b.use(m), b.use(k)), file).expr())
                .isEqualTo(new PySubscript(Py.name("m"), Py.name("k")));
    }

    @Test
    void commaOkMapIndex_hoistsKey() {
        GoObject m = GoObject.localVar("m", new MapType(BasicType.STRING, BasicType.INT));
        GoObject k = GoObject.localVar("k", BasicType.STRING);

        LoweredExpr lowered = lowerWithHoists(b.commaOkIndex(b.use(m), b.use(k)));

        assertThat(lowered.hoisted()).containsExactly(Py.assign(Py.name("key_1"), Py.name("k")));
        assertThat(lowered.expr()).isEqualTo(new PyIfExp(
                Py.compare(Py.name("key_1"), CmpOperator.IN, Py.name("m")),
                Py.tuple(new PySubscript(Py.name("m"), Py.name("key_1")), PyConstant.TRUE),
                Py.tuple(Py.num(0), PyConstant.FALSE)));
    }

    @Test
    void commaOkMapIndex_hoistsComputedMap() {
        MapType table = new MapType(BasicType.STRING, BasicType.INT);
        GoObject registry = GoObject.field("Table", table);
        GoObject r = GoObject.localVar("r", BasicType.INT);

        LoweredExpr lowered = lowerWithHoists(b.commaOkIndex(b.select(b.use(r), registry), b.stringLit("x")));

        assertThat(lowered.hoisted()).containsExactly(
                Py.assign(Py.name("map_1"), Py.attr(Py.name("r"), "Table")),
                Py.assign(Py.name("key_1"), Py.str("\"x\"")));
    }

    @Test
    void stringIndex_yieldsByte() {
        GoObject s = GoObject.localVar("s", BasicType.STRING);

        assertThat(lower(b.index(b.use(s), b.intLit(0))))
                .isEqualTo(Py.call(Py.name("ord"), new PySubscript(Py.name("s"), Py.num(0))));
    }

    @Test
    void sliceExpression_dropsCapacity() {
        GoObject xs = GoObject.localVar("xs", new SliceType(BasicType.INT));

        assertThat(lower(new SliceExpr(b.pos(), b.use(xs), b.intLit(1), null, null)))
                .isEqualTo(new PySubscript(Py.name("xs"), new PySlice(Py.num(1), null, null)));
    }

    // ── type assertions ───────────────────────────────────────────────────

    @Test
    void typeAssertion_withoutCommaOkIsTransparent() {
        GoObject x = GoObject.localVar("x", InterfaceType.EMPTY);

        assertThat(lower(b.typeAssert(b.use(x), b.predeclared("int"), false))).isEqualTo(Py.name("x"));
    }

    @Test
    void commaOkTypeAssertion_checksInstance() {
        GoObject x = GoObject.localVar("x", InterfaceType.EMPTY);

        LoweredExpr lowered = lowerWithHoists(b.typeAssert(b.use(x), b.predeclared("int"), true));

        assertThat(lowered.hoisted()).containsExactly(Py.assign(Py.name("asserted_1"), Py.name("x")));
        assertThat(lowered.expr()).isEqualTo(new PyIfExp(
                Py.call(Py.ISINSTANCE, Py.name("asserted_1"), Py.name("int")),
                Py.tuple(Py.name("asserted_1"), PyConstant.TRUE),
                Py.tuple(Py.num(0), PyConstant.FALSE)));
    }

    @Test
    void commaOkTypeAssertion_toInterfaceChecksMethods() {
        GoObject close = GoObject.method("Close", ResolvedTreeBuilder.signature(List.of(), List.of()));
        GoObject flush = GoObject.method("Flush", ResolvedTreeBuilder.signature(List.of(), List.of()));
        NamedType closer = NamedType.declare("Closer", new InterfaceType(List.of(close, flush)), true);
        GoObject x = GoObject.localVar("x", InterfaceType.EMPTY);

        PyIfExp test = (PyIfExp) lowerWithHoists(b.typeAssert(b.use(x), b.typeName(closer), true)).expr();

        assertThat(test.test()).isEqualTo(new PyBoolOp(BoolOperator.AND, List.of(
                Py.call(Py.HASATTR, Py.name("asserted_1"), Py.str("\"Close\"")),
                Py.call(Py.HASATTR, Py.name("asserted_1"), Py.str("\"Flush\"")))));
        assertThat(test.orelse()).isEqualTo(Py.tuple(PyConstant.NONE, PyConstant.FALSE));
    }

    // ── composite literals ────────────────────────────────────────────────

    @Test
    void structLiteral_keyedFieldsBecomeKeywords() {
        NamedType point = NamedType.declare("Point", new StructType(List.of(
                GoObject.field("X", BasicType.INT), GoObject.field("Y", BasicType.INT))), true);

        assertThat(lower(b.composite(point, b.typeName(point), b.keyValue(new Ident(b.pos(), "Y"), b.intLit(2)))))
                .isEqualTo(new PyCall(Py.name("Point"), List.of(), List.of(new PyKeyword("Y", Py.num(2)))));
    }

    @Test
    void structLiteral_positionalFields() {
        NamedType point = NamedType.declare("Point", new StructType(List.of(
                GoObject.field("X", BasicType.INT), GoObject.field("Y", BasicType.INT))), true);

        assertThat(lower(b.composite(point, b.typeName(point), b.intLit(1), b.intLit(2))))
                .isEqualTo(Py.call(Py.name("Point"), Py.num(1), Py.num(2)));
    }

    @Test
    void anonymousStructLiteral_throws() {
        StructType anon = new StructType(List.of(GoObject.field("X", BasicType.INT)));

        assertThatThrownBy(() -> lower(b.composite(anon, null, b.intLit(1))))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("anonymous struct literal");
    }

    @Test
    void arrayLiteral_padsWithZeroValues() {
        ArrayType triple = new ArrayType(BasicType.INT, 3);

        assertThat(lower(b.composite(triple, null, b.intLit(7))))
                .isEqualTo(new PyList(List.of(Py.num(7), Py.num(0), Py.num(0))));
    }

    @Test
    void namedSliceLiteral_wrapsInClass() {
        NamedType path = NamedType.declare("Path", new SliceType(BasicType.STRING), true);

        assertThat(lower(b.composite(path, b.typeName(path), b.stringLit("a"))))
                .isEqualTo(Py.call(Py.name("Path"), new PyList(List.of(Py.str("\"a\"")))));
    }

    @Test
    void mapLiteral_becomesDict() {
        MapType ages = new MapType(BasicType.STRING, BasicType.INT);

        assertThat(lower(b.composite(ages, null, b.keyValue(b.stringLit("ann"), b.intLit(30)))))
                .isEqualTo(new PyDict(List.of(Py.str("\"ann\"")), List.of(Py.num(30))));
    }

    @Test
    void functionLiteral_isHoistedAsDef() {
        SignatureType sig = ResolvedTreeBuilder.signature(List.of(), List.of(BasicType.INT));

        LoweredExpr lowered = lowerWithHoists(b.funcLit(b.funcType(FieldList.EMPTY, null), sig, b.ret(b.intLit(1))));

        assertThat(lowered.expr()).isEqualTo(Py.name("func_1"));
        assertThat(lowered.hoisted()).containsExactly(
                new PyFunctionDef("func_1", PyArguments.NONE, List.of(new PyReturn(Py.num(1)))));
    }

    // ── calls and builtins ────────────────────────────────────────────────

    @Test
    void call_spreadsVariadicArgument() {
        GoObject sum = GoObject.func("sum", ResolvedTreeBuilder.signature(List.of(), List.of(BasicType.INT)));
        GoObject xs = GoObject.localVar("xs", new SliceType(BasicType.INT));

        assertThat(lower(b.spreadCall(b.use(sum), b.use(xs))))
                .isEqualTo(Py.call(Py.name("sum"), new PyStarred(Py.name("xs"))));
    }

    @Test
    void call_forwardsMultipleResults() {
        GoObject pair = GoObject.func("pair",
                ResolvedTreeBuilder.signature(List.of(), List.of(BasicType.INT, BasicType.INT)));
        GoObject add = GoObject.func("add",
                ResolvedTreeBuilder.signature(List.of(BasicType.INT, BasicType.INT), List.of(BasicType.INT)));

        assertThat(lower(b.call(b.use(add), b.call(b.use(pair)))))
                .isEqualTo(Py.call(Py.name("add"), new PyStarred(Py.call(Py.name("pair")))));
    }

    @Test
    void builtin_lenAndAppend() {
        GoObject xs = GoObject.localVar("xs", new SliceType(BasicType.INT));
        GoObject ys = GoObject.localVar("ys", new SliceType(BasicType.INT));

        assertThat(lower(b.builtinCall("len", BasicType.INT, b.use(xs))))
                .isEqualTo(Py.call(Py.LEN, Py.name("xs")));
        assertThat(lower(b.builtinCall("append", null, b.use(xs), b.intLit(1), b.intLit(2))))
                .isEqualTo(new PyBinOp(Py.name("xs"), BinaryOperator.ADD, new PyList(List.of(Py.num(1), Py.num(2)))));
        assertThat(lower(new CallExpr(b.pos(), b.predeclared("append"),
                List.of(b.use(xs), b.use(ys)), true)))
                .isEqualTo(new PyBinOp(Py.name("xs"), BinaryOperator.ADD, Py.name("ys")));
    }

    @Test
    void builtin_makeSliceAndMap() {
        SliceType ints = new SliceType(BasicType.INT);
        MapType counts = new MapType(BasicType.STRING, BasicType.INT);
        GoObject n = intVar("n");

        assertThat(lower(b.builtinCall("make", ints,
                b.typed(new ArrayTypeExpr(b.pos(), null, b.predeclared("int")), ints), b.use(n))))
                .isEqualTo(new PyListComp(Py.num(0),
                        List.of(new PyComprehension(Py.DISCARD, Py.call(Py.RANGE, Py.name("n"))))));
        assertThat(lower(b.builtinCall("make", counts,
                b.typed(new MapTypeExpr(b.pos(), b.predeclared("string"), b.predeclared("int")), counts))))
                .isEqualTo(new PyDict(List.of(), List.of()));
    }

    @Test
    void builtin_makeSliceWithoutLength_throws() {
        SliceType ints = new SliceType(BasicType.INT);

        assertThatThrownBy(() -> lower(b.builtinCall("make", ints,
                b.typed(new ArrayTypeExpr(b.pos(), null, b.predeclared("int")), ints))))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("needs a length");
    }

    @Test
    void builtin_newBuildsZeroValue() {
        NamedType point = NamedType.declare("Point", new StructType(List.of()), true);

        assertThat(lower(b.builtinCall("new", new PointerType(point), b.typeName(point))))
                .isEqualTo(Py.call(Py.name("Point")));
    }

    @Test
    void builtin_printVariants() {
        GoObject a = intVar("a");

        assertThat(lower(b.builtinCall("print", null, b.use(a)))).isEqualTo(new PyCall(Py.PRINT, List.of(Py.name("a")),
                List.of(new PyKeyword("sep", Py.str("\"\"")), new PyKeyword("end", Py.str("\"\"")))));
        assertThat(lower(b.builtinCall("println", null, b.use(a)))).isEqualTo(Py.call(Py.PRINT, Py.name("a")));
    }

    @Test
    void builtin_complexParts() {
        GoObject z = GoObject.localVar("z", BasicType.COMPLEX128);

        assertThat(lower(b.builtinCall("real", BasicType.FLOAT64, b.use(z)))).isEqualTo(Py.attr(Py.name("z"), "real"));
        assertThat(lower(b.builtinCall("imag", BasicType.FLOAT64, b.use(z)))).isEqualTo(Py.attr(Py.name("z"), "imag"));
    }

    @Test
    void builtin_withoutLowering_throws() {
        GoObject xs = GoObject.localVar("xs", new SliceType(BasicType.INT));
        GoObject ys = GoObject.localVar("ys", new SliceType(BasicType.INT));

        assertThatThrownBy(() -> lower(b.builtinCall("copy", BasicType.INT, b.use(xs), b.use(ys))))
                .isInstanceOf(LoweringException.class)
                .hasMessageContaining("builtin copy has no Python lowering");
    }

    // ── conversions ───────────────────────────────────────────────────────

    @Test
    void conversion_runeToString() {
        GoObject r = GoObject.localVar("r", BasicType.INT32);

        assertThat(lower(b.call(b.predeclared("string"), b.use(r)))).isEqualTo(Py.call(Py.name("chr"), Py.name("r")));
    }

    @Test
    void conversion_numericKinds() {
        GoObject i = intVar("i");
        GoObject f = GoObject.localVar("f", BasicType.FLOAT64);

        assertThat(lower(b.call(b.predeclared("float64"), b.use(i)))).isEqualTo(Py.call(Py.name("float"), Py.name("i")));
        assertThat(lower(b.call(b.predeclared("int"), b.use(f)))).isEqualTo(Py.call(Py.name("int"), Py.name("f")));
        assertThat(lower(b.call(b.predeclared("int64"), b.use(i)))).isEqualTo(Py.name("i"));
    }

    @Test
    void conversion_stringToByteAndRuneSlices() {
        GoObject s = GoObject.localVar("s", BasicType.STRING);
        SliceType bytes = new SliceType(BasicType.UINT8);
        SliceType runes = new SliceType(BasicType.INT32);

        assertThat(lower(b.call(b.typed(new ArrayTypeExpr(b.pos(), null, b.predeclared("byte")), bytes), b.use(s))))
                .isEqualTo(Py.call(Py.name("list"), Py.call(Py.attr(Py.name("s"), "encode"))));
        assertThat(lower(b.call(b.typed(new ArrayTypeExpr(b.pos(), null, b.predeclared("rune")), runes), b.use(s))))
                .isEqualTo(Py.call(Py.name("list"), Py.call(Py.name("map"), Py.name("ord"), Py.name("s"))));
    }

    @Test
    void conversion_bytesToString() {
        GoObject bs = GoObject.localVar("bs", new SliceType(BasicType.UINT8));

        assertThat(lower(b.call(b.predeclared("string"), b.use(bs))))
                .isEqualTo(Py.call(Py.attr(Py.call(Py.name("bytes"), Py.name("bs")), "decode")));
    }

    @Test
    void conversion_toNamedTypeWrapsValue() {
        NamedType celsius = NamedType.declare("Celsius", BasicType.FLOAT64, true);
        GoObject f = GoObject.localVar("f", BasicType.FLOAT64);

        assertThat(lower(b.call(b.typeName(celsius), b.use(f)))).isEqualTo(Py.call(Py.name("Celsius"), Py.name("f")));
    }

    // ── type expressions ──────────────────────────────────────────────────

    @Test
    void typeExpr_runtimeClasses() {
        NamedType point = NamedType.declare("Point", new StructType(List.of()), true);

        assertThat(engine.expressions().typeExpr(BasicType.STRING, file)).isEqualTo(Py.name("str"));
        assertThat(engine.expressions().typeExpr(new PointerType(point), file)).isEqualTo(Py.name("Point"));
        assertThat(engine.expressions().typeExpr(new MapType(BasicType.STRING, BasicType.INT), file)).isEqualTo(Py.name("dict"));
        assertThatThrownBy(() -> engine.expressions().typeExpr(new ChanType(BasicType.INT), file))
                .isInstanceOf(LoweringException.class);
    }
}
