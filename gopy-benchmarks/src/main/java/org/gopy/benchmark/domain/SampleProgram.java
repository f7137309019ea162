package org.gopy.benchmark.domain;

import java.util.List;

import org.gopy.source.ResolvedTreeBuilder;
import org.gopy.source.ast.ArrayTypeExpr;
import org.gopy.source.ast.CommentGroup;
import org.gopy.source.ast.CommentMap;
import org.gopy.source.ast.FieldList;
import org.gopy.source.ast.FuncDecl;
import org.gopy.source.ast.GenDecl;
import org.gopy.source.ast.LitKind;
import org.gopy.source.ast.SourceFile;
import org.gopy.source.ast.StarExpr;
import org.gopy.source.ast.Stmt;
import org.gopy.source.ast.StructTypeExpr;
import org.gopy.source.ast.Token;
import org.gopy.source.types.BasicType;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.NamedType;
import org.gopy.source.types.PointerType;
import org.gopy.source.types.SliceType;
import org.gopy.source.types.StructType;
import org.gopy.source.types.TypeInfo;

/**
 * A small resolved package with a struct, a method, a range loop, a value switch and a
 * deferred call:
 *
 * <pre>
 * type Account struct { Owner string; Balance float64 }
 * func (a *Account) Deposit(amount float64) { a.Balance += amount }
 * var fee = 2
 * func Total(xs []float64) (sum float64) { for _, x := range xs { sum += x }; return }
 * func Tier(n int) string { switch n { case 0: return "none"; case 1: return "one"; default: return "many" } }
 * func Settle(a *Account) { defer a.Deposit(1.5); fee++ }
 * </pre>
 */
public final class SampleProgram {

    private final TypeInfo info = new TypeInfo();
    private final List<SourceFile> files;
    private final FuncDecl total;

    public SampleProgram() {
        ResolvedTreeBuilder accounts = new ResolvedTreeBuilder(info, "account.go");
        ResolvedTreeBuilder ledger = new ResolvedTreeBuilder(info, "ledger.go");

        GoObject owner = GoObject.field("Owner", BasicType.STRING);
        GoObject balance = GoObject.field("Balance", BasicType.FLOAT64);
        StructType struct = new StructType(List.of(owner, balance));
        NamedType account = NamedType.declare("Account", struct, true);

        GoObject a = GoObject.localVar("a", new PointerType(account));
        GoObject amount = GoObject.localVar("amount", BasicType.FLOAT64);
        GoObject deposit = GoObject.method("Deposit",
                ResolvedTreeBuilder.signature(List.of(BasicType.FLOAT64), List.of()));
        account.addMethod(deposit);

        GenDecl accountDecl = accounts.typeDecl(CommentGroup.of("// Account holds a balance."),
                accounts.def(account.obj()),
                accounts.typed(new StructTypeExpr(accounts.pos(), FieldList.EMPTY), struct));
        FuncDecl depositDecl = accounts.funcDecl(null,
                accounts.field(new StarExpr(accounts.pos(), accounts.typeName(account)), accounts.def(a)),
                accounts.def(deposit),
                accounts.funcType(FieldList.of(accounts.field(accounts.predeclared("float64"), accounts.def(amount))), null),
                accounts.assign(List.of(accounts.select(accounts.use(a), balance)), Token.ADD_ASSIGN,
                        List.of(accounts.use(amount))));

        GoObject fee = GoObject.packageVar("fee", BasicType.INT);
        GenDecl feeDecl = ledger.varDecl(ledger.valueSpec(List.of(ledger.def(fee)), null, ledger.intLit(2)));

        GoObject xs = GoObject.localVar("xs", new SliceType(BasicType.FLOAT64));
        GoObject x = GoObject.localVar("x", BasicType.FLOAT64);
        GoObject sum = GoObject.localVar("sum", BasicType.FLOAT64);
        GoObject totalFunc = GoObject.func("Total",
                ResolvedTreeBuilder.signature(List.of(new SliceType(BasicType.FLOAT64)), List.of(BasicType.FLOAT64)));
        Stmt loop = ledger.range(ledger.blank(), ledger.def(x), ledger.use(xs),
                ledger.assign(List.of(ledger.use(sum)), Token.ADD_ASSIGN, List.of(ledger.use(x))));
        total = ledger.funcDecl(CommentGroup.of("// Total adds up xs."), null, ledger.def(totalFunc),
                ledger.funcType(
                        FieldList.of(ledger.field(ledger.typed(new ArrayTypeExpr(ledger.pos(), null,
                                ledger.predeclared("float64")), new SliceType(BasicType.FLOAT64)), ledger.def(xs))),
                        FieldList.of(ledger.field(ledger.predeclared("float64"), ledger.def(sum)))),
                loop,
                ledger.ret());

        GoObject n = GoObject.localVar("n", BasicType.INT);
        GoObject tier = GoObject.func("Tier",
                ResolvedTreeBuilder.signature(List.of(BasicType.INT), List.of(BasicType.STRING)));
        FuncDecl tierDecl = ledger.funcDecl(null, null, ledger.def(tier),
                ledger.funcType(FieldList.of(ledger.field(ledger.predeclared("int"), ledger.def(n))),
                        FieldList.of(ledger.field(ledger.predeclared("string")))),
                ledger.switchStmt(ledger.use(n),
                        ledger.caseClause(List.of(ledger.intLit(0)), ledger.ret(ledger.stringLit("none"))),
                        ledger.caseClause(List.of(ledger.intLit(1)), ledger.ret(ledger.stringLit("one"))),
                        ledger.defaultClause(ledger.ret(ledger.stringLit("many")))));

        GoObject target = GoObject.localVar("a", new PointerType(account));
        GoObject settle = GoObject.func("Settle",
                ResolvedTreeBuilder.signature(List.of(new PointerType(account)), List.of()));
        Stmt bump = ledger.inc(ledger.use(fee));
        FuncDecl settleDecl = ledger.funcDecl(null, null, ledger.def(settle),
                ledger.funcType(FieldList.of(ledger.field(
                        new StarExpr(ledger.pos(), ledger.typeName(account)), ledger.def(target))), null),
                ledger.defer(ledger.call(ledger.select(ledger.use(target), deposit),
                        ledger.literal(LitKind.FLOAT, "1.5", BasicType.UNTYPED_FLOAT))),
                bump);
        CommentMap ledgerComments = new CommentMap().attach(bump, CommentGroup.of("// one fee per settlement"));

        files = List.of(
                new SourceFile("account.go", "bank", List.of(accountDecl, depositDecl), null),
                new SourceFile("ledger.go", "bank", List.of(feeDecl, total, tierDecl, settleDecl), ledgerComments));
    }

    public TypeInfo info() {
        return info;
    }

    public List<SourceFile> files() {
        return files;
    }

    /**
     * The {@code Total} declaration on its own.
     */
    public FuncDecl total() {
        return total;
    }
}
