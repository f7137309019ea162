package org.gopy.util;

import java.util.Map;

import org.gopy.source.ast.Expr;
import org.gopy.source.ast.Ident;
import org.gopy.source.ast.ParenExpr;
import org.gopy.source.ast.Token;
import org.gopy.target.BinaryOperator;
import org.gopy.target.CmpOperator;

public class AstUtils {

    private static final Map<Token, BinaryOperator> BINARY_OPERATORS = Map.ofEntries(
            Map.entry(Token.ADD, BinaryOperator.ADD),
            Map.entry(Token.SUB, BinaryOperator.SUB),
            Map.entry(Token.MUL, BinaryOperator.MULT),
            Map.entry(Token.QUO, BinaryOperator.DIV),
            Map.entry(Token.REM, BinaryOperator.MOD),
            Map.entry(Token.AND, BinaryOperator.BIT_AND),
            Map.entry(Token.OR, BinaryOperator.BIT_OR),
            Map.entry(Token.XOR, BinaryOperator.BIT_XOR),
            Map.entry(Token.SHL, BinaryOperator.LSHIFT),
            Map.entry(Token.SHR, BinaryOperator.RSHIFT)
    );

    // &^= has no augmented form and is rewritten by the caller
    private static final Map<Token, BinaryOperator> AUGMENTED_OPERATORS = Map.ofEntries(
            Map.entry(Token.ADD_ASSIGN, BinaryOperator.ADD),
            Map.entry(Token.SUB_ASSIGN, BinaryOperator.SUB),
            Map.entry(Token.MUL_ASSIGN, BinaryOperator.MULT),
            Map.entry(Token.QUO_ASSIGN, BinaryOperator.FLOOR_DIV),
            Map.entry(Token.REM_ASSIGN, BinaryOperator.MOD),
            Map.entry(Token.AND_ASSIGN, BinaryOperator.BIT_AND),
            Map.entry(Token.OR_ASSIGN, BinaryOperator.BIT_OR),
            Map.entry(Token.XOR_ASSIGN, BinaryOperator.BIT_XOR),
            Map.entry(Token.SHL_ASSIGN, BinaryOperator.LSHIFT),
            Map.entry(Token.SHR_ASSIGN, BinaryOperator.RSHIFT)
    );

    private static final Map<Token, CmpOperator> COMPARISON_OPERATORS = Map.ofEntries(
            Map.entry(Token.EQL, CmpOperator.EQ),
            Map.entry(Token.NEQ, CmpOperator.NOT_EQ),
            Map.entry(Token.LSS, CmpOperator.LT),
            Map.entry(Token.LEQ, CmpOperator.LT_E),
            Map.entry(Token.GTR, CmpOperator.GT),
            Map.entry(Token.GEQ, CmpOperator.GT_E)
    );

    public static BinaryOperator getBinaryOperator(Token token) {
        BinaryOperator operator = BINARY_OPERATORS.get(token);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown binary operator: " + token.text());
        }
        return operator;
    }

    public static BinaryOperator getAugmentedOperator(Token token) {
        BinaryOperator operator = AUGMENTED_OPERATORS.get(token);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown augmented assignment operator: " + token.text());
        }
        return operator;
    }

    public static boolean isComparison(Token token) {
        return COMPARISON_OPERATORS.containsKey(token);
    }

    public static CmpOperator getComparisonOperator(Token token) {
        CmpOperator operator = COMPARISON_OPERATORS.get(token);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown comparison operator: " + token.text());
        }
        return operator;
    }

    /**
     * The blank identifier {@code _}.
     */
    public static boolean isBlank(Expr expr) {
        return expr instanceof Ident ident && ident.name().equals("_");
    }

    public static Expr unparen(Expr expr) {
        while (expr instanceof ParenExpr paren) {
            expr = paren.x();
        }
        return expr;
    }
}
