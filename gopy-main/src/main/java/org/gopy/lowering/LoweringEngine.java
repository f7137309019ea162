package org.gopy.lowering;

import java.util.function.Function;

import org.gopy.lowering.expr.BasicExpressionLowering;

/**
 * Wires statement, declaration and expression lowering together. The three call into each
 * other (function literals are declarations inside expressions, declaration statements are
 * statements), so each receives the engine rather than its peers.
 */
public class LoweringEngine {

    private final StatementLowering statements;
    private final DeclarationLowering declarations;
    private final ExpressionLowering expressions;

    public LoweringEngine() {
        this(BasicExpressionLowering::new);
    }

    public LoweringEngine(Function<LoweringEngine, ExpressionLowering> expressionFactory) {
        this.statements = new StatementLowering(this);
        this.declarations = new DeclarationLowering(this);
        this.expressions = expressionFactory.apply(this);
    }

    public StatementLowering statements() {
        return statements;
    }

    public DeclarationLowering declarations() {
        return declarations;
    }

    public ExpressionLowering expressions() {
        return expressions;
    }
}
