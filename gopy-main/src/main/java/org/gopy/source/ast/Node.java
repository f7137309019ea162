package org.gopy.source.ast;

import org.gopy.source.ast.visitor.GoGenericVisitor;

/**
 * A node of the resolved Go syntax tree. Nodes are immutable; resolution facts about them live
 * in the {@link org.gopy.source.types.TypeOracle}, keyed by node identity.
 */
public interface Node {

    Position position();

    <R, A> R accept(GoGenericVisitor<R, A> v, A arg);

    /**
     * Short description of the node's shape for diagnostics, e.g. {@code RangeStmt}.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
