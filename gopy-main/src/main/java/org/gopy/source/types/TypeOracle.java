package org.gopy.source.types;

import org.gopy.source.ast.CaseClause;
import org.gopy.source.ast.Expr;
import org.gopy.source.ast.Ident;

/**
 * Type and symbol facts computed by the type checker. Lowering only ever reads from it.
 */
public interface TypeOracle {

    /**
     * The resolved type of an expression (including type expressions), or null if unknown.
     */
    GoType typeOf(Expr expr);

    /**
     * The object an identifier defines or refers to, or null for the blank identifier and
     * unresolved names.
     */
    GoObject objectOf(Ident ident);

    /**
     * The per-clause variable a type switch with a binding declares implicitly in the clause.
     */
    GoObject implicitOf(CaseClause clause);
}
