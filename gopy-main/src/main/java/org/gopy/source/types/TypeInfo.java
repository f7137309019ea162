package org.gopy.source.types;

import org.gopy.source.ast.CaseClause;
import org.gopy.source.ast.Expr;
import org.gopy.source.ast.Ident;
import org.gopy.source.ast.ParenExpr;

import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable {@link TypeOracle} filled in while a resolved tree is built. All maps are keyed by
 * node identity.
 */
public class TypeInfo implements TypeOracle {

    private final Map<Expr, GoType> types = new IdentityHashMap<>();
    private final Map<Ident, GoObject> defs = new IdentityHashMap<>();
    private final Map<Ident, GoObject> uses = new IdentityHashMap<>();
    private final Map<CaseClause, GoObject> implicits = new IdentityHashMap<>();
    private final Set<GoObject> definitionOrder = new LinkedHashSet<>();

    public void recordType(Expr expr, GoType type) {
        types.put(expr, type);
    }

    public void recordDef(Ident ident, GoObject obj) {
        defs.put(ident, obj);
        if (obj != null) {
            definitionOrder.add(obj);
        }
    }

    public void recordUse(Ident ident, GoObject obj) {
        uses.put(ident, obj);
    }

    public void recordImplicit(CaseClause clause, GoObject obj) {
        implicits.put(clause, obj);
    }

    @Override
    public GoType typeOf(Expr expr) {
        GoType type = types.get(expr);
        if (type != null) {
            return type;
        }
        if (expr instanceof Ident ident) {
            GoObject obj = objectOf(ident);
            return obj == null ? null : obj.type();
        }
        if (expr instanceof ParenExpr paren) {
            return typeOf(paren.x());
        }
        return null;
    }

    @Override
    public GoObject objectOf(Ident ident) {
        GoObject obj = defs.get(ident);
        return obj != null ? obj : uses.get(ident);
    }

    @Override
    public GoObject implicitOf(CaseClause clause) {
        return implicits.get(clause);
    }

    /**
     * Every object defined at package level, in definition order.
     */
    public List<GoObject> packageLevelDefinitions() {
        return definitionOrder.stream()
                .filter(GoObject::isPackageLevel)
                .toList();
    }
}
