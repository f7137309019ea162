package org.gopy.lowering;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.gopy.LoweringOptions;
import org.gopy.source.ast.CommentIndex;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.TypeOracle;
import org.gopy.target.PyName;

/**
 * Context for one function body, nested in the context it was declared in.
 */
public final class FunctionContext extends LoweringContext {

    private final LoweringContext parent;
    private final NamingScope scope;
    private PyName captureList;
    private final List<PyName> namedResults = new ArrayList<>();
    private final Set<String> globals = new LinkedHashSet<>();
    private final Set<String> nonlocals = new LinkedHashSet<>();

    FunctionContext(LoweringContext parent) {
        this.parent = parent;
        this.scope = parent.scope().nested();
    }

    public LoweringContext parent() {
        return parent;
    }

    @Override
    public TypeOracle oracle() {
        return parent.oracle();
    }

    @Override
    public NamingScope scope() {
        return scope;
    }

    @Override
    public LoweringOptions options() {
        return parent.options();
    }

    @Override
    public Optional<CommentIndex> comments() {
        return parent.comments();
    }

    /**
     * The deferred-call list of this function, or null when it has no {@code defer}.
     */
    public PyName captureList() {
        return captureList;
    }

    void setCaptureList(PyName captureList) {
        this.captureList = captureList;
    }

    public List<PyName> namedResults() {
        return List.copyOf(namedResults);
    }

    void addNamedResult(PyName result) {
        namedResults.add(result);
    }

    @Override
    public void noteAssigned(GoObject obj) {
        int owner = scope.ownerDepth(obj);
        if (owner < 0 || owner == scope.depth()) {
            return;
        }
        String name = scope.name(obj);
        if (owner == 0) {
            globals.add(name);
        } else {
            nonlocals.add(name);
        }
    }

    public List<String> globals() {
        return List.copyOf(globals);
    }

    public List<String> nonlocals() {
        return List.copyOf(nonlocals);
    }
}
