package org.gopy.lowering;

import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import org.gopy.source.types.GoObject;

/**
 * Maps resolved Go objects to Python identifiers and hands out temporaries.
 * <p>
 * Scopes form a chain: the root holds module-level names and each lowered function forks a
 * nested scope. Package-level objects are always named in the root. A name handed out by any
 * scope never collides with a name visible from the scope that asked for it, so the same
 * object keeps one spelling for the whole unit and distinct objects never share one where
 * both are in reach.
 */
public final class NamingScope {

    private static final Set<String> PYTHON_KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
            "try", "while", "with", "yield");

    // builtins the lowering itself emits; a Go name spelled like one must not shadow it
    private static final Set<String> EMITTED_BUILTINS = Set.of(
            "range", "len", "enumerate", "reversed", "type", "isinstance", "hasattr", "KeyError",
            "Exception", "print", "int", "float", "complex", "str", "bool", "list", "dict", "chr",
            "ord", "map", "bytes", "callable");

    private final NamingScope parent;
    private final int depth;
    private final Map<GoObject, String> names = new IdentityHashMap<>();
    private final Set<String> taken = new HashSet<>();
    private final Map<String, Integer> counters = new HashMap<>();

    private NamingScope(NamingScope parent) {
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    public static NamingScope root() {
        return new NamingScope(null);
    }

    /**
     * Forks a child scope for a function body.
     */
    public NamingScope nested() {
        return new NamingScope(this);
    }

    public NamingScope parent() {
        return parent;
    }

    public int depth() {
        return depth;
    }

    /**
     * The Python identifier for {@code obj}, allocating one on first request. Fields and
     * methods are attributes and only get keyword-escaped.
     */
    public String name(GoObject obj) {
        if (obj.isAttribute()) {
            return attributeName(obj.name());
        }
        String existing = lookup(obj);
        if (existing != null) {
            return existing;
        }
        NamingScope owner = obj.isPackageLevel() ? rootScope() : this;
        String candidate = sanitize(obj.name());
        if (isVisible(candidate)) {
            int suffix = 1;
            while (isVisible(candidate + "_" + suffix)) {
                suffix++;
            }
            candidate = candidate + "_" + suffix;
        }
        owner.names.put(obj, candidate);
        owner.taken.add(candidate);
        return candidate;
    }

    /**
     * Names every object up front, in order, so later requests from nested scopes see them
     * as taken.
     */
    public void reserve(Iterable<GoObject> objects) {
        for (GoObject obj : objects) {
            name(obj);
        }
    }

    /**
     * Marks a literal identifier as used in this scope.
     */
    public void claim(String name) {
        taken.add(name);
    }

    /**
     * A fresh temporary {@code base_N}, unique among the names visible here. The numeric suffix
     * already keeps it clear of keywords and builtins, so {@code base} is used as given.
     */
    public String temp(String base) {
        String prefix = base;
        int n = counters.getOrDefault(prefix, 0);
        String candidate;
        do {
            n++;
            candidate = prefix + "_" + n;
        } while (isVisible(candidate));
        counters.put(prefix, n);
        taken.add(candidate);
        return candidate;
    }

    /**
     * {@code base} itself when nothing visible uses it yet, otherwise a {@link #temp(String)}.
     */
    public String fresh(String base) {
        String candidate = sanitize(base);
        if (isVisible(candidate)) {
            return temp(base);
        }
        taken.add(candidate);
        return candidate;
    }

    /**
     * Depth of the scope that named {@code obj}, or -1 when no scope in the chain has.
     */
    public int ownerDepth(GoObject obj) {
        for (NamingScope scope = this; scope != null; scope = scope.parent) {
            if (scope.names.containsKey(obj)) {
                return scope.depth;
            }
        }
        return -1;
    }

    /**
     * Escapes Python keywords and the builtins the lowering relies on with a trailing underscore.
     */
    public static String sanitize(String goName) {
        if (PYTHON_KEYWORDS.contains(goName) || EMITTED_BUILTINS.contains(goName)) {
            return goName + "_";
        }
        return goName;
    }

    public static String attributeName(String goName) {
        return PYTHON_KEYWORDS.contains(goName) ? goName + "_" : goName;
    }

    private String lookup(GoObject obj) {
        for (NamingScope scope = this; scope != null; scope = scope.parent) {
            String name = scope.names.get(obj);
            if (name != null) {
                return name;
            }
        }
        return null;
    }

    private boolean isVisible(String name) {
        for (NamingScope scope = this; scope != null; scope = scope.parent) {
            if (scope.taken.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private NamingScope rootScope() {
        NamingScope scope = this;
        while (scope.parent != null) {
            scope = scope.parent;
        }
        return scope;
    }
}
