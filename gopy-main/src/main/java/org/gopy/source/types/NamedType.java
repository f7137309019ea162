package org.gopy.source.types;

import java.util.ArrayList;
import java.util.List;

/**
 * A defined type. Compared by identity; the underlying type may be set after construction so
 * recursive types can refer to themselves.
 */
public final class NamedType implements GoType {

    private final GoObject obj;
    private GoType underlying;
    private final List<GoObject> methods = new ArrayList<>();

    NamedType(GoObject obj, GoType underlying) {
        this.obj = obj;
        this.underlying = underlying;
    }

    /**
     * Declares a new type name and its named type.
     */
    public static NamedType declare(String name, GoType underlying, boolean packageLevel) {
        GoObject obj = new GoObject(ObjectKind.TYPE_NAME, name, null, packageLevel, null);
        NamedType named = new NamedType(obj, underlying);
        obj.setType(named);
        return named;
    }

    public GoObject obj() {
        return obj;
    }

    public String name() {
        return obj.name();
    }

    @Override
    public GoType underlying() {
        if (underlying == null) {
            throw new IllegalStateException("underlying type of " + obj.name() + " is not set");
        }
        return underlying instanceof NamedType named ? named.underlying() : underlying;
    }

    public void setUnderlying(GoType underlying) {
        if (this.underlying != null) {
            throw new IllegalStateException("underlying type of " + obj.name() + " is already set");
        }
        this.underlying = underlying;
    }

    public List<GoObject> methods() {
        return List.copyOf(methods);
    }

    public void addMethod(GoObject method) {
        methods.add(method);
    }

    @Override
    public String toString() {
        return obj.name();
    }
}
