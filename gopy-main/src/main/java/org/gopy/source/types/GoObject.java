package org.gopy.source.types;

import org.gopy.source.ast.BasicLit;
import org.gopy.source.ast.Position;

/**
 * A resolved symbol identity. Two references to the same declared entity share one instance;
 * equality is identity.
 */
public final class GoObject {

    private final ObjectKind kind;
    private final String name;
    private GoType type;
    private final boolean packageLevel;
    private final Position position;
    private BasicLit constValue;

    GoObject(ObjectKind kind, String name, GoType type, boolean packageLevel, Position position) {
        this.kind = kind;
        this.name = name;
        this.type = type;
        this.packageLevel = packageLevel;
        this.position = position == null ? Position.UNKNOWN : position;
    }

    public static GoObject localVar(String name, GoType type) {
        return new GoObject(ObjectKind.VAR, name, type, false, null);
    }

    public static GoObject packageVar(String name, GoType type) {
        return new GoObject(ObjectKind.VAR, name, type, true, null);
    }

    public static GoObject field(String name, GoType type) {
        return new GoObject(ObjectKind.FIELD, name, type, false, null);
    }

    public static GoObject constant(String name, GoType type, boolean packageLevel) {
        return new GoObject(ObjectKind.CONST, name, type, packageLevel, null);
    }

    /**
     * A constant whose value is known, e.g. an {@code iota} entry with no initializer of its own.
     */
    public static GoObject constant(String name, GoType type, boolean packageLevel, BasicLit value) {
        GoObject obj = new GoObject(ObjectKind.CONST, name, type, packageLevel, null);
        obj.constValue = value;
        return obj;
    }

    public static GoObject func(String name, SignatureType signature) {
        return new GoObject(ObjectKind.FUNC, name, signature, true, null);
    }

    public static GoObject method(String name, SignatureType signature) {
        return new GoObject(ObjectKind.METHOD, name, signature, false, null);
    }

    public static GoObject pkg(String name) {
        return new GoObject(ObjectKind.PACKAGE, name, null, true, null);
    }

    static GoObject predeclared(ObjectKind kind, String name, GoType type) {
        return new GoObject(kind, name, type, false, null);
    }

    public ObjectKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    public GoType type() {
        return type;
    }

    /**
     * The folded value of a constant, or null when unknown.
     */
    public BasicLit constValue() {
        return constValue;
    }

    void setType(GoType type) {
        this.type = type;
    }

    /**
     * True for objects declared at package scope; their Python names live in the module scope.
     */
    public boolean isPackageLevel() {
        return packageLevel;
    }

    public Position position() {
        return position;
    }

    /**
     * True for fields and methods, which are reached through attribute access.
     */
    public boolean isAttribute() {
        return kind == ObjectKind.FIELD || kind == ObjectKind.METHOD;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + name + (type == null ? "" : " " + type);
    }
}
