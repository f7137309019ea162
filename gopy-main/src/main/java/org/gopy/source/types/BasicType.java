package org.gopy.source.types;

import java.util.EnumMap;
import java.util.Map;

public record BasicType(BasicKind kind) implements GoType {

    private static final Map<BasicKind, BasicType> TYPES = new EnumMap<>(BasicKind.class);

    static {
        for (BasicKind kind : BasicKind.values()) {
            TYPES.put(kind, new BasicType(kind));
        }
    }

    public static final BasicType BOOL = of(BasicKind.BOOL);
    public static final BasicType INT = of(BasicKind.INT);
    public static final BasicType INT64 = of(BasicKind.INT64);
    public static final BasicType UINT8 = of(BasicKind.UINT8);
    public static final BasicType INT32 = of(BasicKind.INT32);
    public static final BasicType FLOAT64 = of(BasicKind.FLOAT64);
    public static final BasicType COMPLEX128 = of(BasicKind.COMPLEX128);
    public static final BasicType STRING = of(BasicKind.STRING);
    public static final BasicType UNTYPED_INT = of(BasicKind.UNTYPED_INT);
    public static final BasicType UNTYPED_FLOAT = of(BasicKind.UNTYPED_FLOAT);
    public static final BasicType UNTYPED_STRING = of(BasicKind.UNTYPED_STRING);
    public static final BasicType UNTYPED_BOOL = of(BasicKind.UNTYPED_BOOL);
    public static final BasicType UNTYPED_NIL = of(BasicKind.UNTYPED_NIL);

    public static BasicType of(BasicKind kind) {
        return TYPES.get(kind);
    }

    public boolean isBoolean() {
        return (kind.info() & BasicKind.IS_BOOLEAN) != 0;
    }

    public boolean isInteger() {
        return (kind.info() & BasicKind.IS_INTEGER) != 0;
    }

    public boolean isFloat() {
        return (kind.info() & BasicKind.IS_FLOAT) != 0;
    }

    public boolean isComplex() {
        return (kind.info() & BasicKind.IS_COMPLEX) != 0;
    }

    public boolean isString() {
        return (kind.info() & BasicKind.IS_STRING) != 0;
    }

    public boolean isUntyped() {
        return (kind.info() & BasicKind.IS_UNTYPED) != 0;
    }

    @Override
    public String toString() {
        return kind.goName();
    }
}
