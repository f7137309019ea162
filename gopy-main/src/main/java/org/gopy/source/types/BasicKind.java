package org.gopy.source.types;

public enum BasicKind {

    BOOL("bool", BasicKind.IS_BOOLEAN),
    INT("int", BasicKind.IS_INTEGER),
    INT8("int8", BasicKind.IS_INTEGER),
    INT16("int16", BasicKind.IS_INTEGER),
    INT32("int32", BasicKind.IS_INTEGER),
    INT64("int64", BasicKind.IS_INTEGER),
    UINT("uint", BasicKind.IS_INTEGER | BasicKind.IS_UNSIGNED),
    UINT8("uint8", BasicKind.IS_INTEGER | BasicKind.IS_UNSIGNED),
    UINT16("uint16", BasicKind.IS_INTEGER | BasicKind.IS_UNSIGNED),
    UINT32("uint32", BasicKind.IS_INTEGER | BasicKind.IS_UNSIGNED),
    UINT64("uint64", BasicKind.IS_INTEGER | BasicKind.IS_UNSIGNED),
    UINTPTR("uintptr", BasicKind.IS_INTEGER | BasicKind.IS_UNSIGNED),
    FLOAT32("float32", BasicKind.IS_FLOAT),
    FLOAT64("float64", BasicKind.IS_FLOAT),
    COMPLEX64("complex64", BasicKind.IS_COMPLEX),
    COMPLEX128("complex128", BasicKind.IS_COMPLEX),
    STRING("string", BasicKind.IS_STRING),
    UNSAFE_POINTER("unsafe.Pointer", 0),

    UNTYPED_BOOL("untyped bool", BasicKind.IS_BOOLEAN | BasicKind.IS_UNTYPED),
    UNTYPED_INT("untyped int", BasicKind.IS_INTEGER | BasicKind.IS_UNTYPED),
    UNTYPED_RUNE("untyped rune", BasicKind.IS_INTEGER | BasicKind.IS_UNTYPED),
    UNTYPED_FLOAT("untyped float", BasicKind.IS_FLOAT | BasicKind.IS_UNTYPED),
    UNTYPED_COMPLEX("untyped complex", BasicKind.IS_COMPLEX | BasicKind.IS_UNTYPED),
    UNTYPED_STRING("untyped string", BasicKind.IS_STRING | BasicKind.IS_UNTYPED),
    UNTYPED_NIL("untyped nil", BasicKind.IS_UNTYPED);

    public static final int IS_BOOLEAN = 1;
    public static final int IS_INTEGER = 1 << 1;
    public static final int IS_UNSIGNED = 1 << 2;
    public static final int IS_FLOAT = 1 << 3;
    public static final int IS_COMPLEX = 1 << 4;
    public static final int IS_STRING = 1 << 5;
    public static final int IS_UNTYPED = 1 << 6;

    private final String goName;
    private final int info;

    BasicKind(String goName, int info) {
        this.goName = goName;
        this.info = info;
    }

    public String goName() {
        return goName;
    }

    public int info() {
        return info;
    }
}
