package org.gopy.source.types;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The predeclared objects of the universe scope: basic type names, {@code error},
 * {@code true}/{@code false}, {@code nil} and the builtin functions.
 */
public final class Universe {

    private static final Map<String, GoObject> OBJECTS = new HashMap<>();

    public static final GoObject TRUE = define(GoObject.predeclared(ObjectKind.CONST, "true", BasicType.UNTYPED_BOOL));
    public static final GoObject FALSE = define(GoObject.predeclared(ObjectKind.CONST, "false", BasicType.UNTYPED_BOOL));
    public static final GoObject NIL = define(GoObject.predeclared(ObjectKind.NIL, "nil", BasicType.UNTYPED_NIL));

    public static final GoObject APPEND = builtin("append");
    public static final GoObject CAP = builtin("cap");
    public static final GoObject CLOSE = builtin("close");
    public static final GoObject COMPLEX = builtin("complex");
    public static final GoObject COPY = builtin("copy");
    public static final GoObject DELETE = builtin("delete");
    public static final GoObject IMAG = builtin("imag");
    public static final GoObject LEN = builtin("len");
    public static final GoObject MAKE = builtin("make");
    public static final GoObject NEW = builtin("new");
    public static final GoObject PANIC = builtin("panic");
    public static final GoObject PRINT = builtin("print");
    public static final GoObject PRINTLN = builtin("println");
    public static final GoObject REAL = builtin("real");
    public static final GoObject RECOVER = builtin("recover");

    public static final NamedType ERROR;

    static {
        for (BasicKind kind : BasicKind.values()) {
            if ((kind.info() & BasicKind.IS_UNTYPED) == 0 && kind != BasicKind.UNSAFE_POINTER) {
                define(GoObject.predeclared(ObjectKind.TYPE_NAME, kind.goName(), BasicType.of(kind)));
            }
        }
        define(GoObject.predeclared(ObjectKind.TYPE_NAME, "byte", BasicType.UINT8));
        define(GoObject.predeclared(ObjectKind.TYPE_NAME, "rune", BasicType.INT32));
        define(GoObject.predeclared(ObjectKind.TYPE_NAME, "any", InterfaceType.EMPTY));

        GoObject errorMethod = GoObject.method("Error",
                new SignatureType(List.of(), List.of(GoObject.localVar("", BasicType.STRING)), false));
        ERROR = NamedType.declare("error", new InterfaceType(List.of(errorMethod)), false);
        define(ERROR.obj());
    }

    private Universe() {
    }

    private static GoObject builtin(String name) {
        return define(GoObject.predeclared(ObjectKind.BUILTIN, name, null));
    }

    private static GoObject define(GoObject obj) {
        OBJECTS.put(obj.name(), obj);
        return obj;
    }

    /**
     * The predeclared object with the given name, or null.
     */
    public static GoObject lookup(String name) {
        return OBJECTS.get(name);
    }

    public static boolean isPredeclared(GoObject obj) {
        return obj != null && OBJECTS.get(obj.name()) == obj;
    }
}
