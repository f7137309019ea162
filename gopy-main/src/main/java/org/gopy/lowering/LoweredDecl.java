package org.gopy.lowering;

import java.util.Optional;

import org.gopy.target.PyStmt;

/**
 * One module-level statement produced from a declaration, tagged for module assembly.
 *
 * @param ownerType Python name of the receiver's class, for methods only
 */
public record LoweredDecl(Kind kind, PyStmt stmt, String ownerType) {

    public enum Kind {
        VALUE,
        CLASS,
        TYPE_BINDING,
        FUNCTION,
        METHOD
    }

    public LoweredDecl {
        if ((kind == Kind.METHOD) != (ownerType != null)) {
            throw new IllegalArgumentException("methods, and only methods, have an owner type");
        }
    }

    public static LoweredDecl of(Kind kind, PyStmt stmt) {
        return new LoweredDecl(kind, stmt, null);
    }

    public Optional<String> owner() {
        return Optional.ofNullable(ownerType);
    }
}
