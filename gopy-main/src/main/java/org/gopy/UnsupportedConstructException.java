package org.gopy;

import org.gopy.source.ast.Position;

/**
 * A recognized construct that has no Python lowering, reported only in strict mode. Outside
 * strict mode the same constructs lower to an empty or placeholder result.
 */
public class UnsupportedConstructException extends LoweringException {

    public UnsupportedConstructException(String construct, Position position) {
        super("Unsupported construct: " + construct, construct, position);
    }
}
