package org.gopy.lowering;

import org.gopy.UnsupportedConstructException;
import org.gopy.source.ast.Node;
import org.slf4j.Logger;

/**
 * Recognized constructs without a Python lowering. They are dropped with a warning, or
 * rejected when the options ask for strict lowering.
 */
public final class Unsupported {

    private Unsupported() {
    }

    public static void report(String construct, Node node, LoweringContext ctx, Logger log) {
        if (ctx.options().strictUnsupported()) {
            throw new UnsupportedConstructException(construct, node.position());
        }
        log.warn("{}: {} has no Python lowering, dropped", node.position(), construct);
    }
}
