package org.gopy;

import org.gopy.source.ast.Position;

/**
 * Raised when a source construct has no defined lowering. Lowering of the whole unit stops;
 * there is no partial result.
 */
public class LoweringException extends GoPyException {

    private final String nodeDescription;
    private final Position position;

    public LoweringException(String message, String nodeDescription, Position position) {
        super(format(message, position));
        this.nodeDescription = nodeDescription;
        this.position = position == null ? Position.UNKNOWN : position;
    }

    public LoweringException(String message, String nodeDescription, Position position, Throwable cause) {
        super(format(message, position), cause);
        this.nodeDescription = nodeDescription;
        this.position = position == null ? Position.UNKNOWN : position;
    }

    public String getNodeDescription() {
        return nodeDescription;
    }

    public Position getPosition() {
        return position;
    }

    private static String format(String message, Position position) {
        if (position == null || !position.isKnown()) {
            return message;
        }
        return position + ": " + message;
    }
}
