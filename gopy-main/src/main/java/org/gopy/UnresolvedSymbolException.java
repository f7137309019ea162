package org.gopy;

import org.gopy.source.ast.Position;

public class UnresolvedSymbolException extends LoweringException {

    private final String identifier;

    public UnresolvedSymbolException(String identifier, Position position) {
        super("Unable to resolve identifier '" + identifier + "'", identifier, position);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
