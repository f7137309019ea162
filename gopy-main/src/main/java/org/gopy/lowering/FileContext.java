package org.gopy.lowering;

import java.util.Optional;

import org.gopy.LoweringOptions;
import org.gopy.source.ast.CommentIndex;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.TypeOracle;

/**
 * Module-level context. Owns the root naming scope shared by every function of the unit.
 */
public final class FileContext extends LoweringContext {

    private final TypeOracle oracle;
    private final NamingScope scope;
    private final LoweringOptions options;
    private final CommentIndex comments;

    public FileContext(TypeOracle oracle, NamingScope scope, LoweringOptions options, CommentIndex comments) {
        this.oracle = oracle;
        this.scope = scope;
        this.options = options;
        this.comments = comments;
    }

    public FileContext(TypeOracle oracle, LoweringOptions options) {
        this(oracle, NamingScope.root(), options, null);
    }

    @Override
    public TypeOracle oracle() {
        return oracle;
    }

    @Override
    public NamingScope scope() {
        return scope;
    }

    @Override
    public LoweringOptions options() {
        return options;
    }

    @Override
    public Optional<CommentIndex> comments() {
        return Optional.ofNullable(comments);
    }

    /**
     * Same scope and options, different comment index; used per source file.
     */
    public FileContext withComments(CommentIndex comments) {
        return new FileContext(oracle, scope, options, comments);
    }

    @Override
    public void noteAssigned(GoObject obj) {
        // module-level assignments need no declaration
    }
}
