package org.gopy.lowering;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.gopy.LoweringOptions;
import org.gopy.source.ast.CommentIndex;
import org.gopy.source.types.GoObject;
import org.gopy.source.types.TypeOracle;
import org.gopy.target.PyStmt;

/**
 * Where a construct is being lowered: at file level or inside a function body. Every lowering
 * operation receives one; it carries the oracle, the naming scope and the loops currently open.
 */
public abstract sealed class LoweringContext permits FileContext, FunctionContext {

    private final Deque<List<PyStmt>> loopPosts = new ArrayDeque<>();

    public abstract TypeOracle oracle();

    public abstract NamingScope scope();

    public abstract LoweringOptions options();

    public abstract Optional<CommentIndex> comments();

    /**
     * Opens a loop whose {@code continue} must first run {@code post}.
     */
    public void enterLoop(List<PyStmt> post) {
        loopPosts.push(List.copyOf(post));
    }

    public void exitLoop() {
        loopPosts.pop();
    }

    /**
     * Statements to emit before a {@code continue} of the innermost loop.
     */
    public List<PyStmt> continuePrefix() {
        List<PyStmt> post = loopPosts.peek();
        return post == null ? List.of() : post;
    }

    /**
     * Records an assignment to {@code obj}, so the function can declare it {@code global} or
     * {@code nonlocal} when it lives in an outer scope.
     */
    public abstract void noteAssigned(GoObject obj);

    /**
     * Forks the context for the body of a function declared here.
     */
    public FunctionContext enterFunction() {
        return new FunctionContext(this);
    }
}
