package org.gopy.source.ast;

import java.util.List;

/**
 * Comment groups attached to source nodes.
 */
public interface CommentIndex {

    List<CommentGroup> commentsFor(Node node);
}
