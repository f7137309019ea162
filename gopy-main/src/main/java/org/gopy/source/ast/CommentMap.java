package org.gopy.source.ast;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CommentIndex} backed by an identity map from node to its comment groups, in the
 * order they were attached.
 */
public class CommentMap implements CommentIndex {

    private final Map<Node, List<CommentGroup>> groups = new IdentityHashMap<>();

    public CommentMap attach(Node node, CommentGroup group) {
        groups.computeIfAbsent(node, n -> new ArrayList<>()).add(group);
        return this;
    }

    @Override
    public List<CommentGroup> commentsFor(Node node) {
        List<CommentGroup> list = groups.get(node);
        return list == null ? List.of() : List.copyOf(list);
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
