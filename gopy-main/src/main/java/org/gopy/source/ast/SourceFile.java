package org.gopy.source.ast;

import java.util.List;

/**
 * One resolved Go source file: its declarations in source order plus the comments attached to
 * its nodes.
 */
public record SourceFile(String name, String packageName, List<Decl> decls, CommentMap comments) {

    public SourceFile {
        decls = List.copyOf(decls);
        if (comments == null) {
            comments = new CommentMap();
        }
    }
}
