package org.gopy.source.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A run of comments with no blank line or token between them.
 */
public record CommentGroup(List<Comment> comments) {

    public CommentGroup {
        comments = List.copyOf(comments);
    }

    public static CommentGroup of(String... texts) {
        List<Comment> list = new ArrayList<>();
        for (String text : texts) {
            list.add(new Comment(Position.UNKNOWN, text));
        }
        return new CommentGroup(list);
    }

    /**
     * The comment text without markers, one entry per line. Leading and trailing blank lines
     * are dropped, trailing whitespace is stripped, and the first space after {@code //} is
     * removed.
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        for (Comment comment : comments) {
            String c = comment.text();
            if (c.startsWith("//")) {
                c = c.substring(2);
                if (c.startsWith(" ")) {
                    c = c.substring(1);
                }
                lines.add(c);
            } else if (c.startsWith("/*")) {
                c = c.substring(2, c.length() - 2);
                lines.addAll(List.of(c.split("\n", -1)));
            } else {
                lines.add(c);
            }
        }
        lines.replaceAll(String::stripTrailing);

        int start = 0;
        while (start < lines.size() && lines.get(start).isEmpty()) {
            start++;
        }
        int end = lines.size();
        while (end > start && lines.get(end - 1).isEmpty()) {
            end--;
        }
        return List.copyOf(lines.subList(start, end));
    }
}
