package org.gopy.source.ast;

public record Position(String file, int line, int column) {

    public static final Position UNKNOWN = new Position("", 0, 0);

    public static Position of(String file, int line, int column) {
        return new Position(file, line, column);
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return "-";
        }
        return (file.isEmpty() ? "" : file + ":") + line + ":" + column;
    }
}
