package org.gopy.target;

import java.util.List;

/**
 * Parameter list of a {@code def}. {@code defaults} align with the last parameters;
 * {@code vararg} is null unless the function takes {@code *name}.
 */
public record PyArguments(List<PyArg> args, String vararg, List<PyExpr> defaults) implements PyNode {

    public static final PyArguments NONE = new PyArguments(List.of(), null, List.of());

    public PyArguments {
        args = List.copyOf(args);
        defaults = List.copyOf(defaults);
        if (defaults.size() > args.size()) {
            throw new IllegalArgumentException("more defaults than parameters");
        }
    }

    public List<String> names() {
        return args.stream().map(PyArg::name).toList();
    }
}
