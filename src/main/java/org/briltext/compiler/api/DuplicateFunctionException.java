package org.briltext.compiler.api;

import java.util.List;

/**
 * Thrown when a function name is defined more than once, either within a single
 * parsed unit or across modules merged by import resolution.
 */
public class DuplicateFunctionException extends BrilException {

    private final List<String> names;

    /**
     * @param names The duplicated function names, each listed once.
     */
    public DuplicateFunctionException(List<String> names) {
        super("Function(s) defined twice: " + String.join(", ", names));
        this.names = List.copyOf(names);
    }

    public List<String> getNames() {
        return names;
    }
}
