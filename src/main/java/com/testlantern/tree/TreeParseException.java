package com.testlantern.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown by {@link TreeParseResult#requireRoot()} when a dump produced no tree.
 * Carries every problem the parser found, not only the first.
 */
public class TreeParseException extends RuntimeException {

    private final List<ParseProblem> problems;

    public TreeParseException(List<ParseProblem> problems) {
        super("Element dump could not be parsed: " + problems.stream()
            .map(ParseProblem::toString)
            .collect(Collectors.joining("; ")));
        this.problems = List.copyOf(problems);
    }

    public List<ParseProblem> getProblems() {
        return problems;
    }
}
