package com.testlantern.tree;

import java.util.List;
import java.util.Optional;

/**
 * What {@link DebugTreeParser} made of a dump.
 *
 *   COMPLETE -- every line was placed; root is present, no problems
 *   PARTIAL  -- root is present but some lines could not be placed (depth jumps,
 *               lines outside the root); those lines are listed as problems
 *   FAILED   -- no tree; at least one line was malformed (all of them are listed),
 *               or the dump held no element lines at all
 *
 * Immutable -- use the static factories.
 */
public class TreeParseResult {

    public enum Status { COMPLETE, PARTIAL, FAILED }

    private final Status             status;
    private final ElementNode        root;      // null when FAILED
    private final List<ParseProblem> problems;
    private final int                nodeCount;

    private TreeParseResult(Status status, ElementNode root, List<ParseProblem> problems, int nodeCount) {
        this.status    = status;
        this.root      = root;
        this.problems  = List.copyOf(problems);
        this.nodeCount = nodeCount;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    static TreeParseResult built(ElementNode root, int nodeCount, List<ParseProblem> problems) {
        return new TreeParseResult(problems.isEmpty() ? Status.COMPLETE : Status.PARTIAL,
            root, problems, nodeCount);
    }

    static TreeParseResult failed(List<ParseProblem> problems) {
        return new TreeParseResult(Status.FAILED, null, problems, 0);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Status                getStatus()    { return status; }
    public Optional<ElementNode> getRoot()      { return Optional.ofNullable(root); }
    public List<ParseProblem>    getProblems()  { return problems; }
    public int                   getNodeCount() { return nodeCount; }

    public boolean isComplete() { return status == Status.COMPLETE; }
    public boolean isPartial()  { return status == Status.PARTIAL; }
    public boolean isFailed()   { return status == Status.FAILED; }

    /**
     * Returns the root, or throws a {@link TreeParseException} listing every problem
     * when the dump produced no tree.
     */
    public ElementNode requireRoot() {
        if (root == null) throw new TreeParseException(problems);
        return root;
    }

    @Override
    public String toString() {
        return String.format("TreeParseResult{status=%s, nodes=%d, problems=%d}",
            status, nodeCount, problems.size());
    }
}
