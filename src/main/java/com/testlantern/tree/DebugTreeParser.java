package com.testlantern.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds an {@link ElementNode} tree from the lines of an element dump.
 *
 * ## Two passes
 *
 *   1. Every non-blank line is parsed by {@link DebugLineParser}. If any line is
 *      malformed the dump is rejected as a whole: the result is FAILED, lists every
 *      malformed line, and carries no tree.
 *   2. Nodes are linked in input order using an explicit stack of open ancestors.
 *      For each node the stack is popped while its top is at the node's depth or
 *      deeper; the remaining top is the only possible parent.
 *
 * ## Structural problems
 *
 *   DEPTH_JUMP    the nearest open ancestor is more than one level up. The line is
 *                 left out; any lines that would have been its children are reported
 *                 the same way, and later siblings still attach to the right parent.
 *   OUTSIDE_ROOT  a line at or above the root's depth after the root was placed.
 *
 * Structural problems never discard what was already built; the result is PARTIAL.
 */
public class DebugTreeParser {

    private static final Logger log = LoggerFactory.getLogger(DebugTreeParser.class);

    static final String SUBTREE_SECTION = "Element subtree";

    private static final Pattern SECTION = Pattern.compile("\\n([^:\\n]+):\\n( →.+(?:\\n .*)*)");

    private final DebugLineParser lineParser;

    public DebugTreeParser() {
        this(new DebugLineParser());
    }

    public DebugTreeParser(DebugLineParser lineParser) {
        this.lineParser = lineParser;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /** Parses a dump held in one string, one element per line. */
    public TreeParseResult parse(String dump) {
        if (dump == null) return parse(List.of());
        return parse(Arrays.asList(dump.split("\\r?\\n", -1)));
    }

    /** Parses a dump given as its lines, in order. */
    public TreeParseResult parse(List<String> lines) {
        List<ParseProblem> malformed = new ArrayList<>();
        List<NumberedNode> nodes     = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) continue;

            DebugLineParser.Attempt attempt = lineParser.attempt(line);
            if (attempt.isOk()) {
                nodes.add(new NumberedNode(i + 1, attempt.node()));
            } else {
                malformed.add(new ParseProblem(ParseProblem.Kind.MALFORMED_LINE, i + 1, line, attempt.reason()));
            }
        }

        if (!malformed.isEmpty()) {
            malformed.forEach(p -> log.warn("DebugTreeParser: {}", p));
            log.info("DebugTreeParser: dump rejected -- {} malformed line(s)", malformed.size());
            return TreeParseResult.failed(malformed);
        }

        if (nodes.isEmpty()) {
            log.info("DebugTreeParser: dump contains no element lines");
            return TreeParseResult.failed(List.of(
                new ParseProblem(ParseProblem.Kind.EMPTY_DUMP, 0, "", "no element lines")));
        }

        return assemble(nodes);
    }

    /**
     * Extracts the element subtree section from a full debug description and parses it.
     * A description without that section yields a FAILED result.
     */
    public TreeParseResult fromDebugDescription(String description) {
        Map<String, String> sections = sections(description);
        String subtree = sections.get(SUBTREE_SECTION);
        if (subtree == null) {
            log.info("DebugTreeParser: no '{}' section among {}", SUBTREE_SECTION, sections.keySet());
            return TreeParseResult.failed(List.of(new ParseProblem(
                ParseProblem.Kind.MISSING_SECTION, 0, "", "no '" + SUBTREE_SECTION + "' section")));
        }
        return parse(subtree);
    }

    // ── Assembly ──────────────────────────────────────────────────────────────

    private TreeParseResult assemble(List<NumberedNode> nodes) {
        Deque<ElementNode>  open     = new ArrayDeque<>();
        List<ParseProblem>  problems = new ArrayList<>();
        ElementNode         root     = null;
        int                 placed   = 0;

        for (NumberedNode n : nodes) {
            ElementNode node = n.node();

            if (root == null) {
                root = node;
                open.push(node);
                placed++;
                continue;
            }

            while (!open.isEmpty() && open.peek().getDepth() >= node.getDepth()) {
                open.pop();
            }

            if (open.isEmpty()) {
                problems.add(new ParseProblem(ParseProblem.Kind.OUTSIDE_ROOT, n.lineNumber(), node.getSource(),
                    "depth " + node.getDepth() + " is not below the root depth " + root.getDepth()));
                continue;
            }

            ElementNode parent = open.peek();
            if (parent.getDepth() != node.getDepth() - 1) {
                problems.add(new ParseProblem(ParseProblem.Kind.DEPTH_JUMP, n.lineNumber(), node.getSource(),
                    "depth " + node.getDepth() + " under an ancestor at depth " + parent.getDepth()));
                continue;
            }

            parent.attachChild(node);
            open.push(node);
            placed++;
        }

        problems.forEach(p -> log.warn("DebugTreeParser: {}", p));
        TreeParseResult result = TreeParseResult.built(root, placed, problems);
        log.info("DebugTreeParser: {} -- {} of {} line(s) placed", result.getStatus(), placed, nodes.size());
        return result;
    }

    private static Map<String, String> sections(String description) {
        Map<String, String> out = new LinkedHashMap<>();
        if (description == null) return out;
        Matcher m = SECTION.matcher("\n" + description);
        while (m.find()) {
            out.put(m.group(1).trim(), m.group(2));
        }
        return out;
    }

    private record NumberedNode(int lineNumber, ElementNode node) {}
}
