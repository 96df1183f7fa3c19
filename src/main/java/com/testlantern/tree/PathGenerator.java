package com.testlantern.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Builds the locator expression a UI driver can use to find an element again.
 *
 * <pre>
 *   app.tables["Inbox"].cells.elementAtIndex(2).staticTexts["Subject"]
 * </pre>
 *
 * ## Rules
 *
 *   - The nearest Application ancestor (or, when there is none, the tree root) is the
 *     caller-supplied application reference; nothing above it appears in the path.
 *   - Main-window nodes, and Other nodes with neither identifier nor label, add no
 *     segment of their own.
 *   - Every other node adds ".&lt;queryName&gt;" followed by
 *       ["index"]                 when it has an identifier or label
 *       (nothing)                 when it is the only child of its type
 *       .elementAtIndex(n)        its ordinal among same-type siblings otherwise
 *       .elementAtIndex(-1)       when it cannot be found among those siblings
 *       .FAIL()                   when the sibling cohort is empty
 *   - An Other target with neither identifier nor label cannot be expressed:
 *     {@link #pathFor} returns empty. That is an expected answer, not an error.
 */
public class PathGenerator {

    static final String INVALID_INDEX_SUFFIX = ".elementAtIndex(-1)";
    static final String FAILED_SUFFIX        = ".FAIL()";

    /**
     * Returns the locator expression for {@code target}, or empty when the element is
     * not representable.
     *
     * @param target  element to describe
     * @param appName expression that stands for the application, e.g. {@code "app"}
     */
    public Optional<String> pathFor(ElementNode target, String appName) {
        Deque<ElementNode> chain = new ArrayDeque<>();
        ElementNode cursor = target;
        while (cursor != null && cursor.getType() != ElementType.APPLICATION && !cursor.isRoot()) {
            chain.push(cursor);
            cursor = cursor.getParent().orElse(null);
        }

        // the application reference itself is always expressible
        if (!chain.isEmpty() && isTransparentOther(target)) {
            return Optional.empty();
        }

        String path = appName;
        for (ElementNode node : chain) {
            path = appendSegment(path, node);
        }
        return Optional.of(path);
    }

    /** The segment {@code node} contributes when its parent's expression is {@code parentPath}. */
    public String appendSegment(String parentPath, ElementNode node) {
        if (isTransparentOther(node) || node.isMainWindow()) {
            return parentPath;
        }

        String prefix = parentPath + "." + node.getType().queryName();

        Optional<String> index = node.getIndex();
        if (index.isPresent()) {
            return prefix + "[\"" + escape(index.get()) + "\"]";
        }

        return prefix + numericSuffix(node.numericIndexMembership());
    }

    /** Suffix for an unkeyed node, given where it sits among its same-type siblings. */
    static String numericSuffix(ElementNode.IndexMembership membership) {
        if (membership.ordinal().isEmpty()) {
            return INVALID_INDEX_SUFFIX;
        }
        return switch (membership.cohortSize()) {
            case 0  -> FAILED_SUFFIX;
            case 1  -> "";
            default -> ".elementAtIndex(" + membership.ordinal().getAsInt() + ")";
        };
    }

    private static boolean isTransparentOther(ElementNode node) {
        return node.getType() == ElementType.OTHER && node.getIndex().isEmpty();
    }

    private static String escape(String index) {
        return index.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
