package com.testlantern.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists copy-pastable locator expressions for every element in a dump.
 *
 * Elements are visited parents-first in dump order; elements that cannot be
 * expressed (see {@link PathGenerator}) are skipped.
 */
public class AccessorDump {

    private static final Logger log = LoggerFactory.getLogger(AccessorDump.class);

    private final DebugTreeParser parser;
    private final PathGenerator   paths;

    public AccessorDump() {
        this(new DebugTreeParser(), new PathGenerator());
    }

    public AccessorDump(DebugTreeParser parser, PathGenerator paths) {
        this.parser = parser;
        this.paths  = paths;
    }

    /** Locator expressions for {@code root} and all of its descendants. */
    public List<String> accessors(String appName, ElementNode root) {
        List<String> out = new ArrayList<>();
        for (ElementNode node : root.preorder()) {
            paths.pathFor(node, appName).ifPresent(out::add);
        }
        return out;
    }

    /**
     * Locator expressions for the element subtree of a full debug description.
     * Returns an empty list when the description yields no tree.
     */
    public List<String> accessorsFromDebugDescription(String appName, String description) {
        TreeParseResult result = parser.fromDebugDescription(description);
        if (result.getRoot().isEmpty()) {
            log.warn("AccessorDump: no tree -- {}", result.getProblems());
            return List.of();
        }
        return accessors(appName, result.getRoot().get());
    }
}
