package com.testlantern.core;

import com.testlantern.report.AccessorReport;
import com.testlantern.report.AccessorReportWriter;
import com.testlantern.tree.AccessorDump;
import com.testlantern.tree.DebugTreeParser;
import com.testlantern.tree.ParseProblem;
import com.testlantern.tree.PathGenerator;
import com.testlantern.tree.TreeParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point for turning a captured debug description into a list of locator paths.
 *
 * Parses the dump, generates a path for every representable element, and (unless
 * disabled in {@link LanternConfig}) writes the result as an {@link AccessorReport}.
 *
 * <pre>
 *   AccessorDumper dumper = new AccessorDumper(LanternConfig.fromEnvironment());
 *   AccessorReport report = dumper.dumpDebugDescription(app.debugDescription());
 *   report.getAccessors().forEach(System.out::println);
 * </pre>
 */
public class AccessorDumper {

    private static final Logger log = LoggerFactory.getLogger(AccessorDumper.class);

    private final LanternConfig        config;
    private final DebugTreeParser      parser;
    private final AccessorDump         dump;
    private final AccessorReportWriter writer;   // null when the report is disabled

    public AccessorDumper(LanternConfig config) {
        this.config = config;
        this.parser = new DebugTreeParser();
        this.dump   = new AccessorDump(parser, new PathGenerator());
        this.writer = config.isAccessorReportEnabled()
            ? new AccessorReportWriter(config.getAccessorReportPath())
            : null;
        log.info("AccessorDumper: Initialized -- appName={}, report={}",
            config.getAppName(), writer != null ? config.getAccessorReportPath() : "disabled");
    }

    /** Dumps the "Element subtree" section of a full debug description. */
    public AccessorReport dumpDebugDescription(String description) {
        return dump(parser.fromDebugDescription(description));
    }

    /** Dumps a bare element tree (just the arrow-prefixed lines). */
    public AccessorReport dumpTree(String treeText) {
        return dump(parser.parse(treeText));
    }

    private AccessorReport dump(TreeParseResult result) {
        String appName = config.getAppName();
        List<String> accessors = result.getRoot()
            .map(root -> dump.accessors(appName, root))
            .orElse(List.of());

        AccessorReport report = new AccessorReport();
        report.setGeneratedAt(Instant.now());
        report.setAppName(appName);
        report.setStatus(result.getStatus().name());
        report.setNodeCount(result.getNodeCount());
        report.setAccessors(accessors);
        report.setProblems(result.getProblems().stream()
            .map(ParseProblem::toString)
            .collect(Collectors.toList()));

        if (result.isFailed()) {
            log.warn("AccessorDumper: Dump produced no tree -- {} problem(s)", result.getProblems().size());
        } else {
            log.info("AccessorDumper: {} accessors from {} nodes ({})",
                accessors.size(), result.getNodeCount(), result.getStatus());
        }

        if (writer != null) writer.write(report);
        return report;
    }
}
