package com.testlantern.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON record of one accessor dump: every locator path generated from a debug
 * description, plus anything the parser complained about.
 *
 * Written by {@link AccessorReportWriter} (default target/accessor-report.json,
 * configured via TESTLANTERN_ACCESSOR_REPORT_PATH). Engineers copy paths out of it
 * when writing new screen actions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccessorReport {

    private Instant      generatedAt;
    private String       appName;
    private String       status;       // TreeParseResult.Status name
    private int          nodeCount;
    private List<String> accessors = new ArrayList<>();
    private List<String> problems  = new ArrayList<>();

    // ── Getters / Setters ─────────────────────────────────────────────────────

    public Instant getGeneratedAt()                 { return generatedAt; }
    public void setGeneratedAt(Instant generatedAt) { this.generatedAt = generatedAt; }

    public String getAppName()                      { return appName; }
    public void setAppName(String appName)          { this.appName = appName; }

    public String getStatus()                       { return status; }
    public void setStatus(String status)            { this.status = status; }

    public int getNodeCount()                       { return nodeCount; }
    public void setNodeCount(int nodeCount)         { this.nodeCount = nodeCount; }

    public List<String> getAccessors()              { return accessors; }
    public void setAccessors(List<String> accessors) {
        this.accessors = accessors != null ? new ArrayList<>(accessors) : new ArrayList<>();
    }

    public List<String> getProblems()               { return problems; }
    public void setProblems(List<String> problems) {
        this.problems = problems != null ? new ArrayList<>(problems) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return String.format("AccessorReport{app='%s', status=%s, nodes=%d, accessors=%d, problems=%d}",
            appName, status, nodeCount, accessors.size(), problems.size());
    }
}
