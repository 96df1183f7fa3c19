package com.testlantern.steps;

import com.testlantern.context.ScenarioContext;
import com.testlantern.core.AccessorDumper;
import com.testlantern.core.LanternConfig;
import com.testlantern.report.AccessorReportWriter;
import com.testlantern.support.Dumps;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Steps for dump parsing and accessor generation.
 *
 * Steps covered:
 *   Given the login screen debug description
 *   Given a dump with lines:
 *   When the accessors are dumped from the debug description for app {string}
 *   When the accessors are dumped from the tree
 *   Then the accessors are:
 *   Then the dump status is {word}
 *   Then a malformed line is reported at line {int}
 *   Then the accessor report on disk lists {int} accessors
 */
public class DumpSteps {

    private static final Logger log = LoggerFactory.getLogger(DumpSteps.class);

    private final ScenarioContext ctx;

    public DumpSteps(ScenarioContext ctx) {
        this.ctx = ctx;
    }

    // ── Inputs ────────────────────────────────────────────────────────────────

    @Given("the login screen debug description")
    public void theLoginScreenDebugDescription() {
        ctx.setDumpText(Dumps.LOGIN_DESCRIPTION);
    }

    @Given("a dump with lines:")
    public void aDumpWithLines(String docString) {
        ctx.setDumpText(docString);
    }

    // ── Actions ───────────────────────────────────────────────────────────────

    @When("the accessors are dumped from the debug description for app {string}")
    public void theAccessorsAreDumpedFromTheDebugDescription(String appName) {
        LanternConfig config = LanternConfig.builder()
            .appName(appName)
            .accessorReportPath(ctx.getConfig().getAccessorReportPath())
            .build();
        ctx.setReport(new AccessorDumper(config).dumpDebugDescription(ctx.getDumpText()));
        log.info("DumpSteps: {}", ctx.getReport());
    }

    @When("the accessors are dumped from the tree")
    public void theAccessorsAreDumpedFromTheTree() {
        ctx.setReport(new AccessorDumper(ctx.getConfig()).dumpTree(ctx.getDumpText()));
        log.info("DumpSteps: {}", ctx.getReport());
    }

    // ── Checks ────────────────────────────────────────────────────────────────

    @Then("the accessors are:")
    public void theAccessorsAre(List<String> expected) {
        assertThat(ctx.getReport().getAccessors()).containsExactlyElementsOf(expected);
    }

    @Then("the dump status is {word}")
    public void theDumpStatusIs(String status) {
        assertThat(ctx.getReport().getStatus()).isEqualTo(status);
    }

    @Then("a malformed line is reported at line {int}")
    public void aMalformedLineIsReportedAtLine(int lineNumber) {
        assertThat(ctx.getReport().getProblems())
            .anyMatch(p -> p.startsWith("MALFORMED_LINE at line " + lineNumber + " "));
    }

    @Then("the accessor report on disk lists {int} accessors")
    public void theAccessorReportOnDiskLists(int count) {
        AccessorReportWriter writer = new AccessorReportWriter(ctx.getConfig().getAccessorReportPath());
        assertThat(writer.read()).hasValueSatisfying(r -> assertThat(r.getAccessors()).hasSize(count));
    }
}
