package com.horstmann.tmgrader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ReportTest {
    private static GradingResults results() {
        GradingResults results = new GradingResults();
        results.put(2, List.of(
            new TestOutcome("invert on '01'", Verdict.pass()),
            new TestOutcome("equal on '1#1'", Verdict.wrongResult("- ACCEPT\n+ REJECT"))));
        results.put(1, List.of(
            new TestOutcome("invert on '01'", Verdict.ambiguousEntrypoint(List.of(Paths.get("b.c"), Paths.get("a.c")))),
            new TestOutcome("equal on '1#1'", Verdict.ambiguousEntrypoint(List.of(Paths.get("b.c"), Paths.get("a.c"))))));
        return results;
    }

    @Test
    public void textReportListsGroupsInOrder() {
        Report report = new TextReport();
        report.header("tms", 2, 2);
        results().report(report);
        report.close();
        String text = report.getText();
        assertTrue(text, text.indexOf("Group 1") < text.indexOf("Group 2"));
        assertTrue(text, text.contains("  equal on '1#1': Wrong result\n      - ACCEPT\n      + REJECT\n"));
        assertTrue(text, text.contains("Passed 0/2"));
        assertTrue(text, text.contains("Passed 1/2"));
    }

    @Test
    public void jsonReportHasOneEntryPerTest() throws Exception {
        Report report = new JSONReport();
        report.header("simulators", 2, 2);
        results().report(report);
        JsonNode root = new ObjectMapper().readTree(report.getText());
        assertEquals("simulators", root.get("assignment").asText());
        JsonNode groups = root.get("groups");
        assertEquals(2, groups.size());
        assertEquals(1, groups.get(0).get("group").asInt());
        assertEquals("AMBIGUOUS_ENTRYPOINT", groups.get(0).get("results").get(0).get("verdict").asText());
        assertEquals("a.c", groups.get(0).get("results").get(0).get("candidates").get(0).asText());
        assertEquals(1, groups.get(1).get("passed").asInt());
    }
}
