package com.horstmann.tmgrader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Set;

import org.junit.Test;

public class OutputReconcilerTest {
    private final OutputReconciler reconciler = new OutputReconciler();
    private final OutputSchema configurations = new ConfigurationSchema(Set.of('0', '1', 'B'), 'B');

    @Test
    public void extraWhitespaceStillPasses() {
        Verdict verdict = reconciler.reconcile("  3   4\n\n5 \n", "3 4\n5", new TokenSchema());
        assertEquals(Verdict.pass(), verdict);
    }

    @Test
    public void numbersAreComparedByValue() {
        assertEquals(Verdict.pass(), reconciler.reconcile("3.0\n", "3\n",
            new TokenSchema(TokenSchema.Field.NUMBER)));
        assertEquals(Verdict.pass(), reconciler.reconcile("1e2 x", "100 x",
            new TokenSchema(TokenSchema.Field.NUMBER, TokenSchema.Field.TOKEN)));
    }

    @Test
    public void undeclaredTokensAreComparedAsText() {
        Verdict verdict = reconciler.reconcile("3.0\n", "3\n", new TokenSchema());
        assertEquals(Verdict.Kind.FORMAT_MISMATCH, verdict.getKind());
        assertEquals("- 3\n+ 3.0", verdict.getDetail());
    }

    @Test
    public void differentValuesAreAFormatMismatch() {
        Verdict verdict = reconciler.reconcile("3 4\n6\n", "3 4\n5\n", new TokenSchema());
        assertEquals(Verdict.Kind.FORMAT_MISMATCH, verdict.getKind());
        assertEquals("  3 4\n- 5\n+ 6", verdict.getDetail());
    }

    @Test
    public void outputThatDoesNotParseIsUnparseable() {
        Verdict verdict = reconciler.reconcile("hello", "3", new TokenSchema(TokenSchema.Field.NUMBER));
        assertEquals(Verdict.Kind.UNPARSEABLE, verdict.getKind());
        assertTrue(verdict.getDetail().startsWith("hello\n"));
    }

    @Test
    public void runawayOutputIsTruncated() {
        StringBuilder actual = new StringBuilder("1\n");
        for (int i = 0; i < 50; i++) actual.append("2\n");
        Verdict verdict = reconciler.reconcile(actual.toString(), "1", new TokenSchema());
        String[] lines = verdict.getDetail().split("\n");
        assertEquals(12, lines.length);
        assertEquals("+ . . .", lines[11]);
    }

    @Test
    public void configurationsInStrictForm() {
        Verdict verdict = reconciler.reconcile("...[q0]01...\n...1[q0]1...", "...[q0]01...\n...1[q0]1...",
            configurations);
        assertEquals(Verdict.pass(), verdict);
    }

    @Test
    public void configurationsWithOtherDelimitersAndPadding() {
        Verdict verdict = reconciler.reconcile("BB 1 (q0) 1 B\n. . . 1 |q1| B . . .", "...1[q0]1...\n...1[q1]...",
            configurations);
        assertEquals(Verdict.pass(), verdict);
    }

    @Test
    public void wrongConfigurationIsAFormatMismatch() {
        Verdict verdict = reconciler.reconcile("...1[q0]1...", "...1[q1]1...", configurations);
        assertEquals(Verdict.Kind.FORMAT_MISMATCH, verdict.getKind());
    }

    @Test
    public void foreignSymbolsAreUnparseable() {
        Verdict verdict = reconciler.reconcile("state q0, head 2", "...1[q0]1...", configurations);
        assertEquals(Verdict.Kind.UNPARSEABLE, verdict.getKind());
    }
}
