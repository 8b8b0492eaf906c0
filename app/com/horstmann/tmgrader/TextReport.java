package com.horstmann.tmgrader;

/**
 * A plain text report: a line per test case, with the detail of failures indented
 * below it, and a score line per group.
 */
public class TextReport implements Report {
    private final StringBuilder builder = new StringBuilder();
    private int group = -1;
    private int passed;
    private int total;

    private TextReport add(CharSequence s) {
        if (s == null) return this;
        builder.append(s);
        if (s.length() > 0 && s.charAt(s.length() - 1) != '\n')
            builder.append("\n");
        return this;
    }

    @Override
    public TextReport header(String assignment, int groups, int tests) {
        String text = "Grading " + assignment + ": " + groups + " groups, " + tests + " tests";
        add(text);
        builder.append("=".repeat(text.length())).append("\n");
        return this;
    }

    @Override
    public TextReport verdict(int group, String test, Verdict verdict) {
        if (group != this.group) {
            score();
            this.group = group;
            builder.append("\nGroup ").append(group).append("\n");
        }
        total++;
        if (verdict.isPass()) passed++;
        add("  " + test + ": " + verdict.getKind().getCaption());
        if (!verdict.isPass() && !verdict.getDetail().isEmpty())
            add(verdict.getDetail().replaceAll("(?m)^", "      "));
        return this;
    }

    private void score() {
        if (group >= 0) builder.append("  Passed ").append(passed).append("/").append(total).append("\n");
        passed = 0;
        total = 0;
    }

    @Override
    public void close() {
        score();
        group = -1;
    }

    @Override
    public String getText() { return builder.toString(); }
}
