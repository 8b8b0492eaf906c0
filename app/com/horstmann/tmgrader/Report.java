package com.horstmann.tmgrader;

public interface Report {
    Report header(String assignment, int groups, int tests);

    Report verdict(int group, String test, Verdict verdict);

    default void close() {}

    String getText();
}
