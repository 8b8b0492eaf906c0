package com.horstmann.tmgrader;

import java.util.List;

/**
 * The structure of a program's output. Parsed outputs are compared with equals.
 */
public interface OutputSchema {
    /**
     * Parses output exactly as written.
     * @return one value per line, or null if the lines do not follow the schema
     */
    List<Object> parse(List<String> lines);

    /**
     * Parses output whose lines have been trimmed, with blank lines removed and
     * whitespace runs collapsed. Tolerates whatever formatting noise the schema
     * considers harmless.
     * @return one value per line, or null if the lines cannot be understood
     */
    default List<Object> parseLenient(List<String> lines) {
        return parse(lines);
    }
}
