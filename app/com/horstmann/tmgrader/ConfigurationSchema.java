package com.horstmann.tmgrader;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One Turing machine configuration per line, written as ...left[state]right...
 *
 * The lenient form also accepts ( { | as opening and ) } | as closing delimiters around
 * the state, and spaces or dots anywhere outside it. Blank padding at the outer ends is
 * ignored in both forms.
 */
public class ConfigurationSchema implements OutputSchema {
    private static final Pattern STRICT = Pattern.compile("^\\.{3}(\\S*)\\[([^\\]\\s]+)\\](\\S*)\\.{3}$");
    private static final String OPENING = "[({|";
    private static final String CLOSING = "])}|";

    private final Set<Character> alphabet;
    private final char blank;

    /**
     * @param alphabet the tape alphabet, including the blank
     */
    public ConfigurationSchema(Set<Character> alphabet, char blank) {
        this.alphabet = alphabet;
        this.blank = blank;
    }

    public ConfigurationSchema(TuringMachine machine) {
        this(machine.getTapeAlphabet(), machine.getBlank());
    }

    @Override
    public List<Object> parse(List<String> lines) {
        List<Object> result = new ArrayList<>();
        for (String line : lines) {
            Matcher matcher = STRICT.matcher(line);
            if (!matcher.matches() || !inAlphabet(matcher.group(1)) || !inAlphabet(matcher.group(3)))
                return null;
            result.add(new Configuration(matcher.group(2), matcher.group(1), matcher.group(3), blank));
        }
        return result;
    }

    @Override
    public List<Object> parseLenient(List<String> lines) {
        List<Object> result = new ArrayList<>();
        for (String line : lines) {
            Configuration configuration = parseLenient(line);
            if (configuration == null) return null;
            result.add(configuration);
        }
        return result;
    }

    private enum Part { LEFT, STATE, RIGHT }

    Configuration parseLenient(String line) {
        StringBuilder left = new StringBuilder();
        StringBuilder state = new StringBuilder();
        StringBuilder right = new StringBuilder();
        Part part = Part.LEFT;
        for (char c : line.toCharArray()) {
            if (part == Part.STATE) {
                if (CLOSING.indexOf(c) >= 0 && state.length() > 0) part = Part.RIGHT;
                else if (Character.isWhitespace(c)) continue;
                else if (CLOSING.indexOf(c) >= 0 || OPENING.indexOf(c) >= 0) return null;
                else state.append(c);
            }
            else if (alphabet.contains(c))
                (part == Part.LEFT ? left : right).append(c);
            else if (c == ' ' || c == '.') continue;
            else if (part == Part.LEFT && OPENING.indexOf(c) >= 0) part = Part.STATE;
            else return null;
        }
        if (part != Part.RIGHT) return null;
        return new Configuration(state.toString(), left.toString(), right.toString(), blank);
    }

    private boolean inAlphabet(String symbols) {
        for (char c : symbols.toCharArray())
            if (!alphabet.contains(c)) return false;
        return true;
    }

    public String toString() {
        return "configurations over " + alphabet;
    }
}
