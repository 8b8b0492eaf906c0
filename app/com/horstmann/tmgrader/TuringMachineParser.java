package com.horstmann.tmgrader;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.horstmann.tmgrader.ParseResult.ParseError.Kind;

/**
 * Parses the textual description of a Turing machine:
 *
 * <pre>
 * # comment
 * states: q0, q1, accept
 * input: 0, 1
 * tape: 0, 1, B
 * blank: B
 * start: q0
 * accept: accept
 * reject: qr
 * transitions:
 * q0,1 -&gt; q1,1,R
 * q1,B -&gt; accept,B,S
 * </pre>
 *
 * The blank and reject lines and the transitions header are optional. Symbols are
 * single characters; an alphabet may also be written as one run such as 01#. The word
 * blank may be used for the blank symbol in rules. Moves are L, R and S (or N).
 *
 * Problems are reported in this order: syntax errors, two rules for the same state and
 * symbol, undeclared states or symbols, missing start state.
 */
public class TuringMachineParser {
    private static final char DEFAULT_BLANK = 'B';
    private static final Pattern SEPARATORS = Pattern.compile("[,\\s]+");
    private static final Pattern STATE_NAME = Pattern.compile("[^\\s,()\\[\\]{}]+");
    private static final String BLANK_ALIAS = "blank";

    private static final Map<String, String> KEYS = new HashMap<>();
    static {
        for (String key : new String[] { "states", "input", "tape", "blank", "start", "accept", "reject", "transitions" })
            KEYS.put(key, key);
        KEYS.put("input alphabet", "input");
        KEYS.put("tape alphabet", "tape");
        KEYS.put("start state", "start");
        KEYS.put("accepting", "accept");
        KEYS.put("accept states", "accept");
        KEYS.put("final", "accept");
        KEYS.put("rejecting", "reject");
        KEYS.put("reject states", "reject");
    }

    private static class Rule {
        final int line;
        final String state;
        final String symbol;
        final String target;
        final String write;
        final TuringMachine.Move move;

        Rule(int line, String state, String symbol, String target, String write, TuringMachine.Move move) {
            this.line = line;
            this.state = state;
            this.symbol = symbol;
            this.target = target;
            this.write = write;
            this.move = move;
        }
    }

    private final Map<String, List<String>> sections = new HashMap<>();
    private final Map<String, Integer> sectionLines = new HashMap<>();
    private final List<Rule> rules = new ArrayList<>();
    private ParseResult syntaxError;

    private TuringMachineParser() {
    }

    public static ParseResult parse(String description) {
        return new TuringMachineParser().run(description);
    }

    private ParseResult run(String description) {
        String[] lines = description.replace("\r", "").split("\n", -1);
        for (int i = 0; i < lines.length && syntaxError == null; i++)
            parseLine(i + 1, lines[i].replace("\uFEFF", "").trim());
        if (syntaxError != null) return syntaxError;

        char blank = DEFAULT_BLANK;
        if (sections.containsKey("blank")) {
            List<String> values = sections.get("blank");
            if (values.size() != 1 || values.get(0).length() != 1)
                return ParseResult.error(Kind.SYNTAX, sectionLines.get("blank"), "the blank must be a single character");
            blank = values.get(0).charAt(0);
        }
        Set<Character> input = symbols("input");
        if (syntaxError != null) return syntaxError;
        Set<Character> tape = symbols("tape");
        if (syntaxError != null) return syntaxError;
        if (input.contains(blank))
            return ParseResult.error(Kind.SYNTAX, sectionLines.get("input"), "the blank " + blank + " cannot be an input symbol");
        tape.addAll(input);
        tape.add(blank);
        if (sections.containsKey("start") && sections.get("start").size() != 1)
            return ParseResult.error(Kind.SYNTAX, sectionLines.get("start"), "expected exactly one start state");

        Map<String, Integer> seen = new HashMap<>();
        for (Rule rule : rules) {
            String key = rule.state + "," + symbol(rule.symbol, blank);
            Integer previous = seen.putIfAbsent(key, rule.line);
            if (previous != null)
                return ParseResult.error(Kind.AMBIGUOUS_TRANSITION, rule.line,
                    "state " + rule.state + ", symbol " + symbol(rule.symbol, blank)
                        + " has rules on lines " + previous + " and " + rule.line);
        }

        Set<String> states = new LinkedHashSet<>(sections.getOrDefault("states", List.of()));
        for (Rule rule : rules) {
            String undeclared = null;
            if (!states.contains(rule.state)) undeclared = "state " + rule.state;
            else if (!tape.contains(symbol(rule.symbol, blank))) undeclared = "symbol " + rule.symbol;
            else if (!states.contains(rule.target)) undeclared = "state " + rule.target;
            else if (!tape.contains(symbol(rule.write, blank))) undeclared = "symbol " + rule.write;
            if (undeclared != null)
                return ParseResult.error(Kind.UNDECLARED_SYMBOL, rule.line, "undeclared " + undeclared);
        }
        for (String key : new String[] { "start", "accept", "reject" }) {
            for (String state : sections.getOrDefault(key, List.of()))
                if (!states.contains(state))
                    return ParseResult.error(Kind.UNDECLARED_SYMBOL, sectionLines.get(key), "undeclared state " + state);
        }

        if (!sections.containsKey("start"))
            return ParseResult.error(Kind.MISSING_START, 0, "no start state declared");

        Map<String, Map<Character, TuringMachine.Action>> transitions = new LinkedHashMap<>();
        for (Rule rule : rules)
            transitions.computeIfAbsent(rule.state, k -> new LinkedHashMap<>())
                .put(symbol(rule.symbol, blank), new TuringMachine.Action(rule.target, symbol(rule.write, blank), rule.move));
        return ParseResult.of(new TuringMachine(states, input, tape, blank, transitions,
            sections.get("start").get(0),
            new LinkedHashSet<>(sections.getOrDefault("accept", List.of())),
            new LinkedHashSet<>(sections.getOrDefault("reject", List.of()))));
    }

    private void parseLine(int line, String text) {
        if (text.isEmpty() || text.startsWith("#") || text.startsWith("//")) return;
        int arrow = text.indexOf("->");
        if (arrow >= 0) {
            parseRule(line, text.substring(0, arrow), text.substring(arrow + 2));
            return;
        }
        int colon = text.indexOf(':');
        if (colon < 0) {
            syntaxError(line, "expected a declaration such as states: ... or a rule such as q0,1 -> q1,0,R");
            return;
        }
        String key = KEYS.get(text.substring(0, colon).trim().toLowerCase().replaceAll("\\s+", " "));
        if (key == null) {
            syntaxError(line, "unknown declaration " + text.substring(0, colon).trim());
            return;
        }
        if (sectionLines.containsKey(key)) {
            syntaxError(line, key + " already declared on line " + sectionLines.get(key));
            return;
        }
        sectionLines.put(key, line);
        List<String> values = values(text.substring(colon + 1));
        if (key.equals("transitions")) {
            if (!values.isEmpty()) syntaxError(line, "put each rule on its own line after transitions:");
            return;
        }
        if (!key.equals("input") && !key.equals("tape") && !key.equals("blank")) {
            for (String value : values)
                if (!STATE_NAME.matcher(value).matches()) {
                    syntaxError(line, "invalid state name " + value);
                    return;
                }
        }
        sections.put(key, values);
    }

    private void parseRule(int line, String left, String right) {
        String[] from = SEPARATORS.split(strip(left).trim());
        String[] to = SEPARATORS.split(strip(right).trim());
        if (from.length != 2 || to.length != 3) {
            syntaxError(line, "a rule must have the form state,symbol -> state,symbol,move");
            return;
        }
        TuringMachine.Move move = TuringMachine.Move.parse(to[2]);
        if (move == null) {
            syntaxError(line, "unknown move " + to[2] + " (use L, R or S)");
            return;
        }
        for (String symbol : new String[] { from[1], to[1] })
            if (symbol.length() != 1 && !symbol.equalsIgnoreCase(BLANK_ALIAS)) {
                syntaxError(line, "symbol " + symbol + " is not a single character");
                return;
            }
        for (String state : new String[] { from[0], to[0] })
            if (!STATE_NAME.matcher(state).matches()) {
                syntaxError(line, "invalid state name " + state);
                return;
            }
        rules.add(new Rule(line, from[0], from[1], to[0], to[1], move));
    }

    private Set<Character> symbols(String key) {
        Set<Character> result = new LinkedHashSet<>();
        List<String> values = sections.getOrDefault(key, List.of());
        if (values.size() == 1) {
            // a run of characters such as 01#
            for (char c : values.get(0).toCharArray()) result.add(c);
            return result;
        }
        for (String value : values) {
            if (value.length() != 1) {
                syntaxError(sectionLines.get(key), "symbol " + value + " is not a single character");
                return result;
            }
            result.add(value.charAt(0));
        }
        return result;
    }

    private static char symbol(String s, char blank) {
        return s.equalsIgnoreCase(BLANK_ALIAS) ? blank : s.charAt(0);
    }

    private static List<String> values(String text) {
        List<String> result = new ArrayList<>();
        for (String value : SEPARATORS.split(strip(text.trim()).trim()))
            if (!value.isEmpty()) result.add(value);
        return result;
    }

    /**
     * Removes one pair of enclosing parentheses or braces.
     */
    private static String strip(String s) {
        s = s.trim();
        if (s.length() >= 2 && (s.startsWith("(") && s.endsWith(")") || s.startsWith("{") && s.endsWith("}")))
            return s.substring(1, s.length() - 1);
        return s;
    }

    private void syntaxError(int line, String message) {
        syntaxError = ParseResult.error(Kind.SYNTAX, line, message);
    }
}
