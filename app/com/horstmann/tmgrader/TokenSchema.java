package com.horstmann.tmgrader;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lines of space-separated fields. Declared NUMBER fields are compared by value, so 3
 * and 3.0 are the same; other tokens are compared exactly. Without declared fields, every
 * line may have any number of tokens, and all of them are compared as text.
 */
public class TokenSchema implements OutputSchema {
    public enum Field { NUMBER, TOKEN }

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final List<Field> fields;

    public TokenSchema(Field... fields) {
        this.fields = Arrays.asList(fields);
    }

    @Override
    public List<Object> parse(List<String> lines) {
        List<Object> result = new ArrayList<>();
        for (String line : lines) {
            List<Object> values = parseLine(line.isEmpty() ? new String[0] : line.split(" ", -1));
            if (values == null) return null;
            result.add(values);
        }
        return result;
    }

    @Override
    public List<Object> parseLenient(List<String> lines) {
        List<Object> result = new ArrayList<>();
        for (String line : lines) {
            List<Object> values = parseLine(line.trim().isEmpty() ? new String[0] : line.trim().split("\\s+"));
            if (values == null) return null;
            result.add(values);
        }
        return result;
    }

    private List<Object> parseLine(String[] tokens) {
        if (!fields.isEmpty() && tokens.length != fields.size()) return null;
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.isEmpty()) return null;
            if (!fields.isEmpty() && fields.get(i) == Field.NUMBER) {
                if (!NUMBER.matcher(token).matches()) return null;
                values.add(number(token));
            }
            else values.add(token);
        }
        return values;
    }

    private static BigDecimal number(String token) {
        BigDecimal value = new BigDecimal(token.startsWith("+") ? token.substring(1) : token);
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    public String toString() {
        return fields.isEmpty() ? "tokens" : fields.toString();
    }
}
