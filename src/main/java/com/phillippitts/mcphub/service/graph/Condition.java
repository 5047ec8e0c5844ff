package com.phillippitts.mcphub.service.graph;

import com.phillippitts.mcphub.exception.ConfigurationException;
import com.phillippitts.mcphub.exception.MissingStateKeyException;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Edge predicate over pipeline state.
 *
 * <p>Textual form used in configuration:
 * <pre>
 * meeting.has_action_items            truthy
 * !email.has_messages                 falsy
 * request.mode == draft               equals (true, false, numbers, quoted or bare strings)
 * request.mode != 'summary only'      not equals
 * </pre>
 * Truthy means: non-null, not {@code false}, not a zero number, not an empty string,
 * collection or map.
 */
public final class Condition {

    private final String expression;
    private final Set<String> referencedKeys;
    private final Predicate<PipelineState> predicate;

    private Condition(String expression, Set<String> referencedKeys, Predicate<PipelineState> predicate) {
        this.expression = expression;
        this.referencedKeys = Set.copyOf(referencedKeys);
        this.predicate = predicate;
    }

    /**
     * Builds a condition from code. {@code keys} must list every key the predicate reads.
     */
    public static Condition of(String description, Set<String> keys, Predicate<PipelineState> predicate) {
        return new Condition(description, keys, predicate);
    }

    /**
     * Parses the textual form.
     *
     * @throws ConfigurationException on a malformed expression
     */
    public static Condition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Empty edge condition");
        }
        String expr = expression.strip();
        int eq = expr.indexOf("==");
        int ne = expr.indexOf("!=");
        if (eq > 0 || ne > 0) {
            boolean negate = ne > 0 && (eq < 0 || ne < eq);
            int idx = negate ? ne : eq;
            String key = expr.substring(0, idx).strip();
            String literalText = expr.substring(idx + 2).strip();
            requireKey(key, expression);
            if (literalText.isEmpty()) {
                throw new ConfigurationException("Missing literal in edge condition '" + expression + "'");
            }
            Object literal = literal(literalText);
            return new Condition(expr, Set.of(key), state -> {
                boolean equal = matches(read(state, key), literal);
                return negate != equal;
            });
        }
        if (expr.startsWith("!")) {
            String key = expr.substring(1).strip();
            requireKey(key, expression);
            return new Condition(expr, Set.of(key), state -> !truthy(read(state, key)));
        }
        requireKey(expr, expression);
        return new Condition(expr, Set.of(expr), state -> truthy(read(state, expr)));
    }

    /**
     * @throws MissingStateKeyException if a referenced key is absent
     */
    public boolean test(PipelineState state) {
        return predicate.test(state);
    }

    public Set<String> referencedKeys() {
        return referencedKeys;
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }

    private static Object read(PipelineState state, String key) {
        if (!state.contains(key)) {
            throw new MissingStateKeyException(key);
        }
        return state.get(key).orElse(null);
    }

    static boolean truthy(Object v) {
        if (v == null) {
            return false;
        }
        if (v instanceof Boolean b) {
            return b;
        }
        if (v instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (v instanceof CharSequence cs) {
            return !cs.isEmpty();
        }
        if (v instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (v instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    private static boolean matches(Object value, Object literal) {
        if (value == null || literal == null) {
            return value == literal;
        }
        if (value instanceof Number a && literal instanceof Number b) {
            return a.doubleValue() == b.doubleValue();
        }
        if (value instanceof Boolean || literal instanceof Boolean) {
            return Objects.equals(String.valueOf(value), String.valueOf(literal));
        }
        return Objects.equals(value.toString(), literal.toString());
    }

    private static Object literal(String text) {
        if ((text.startsWith("'") && text.endsWith("'") && text.length() >= 2)
                || (text.startsWith("\"") && text.endsWith("\"") && text.length() >= 2)) {
            return text.substring(1, text.length() - 1);
        }
        if ("true".equals(text) || "false".equals(text)) {
            return Boolean.valueOf(text);
        }
        if ("null".equals(text)) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            return text;
        }
    }

    private static void requireKey(String key, String expression) {
        if (key.isEmpty() || !key.matches("[A-Za-z0-9_.\\-]+")) {
            throw new ConfigurationException("Invalid state key '" + key + "' in edge condition '" + expression + "'");
        }
    }
}
