package com.skillflow.workflow;

import com.skillflow.shared.model.ActionOutput;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Predicate over a source node's result that gates the edge's target.
 *
 * <pre>
 * true | false | success
 * output == "text" | output != "text" | output contains "text"
 * output is empty | output is not empty
 * exitCode == 0 | exitCode != 0
 * </pre>
 */
@FunctionalInterface
public interface EdgeCondition {

    Pattern OUTPUT_COMPARE = Pattern.compile("^output\\s*(==|!=)\\s*\"(.*)\"$");
    Pattern OUTPUT_CONTAINS = Pattern.compile("^output\\s+contains\\s+\"(.*)\"$");
    Pattern OUTPUT_EMPTY = Pattern.compile("^output\\s+is\\s+(not\\s+)?empty$");
    Pattern EXIT_CODE = Pattern.compile("^exitCode\\s*(==|!=)\\s*(-?\\d+)$");

    boolean test(ActionOutput output);

    static EdgeCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return output -> true;
        }
        var expr = expression.strip();
        switch (expr) {
            case "true", "success" -> { return output -> true; }
            case "false" -> { return output -> false; }
            default -> { }
        }

        var m = OUTPUT_COMPARE.matcher(expr);
        if (m.matches()) {
            var expected = m.group(2);
            var equal = m.group(1).equals("==");
            return output -> text(output).equals(expected) == equal;
        }
        m = OUTPUT_CONTAINS.matcher(expr);
        if (m.matches()) {
            var needle = m.group(1);
            return output -> text(output).contains(needle);
        }
        m = OUTPUT_EMPTY.matcher(expr);
        if (m.matches()) {
            var negated = m.group(1) != null;
            return output -> text(output).isBlank() != negated;
        }
        m = EXIT_CODE.matcher(expr);
        if (m.matches()) {
            var expected = Integer.parseInt(m.group(2));
            var equal = m.group(1).equals("==");
            return output -> {
                var code = output == null ? null : output.details().get("exitCode");
                if (!(code instanceof Number n)) return false;
                return (n.intValue() == expected) == equal;
            };
        }
        throw new IllegalArgumentException("Unsupported condition: " + expression);
    }

    private static String text(ActionOutput output) {
        if (output == null || output.value() == null) return "";
        return Objects.toString(output.value()).strip();
    }
}
