package com.skillflow.actions;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{name}}} placeholders of a user-defined command skill.
 * Every substituted value is single-quoted for POSIX shells; absent optional
 * parameters render as nothing.
 */
public final class CommandTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_]+)\\s*}}");

    private CommandTemplate() {}

    public static String render(String template, Map<String, Object> parameters) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        var out = new StringBuilder();
        while (matcher.find()) {
            var value = parameters.get(matcher.group(1));
            var replacement = value == null ? "" : quote(String.valueOf(value));
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
