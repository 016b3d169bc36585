package com.skillflow.workflow;

import com.skillflow.shared.model.ActionOutput;
import com.skillflow.shared.model.SkillException;
import com.skillflow.shared.model.WorkflowEdge;
import com.skillflow.shared.model.WorkflowNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.skillflow.shared.model.SkillException.Kind.PARAMETER_INVALID;

/**
 * Resolves a node's parameters before it runs.
 *
 * <ul>
 *   <li>{@code {{inputs.name}}} reads a workflow input;</li>
 *   <li>{@code {{nodeId.output}}} reads an earlier node's output value;</li>
 *   <li>{@code {{nodeId.key}}} reads a detail of that output, e.g. {@code exitCode}.</li>
 * </ul>
 * A value that is exactly one reference keeps the referenced type; references
 * embedded in longer text are interpolated as strings. Edges with a target
 * parameter then overwrite that parameter with the source output.
 */
public class NodeParameterResolver {

    private static final Pattern REFERENCE =
            Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_-]+)\\.([a-zA-Z0-9_]+)\\s*}}");

    public Map<String, Object> resolve(WorkflowNode node, List<WorkflowEdge> incoming,
                                       Map<String, Object> inputs, Map<String, ActionOutput> outputs) {
        var resolved = new LinkedHashMap<String, Object>();
        for (var entry : node.parameters().entrySet()) {
            resolved.put(entry.getKey(), resolveValue(entry.getKey(), entry.getValue(), inputs, outputs));
        }
        for (var edge : incoming) {
            if (edge.targetParameter() == null || edge.targetParameter().isBlank()) continue;
            var source = outputs.get(edge.sourceNodeId());
            resolved.put(edge.targetParameter(), source == null ? null : source.value());
        }
        return resolved;
    }

    private Object resolveValue(String key, Object raw, Map<String, Object> inputs, Map<String, ActionOutput> outputs) {
        if (!(raw instanceof String text)) return raw;
        Matcher whole = REFERENCE.matcher(text.strip());
        if (whole.matches()) {
            return lookup(key, whole.group(1), whole.group(2), inputs, outputs);
        }
        Matcher m = REFERENCE.matcher(text);
        var out = new StringBuilder();
        while (m.find()) {
            var value = lookup(key, m.group(1), m.group(2), inputs, outputs);
            m.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(value)));
        }
        m.appendTail(out);
        return out.toString();
    }

    private Object lookup(String key, String scope, String field,
                          Map<String, Object> inputs, Map<String, ActionOutput> outputs) {
        if ("inputs".equals(scope)) {
            if (!inputs.containsKey(field)) {
                throw new SkillException(PARAMETER_INVALID, key, "Missing workflow input '" + field + "'");
            }
            return inputs.get(field);
        }
        var output = outputs.get(scope);
        if (output == null) {
            throw new SkillException(PARAMETER_INVALID, key,
                    "Parameter '" + key + "' refers to node '" + scope + "' which has not run");
        }
        if ("output".equals(field)) return output.value();
        if (!output.details().containsKey(field)) {
            throw new SkillException(PARAMETER_INVALID, key,
                    "Node '" + scope + "' has no output detail '" + field + "'");
        }
        return output.details().get(field);
    }
}
