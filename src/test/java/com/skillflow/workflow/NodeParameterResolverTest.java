package com.skillflow.workflow;

import com.skillflow.shared.model.ActionOutput;
import com.skillflow.shared.model.SkillException;
import com.skillflow.shared.model.WorkflowEdge;
import com.skillflow.shared.model.WorkflowNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.skillflow.shared.model.SkillException.Kind.PARAMETER_INVALID;
import static org.junit.jupiter.api.Assertions.*;

class NodeParameterResolverTest {

    private final NodeParameterResolver resolver = new NodeParameterResolver();

    private final Map<String, ActionOutput> outputs = Map.of(
            "build", new ActionOutput("target/app.jar", Map.of("exitCode", 0)),
            "count-lines", ActionOutput.of(42));

    @Test
    void wholeReferenceKeepsType() {
        var node = WorkflowNode.skill("n", "s", Map.of("limit", "{{count-lines.output}}", "code", "{{build.exitCode}}"));

        var resolved = resolver.resolve(node, List.of(), Map.of(), outputs);

        assertEquals(42, resolved.get("limit"));
        assertEquals(0, resolved.get("code"));
    }

    @Test
    void embeddedReferencesInterpolate() {
        var node = WorkflowNode.skill("n", "s", Map.of("command", "cp {{build.output}} {{inputs.dest}}/"));

        var resolved = resolver.resolve(node, List.of(), Map.of("dest", "/srv"), outputs);

        assertEquals("cp target/app.jar /srv/", resolved.get("command"));
    }

    @Test
    void staticValuesPassThrough() {
        var node = WorkflowNode.skill("n", "s", Map.of("flag", true, "path", "plain.txt"));

        var resolved = resolver.resolve(node, List.of(), Map.of(), outputs);

        assertEquals(true, resolved.get("flag"));
        assertEquals("plain.txt", resolved.get("path"));
    }

    @Test
    void edgeBindingOverridesStaticValue() {
        var node = WorkflowNode.skill("n", "write_file", Map.of("content", "placeholder", "path", "out.txt"));
        var edge = WorkflowEdge.binding("e1", "build", "n", "content");

        var resolved = resolver.resolve(node, List.of(edge), Map.of(), outputs);

        assertEquals("target/app.jar", resolved.get("content"));
    }

    @Test
    void missingInputIsParameterInvalid() {
        var node = WorkflowNode.skill("n", "s", Map.of("path", "{{inputs.src}}"));

        var e = assertThrows(SkillException.class, () -> resolver.resolve(node, List.of(), Map.of(), outputs));

        assertEquals(PARAMETER_INVALID, e.getKind());
        assertEquals("path", e.getDetail());
    }

    @Test
    void referenceToNodeThatDidNotRunIsParameterInvalid() {
        var node = WorkflowNode.skill("n", "s", Map.of("path", "{{deploy.output}}"));

        assertThrows(SkillException.class, () -> resolver.resolve(node, List.of(), Map.of(), outputs));
    }
}
