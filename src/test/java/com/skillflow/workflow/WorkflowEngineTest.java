package com.skillflow.workflow;

import com.skillflow.actions.ActionExecutor;
import com.skillflow.approval.ApprovalGate;
import com.skillflow.audit.AuditLog;
import com.skillflow.observability.EngineMetrics;
import com.skillflow.pipeline.ExecutionPipeline;
import com.skillflow.security.CommandResult;
import com.skillflow.security.CommandRunner;
import com.skillflow.shared.config.ExecutorConfig;
import com.skillflow.shared.model.ParameterType;
import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.SkillException;
import com.skillflow.shared.model.SkillParameter;
import com.skillflow.shared.model.ValueType;
import com.skillflow.shared.model.Workflow;
import com.skillflow.shared.model.WorkflowEdge;
import com.skillflow.shared.model.WorkflowNode;
import com.skillflow.shared.model.WorkflowResult;
import com.skillflow.skills.SkillRegistry;
import com.skillflow.store.DocumentStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.skillflow.shared.model.SkillException.Kind.APPROVAL_DENIED;
import static com.skillflow.shared.model.SkillException.Kind.CYCLIC_GRAPH;
import static com.skillflow.shared.model.SkillException.Kind.PATH_NOT_FOUND;
import static com.skillflow.shared.model.SkillException.Kind.WORKFLOW_NODE_FAILED;
import static com.skillflow.shared.model.SkillException.Kind.WORKFLOW_NOT_FOUND;
import static org.junit.jupiter.api.Assertions.*;

class WorkflowEngineTest {

    @TempDir
    Path tempDir;

    private final List<String> commands = Collections.synchronizedList(new ArrayList<>());
    private final SkillRegistry registry = SkillRegistry.withBuiltins();
    private final ApprovalGate gate = new ApprovalGate();
    private final AuditLog auditLog = new AuditLog();
    private final EngineMetrics metrics = new EngineMetrics();
    private ExecutionPipeline pipeline;
    private WorkflowRepository repository;
    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        CommandRunner runner = (command, workDir, timeoutSeconds) -> {
            commands.add(command);
            return new CommandResult(command.replace("'", ""), "", command.contains("fail") ? 1 : 0);
        };
        var config = new ExecutorConfig(5, 1024, List.of(), tempDir.toString());
        registry.register(new SkillDefinition("echo", "Echo", null, "text",
                List.of(SkillParameter.required("text", ParameterType.STRING)), false, ValueType.STRING,
                "echo {{text}}"));
        pipeline = new ExecutionPipeline(registry, gate, ActionExecutor.withBuiltins(runner, config), auditLog,
                metrics, Executors.newFixedThreadPool(2), Clock.systemUTC());
        repository = new WorkflowRepository(DocumentStore.none(), Clock.systemUTC());
        engine = new WorkflowEngine(repository, new WorkflowValidator(registry), pipeline, metrics,
                Executors.newSingleThreadExecutor());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
        pipeline.shutdown();
    }

    private WorkflowResult run(Workflow workflow, Map<String, Object> inputs) {
        var saved = repository.save(workflow);
        return engine.execute(saved.id(), inputs).orTimeout(10, TimeUnit.SECONDS).join();
    }

    @Test
    void copiesFileThroughApprovedWrite() throws Exception {
        Files.writeString(tempDir.resolve("in.txt"), "payload");
        gate.addNotifier((execution, g) -> g.approve(execution.id()));
        var workflow = new Workflow(null, "copy",
                List.of(WorkflowNode.skill("read", "read_file", Map.of("path", "{{inputs.src}}")),
                        WorkflowNode.skill("write", "write_file", Map.of("path", "{{inputs.dst}}"))),
                List.of(WorkflowEdge.binding("e1", "read", "write", "content")));

        var result = run(workflow, Map.of("src", "in.txt", "dst", "out/copy.txt"));

        assertTrue(result.success());
        assertEquals(List.of("read", "write"), result.executedNodes());
        assertEquals("payload", Files.readString(tempDir.resolve("out/copy.txt")));
        assertEquals(2, result.executionIds().size());
        assertEquals(2, auditLog.size());
    }

    @Test
    void failedNodeHaltsAndEarlierEffectsRemain() throws Exception {
        gate.addNotifier((execution, g) -> g.approve(execution.id()));
        var workflow = new Workflow("chain", "chain",
                List.of(WorkflowNode.skill("A", "write_file", Map.of("path", "a.txt", "content", "from A")),
                        WorkflowNode.skill("B", "read_file", Map.of("path", "missing.txt")),
                        WorkflowNode.skill("C", "echo", Map.of("text", "never"))),
                List.of(WorkflowEdge.of("e1", "A", "B"), WorkflowEdge.of("e2", "B", "C")));

        var result = run(workflow, Map.of());

        assertFalse(result.success());
        assertEquals(List.of("A", "B"), result.executedNodes());
        assertEquals("B", result.failedNode());
        assertEquals(WORKFLOW_NODE_FAILED, result.error().kind());
        assertEquals(PATH_NOT_FOUND, result.nodeError().kind());
        assertEquals("from A", Files.readString(tempDir.resolve("a.txt")));
        assertTrue(commands.isEmpty());
    }

    @Test
    void deniedNodeFailsTheRun() {
        gate.addNotifier((execution, g) -> g.deny(execution.id()));
        var workflow = new Workflow("deny", "deny",
                List.of(WorkflowNode.skill("rm", "delete_file", Map.of("path", "x"))), List.of());

        var result = run(workflow, Map.of());

        assertFalse(result.success());
        assertEquals("rm", result.failedNode());
        assertEquals(APPROVAL_DENIED, result.nodeError().kind());
    }

    @Test
    void outputsFeedLaterTemplates() {
        var workflow = new Workflow("tmpl", "tmpl",
                List.of(WorkflowNode.skill("first", "echo", Map.of("text", "{{inputs.name}}")),
                        WorkflowNode.skill("second", "echo", Map.of("text", "got {{first.output}}"))),
                List.of(WorkflowEdge.of("e1", "first", "second")));

        var result = run(workflow, Map.of("name", "ada"));

        assertTrue(result.success());
        assertEquals(List.of("echo 'ada'", "echo 'got echo ada'"), commands);
        assertEquals("echo got echo ada", result.nodeOutputs().get("second").value());
    }

    @Test
    void conditionalEdgesSkipBranches() {
        var workflow = new Workflow("cond", "cond",
                List.of(WorkflowNode.skill("check", "echo", Map.of("text", "fail")),
                        WorkflowNode.skill("onSuccess", "echo", Map.of("text", "deploy")),
                        WorkflowNode.skill("onFailure", "echo", Map.of("text", "alert")),
                        WorkflowNode.skill("afterDeploy", "echo", Map.of("text", "notify"))),
                List.of(WorkflowEdge.when("e1", "check", "onSuccess", "exitCode == 0"),
                        WorkflowEdge.when("e2", "check", "onFailure", "exitCode != 0"),
                        WorkflowEdge.of("e3", "onSuccess", "afterDeploy")));

        var result = run(workflow, Map.of());

        assertTrue(result.success());
        assertEquals(List.of("check", "onFailure"), result.executedNodes());
        assertEquals(List.of("onSuccess", "afterDeploy"), result.skippedNodes());
    }

    @Test
    void cyclicWorkflowCanBeSavedButNotExecuted() {
        var saved = repository.save(new Workflow("loop", "loop",
                List.of(WorkflowNode.skill("a", "echo", Map.of("text", "a")),
                        WorkflowNode.skill("b", "echo", Map.of("text", "b"))),
                List.of(WorkflowEdge.of("e1", "a", "b"), WorkflowEdge.of("e2", "b", "a"))));

        var e = assertThrows(SkillException.class, () -> engine.execute(saved.id(), Map.of()));

        assertEquals(CYCLIC_GRAPH, e.getKind());
        assertTrue(commands.isEmpty());
    }

    @Test
    void unknownWorkflowIsNotFound() {
        var e = assertThrows(SkillException.class, () -> engine.execute("ghost", Map.of()));
        assertEquals(WORKFLOW_NOT_FOUND, e.getKind());
    }

    @Test
    void countsRuns() {
        run(new Workflow("ok", "ok", List.of(WorkflowNode.skill("a", "echo", Map.of("text", "a"))), List.of()),
                Map.of());
        assertEquals(1.0, metrics.workflowRuns("success").count());
    }

    @Test
    void closedPipelineFailsTheNodeInsteadOfTheRun() {
        var workflow = new Workflow("late", "late",
                List.of(WorkflowNode.skill("A", "echo", Map.of("text", "hi"))), List.of());
        var plan = new WorkflowValidator(registry).validate(workflow);
        pipeline.shutdown();

        var result = engine.run(plan, Map.of());

        assertFalse(result.success());
        assertEquals("A", result.failedNode());
        assertEquals(WORKFLOW_NODE_FAILED, result.error().kind());
        assertEquals(APPROVAL_DENIED, result.nodeError().kind());
    }
}
