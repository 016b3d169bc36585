package com.skillflow.engine;

import com.skillflow.actions.ActionExecutor;
import com.skillflow.approval.ApprovalGate;
import com.skillflow.approval.CliApprovalNotifier;
import com.skillflow.audit.AuditLog;
import com.skillflow.observability.EngineMetrics;
import com.skillflow.pipeline.ExecutionHandle;
import com.skillflow.pipeline.ExecutionPipeline;
import com.skillflow.security.NativeCommandRunner;
import com.skillflow.shared.config.SkillFlowConfig;
import com.skillflow.shared.model.AuditEntry;
import com.skillflow.shared.model.ExecutionSnapshot;
import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.SkillException;
import com.skillflow.shared.model.Workflow;
import com.skillflow.shared.model.WorkflowResult;
import com.skillflow.skills.BuiltinSkills;
import com.skillflow.skills.SkillLoader;
import com.skillflow.skills.SkillRegistry;
import com.skillflow.store.DocumentStore;
import com.skillflow.store.JsonDocumentStore;
import com.skillflow.workflow.WorkflowEngine;
import com.skillflow.workflow.WorkflowPlan;
import com.skillflow.workflow.WorkflowRepository;
import com.skillflow.workflow.WorkflowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static com.skillflow.shared.model.SkillException.Kind.EXECUTION_NOT_FOUND;
import static com.skillflow.shared.model.SkillException.Kind.SIGNATURE_INVALID;

/**
 * Entry point for hosts: owns the registry, the execution pipeline, the audit
 * log and the workflow engine, and persists user-defined skills.
 */
public class SkillEngine {

    private static final Logger log = LoggerFactory.getLogger(SkillEngine.class);

    private final SkillRegistry registry;
    private final ActionExecutor actionExecutor;
    private final ExecutionPipeline pipeline;
    private final ApprovalGate gate;
    private final AuditLog auditLog;
    private final WorkflowRepository workflows;
    private final WorkflowEngine workflowEngine;
    private final DocumentStore store;
    private final EngineMetrics metrics;

    public SkillEngine(SkillRegistry registry, ActionExecutor actionExecutor, ExecutionPipeline pipeline,
                       ApprovalGate gate, AuditLog auditLog, WorkflowRepository workflows,
                       WorkflowEngine workflowEngine, DocumentStore store, EngineMetrics metrics) {
        this.registry = registry;
        this.actionExecutor = actionExecutor;
        this.pipeline = pipeline;
        this.gate = gate;
        this.auditLog = auditLog;
        this.workflows = workflows;
        this.workflowEngine = workflowEngine;
        this.store = store;
        this.metrics = metrics;
    }

    public static SkillEngine create(SkillFlowConfig config) {
        return create(config, new EngineMetrics(), Clock.systemUTC());
    }

    public static SkillEngine create(SkillFlowConfig config, EngineMetrics metrics, Clock clock) {
        DocumentStore store = config.storageDir() != null && !config.storageDir().isBlank()
                ? new JsonDocumentStore(Path.of(config.storageDir()))
                : DocumentStore.none();

        var registry = SkillRegistry.withBuiltins();
        var runner = new NativeCommandRunner(config.executor());
        var actionExecutor = ActionExecutor.withBuiltins(runner, config.executor());
        for (var skill : store.loadSkills()) {
            registerQuietly(registry, actionExecutor, skill, "storage");
        }
        if (config.skillsDir() != null && !config.skillsDir().isBlank()) {
            for (var skill : SkillLoader.loadFrom(Path.of(config.skillsDir()))) {
                registerQuietly(registry, actionExecutor, skill, config.skillsDir());
            }
        }

        var auditLog = new AuditLog(store);
        auditLog.restore(store.loadAudit());

        var gate = new ApprovalGate(config.approval().timeoutSeconds(), clock);
        if (config.approval().cliPrompt()) {
            gate.addNotifier(new CliApprovalNotifier());
        }

        var workers = Executors.newFixedThreadPool(Math.max(1, config.workerThreads()), daemonThreads("skillflow-worker"));
        var pipeline = new ExecutionPipeline(registry, gate, actionExecutor, auditLog, metrics, workers, clock);

        var repository = new WorkflowRepository(store, clock);
        var workflowEngine = new WorkflowEngine(repository, new WorkflowValidator(registry), pipeline, metrics,
                Executors.newCachedThreadPool(daemonThreads("skillflow-workflow")));

        log.info("Skill engine ready: {} skills, {} audit entries, {} workflows",
                registry.all().size(), auditLog.size(), repository.all().size());
        return new SkillEngine(registry, actionExecutor, pipeline, gate, auditLog, repository, workflowEngine,
                store, metrics);
    }

    public void registerSkill(SkillDefinition definition) {
        checkBound(actionExecutor, definition);
        registry.register(definition);
        persistSkills();
    }

    public void updateSkill(SkillDefinition definition) {
        checkBound(actionExecutor, definition);
        registry.replace(definition);
        persistSkills();
    }

    public void unregisterSkill(String skillId) {
        registry.unregister(skillId);
        persistSkills();
    }

    public List<SkillDefinition> listSkills() {
        return registry.all();
    }

    public ExecutionHandle executeSkill(String skillId, Map<String, Object> parameters) {
        return pipeline.submit(skillId, parameters == null ? Map.of() : parameters);
    }

    public ExecutionSnapshot getExecution(String executionId) {
        return pipeline.find(executionId).orElseThrow(() ->
                new SkillException(EXECUTION_NOT_FOUND, executionId, "No execution " + executionId));
    }

    public List<ExecutionSnapshot> pendingApprovals() {
        return gate.pending();
    }

    public void approveExecution(String executionId) {
        pipeline.approve(executionId);
    }

    public void denyExecution(String executionId) {
        pipeline.deny(executionId);
    }

    /** All entries in append order, or only those of {@code skillId} when it is non-null. */
    public List<AuditEntry> getExecutionHistory(String skillId) {
        return auditLog.history(skillId);
    }

    public Workflow saveWorkflow(Workflow workflow) {
        return workflows.save(workflow);
    }

    public Workflow getWorkflow(String workflowId) {
        return workflows.get(workflowId);
    }

    public List<Workflow> listWorkflows() {
        return workflows.all();
    }

    public void deleteWorkflow(String workflowId) {
        workflows.delete(workflowId);
    }

    public WorkflowPlan validateWorkflow(String workflowId) {
        return workflowEngine.validate(workflows.get(workflowId));
    }

    public CompletableFuture<WorkflowResult> executeWorkflow(String workflowId, Map<String, Object> inputs) {
        return workflowEngine.execute(workflowId, inputs);
    }

    public EngineMetrics metrics() {
        return metrics;
    }

    public void shutdown() {
        log.info("Shutting down skill engine");
        pipeline.shutdown();
        workflowEngine.shutdown();
    }

    private void persistSkills() {
        store.saveSkills(registry.all().stream()
                .filter(s -> !BuiltinSkills.isBuiltin(s.id()))
                .toList());
    }

    private static void checkBound(ActionExecutor actionExecutor, SkillDefinition definition) {
        if (definition != null && definition.id() != null && !actionExecutor.supports(definition)) {
            throw new SkillException(SIGNATURE_INVALID, "commandTemplate",
                    "Skill '" + definition.id() + "' has no built-in action and no command template");
        }
    }

    private static void registerQuietly(SkillRegistry registry, ActionExecutor actionExecutor,
                                        SkillDefinition skill, String source) {
        try {
            checkBound(actionExecutor, skill);
            registry.register(skill);
        } catch (SkillException e) {
            log.warn("Skipping skill '{}' from {}: {}", skill.id(), source, e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            var t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
