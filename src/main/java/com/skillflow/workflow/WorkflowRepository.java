package com.skillflow.workflow;

import com.skillflow.shared.model.SkillException;
import com.skillflow.shared.model.Workflow;
import com.skillflow.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.skillflow.shared.model.SkillException.Kind.WORKFLOW_NOT_FOUND;

/**
 * Saved workflows. Saving never validates: a cyclic workflow can be stored
 * and only fails when it is executed.
 */
public class WorkflowRepository {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRepository.class);

    private final Map<String, Workflow> workflows = new LinkedHashMap<>();
    private final DocumentStore store;
    private final Clock clock;

    public WorkflowRepository(DocumentStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        for (var workflow : store.loadWorkflows()) {
            workflows.put(workflow.id(), workflow);
        }
        if (!workflows.isEmpty()) {
            log.info("Loaded {} workflows", workflows.size());
        }
    }

    public synchronized Workflow save(Workflow workflow) {
        var now = clock.instant();
        var id = workflow.id() == null || workflow.id().isBlank() ? UUID.randomUUID().toString() : workflow.id();
        var existing = workflows.get(id);
        var saved = workflow.withId(id, existing != null ? existing.createdAt() : now, now);
        workflows.put(id, saved);
        store.saveWorkflows(List.copyOf(workflows.values()));
        log.info("Saved workflow '{}' ({} nodes, {} edges)", id, saved.nodes().size(), saved.edges().size());
        return saved;
    }

    public synchronized Workflow get(String id) {
        var workflow = workflows.get(id);
        if (workflow == null) {
            throw new SkillException(WORKFLOW_NOT_FOUND, id, "No workflow " + id);
        }
        return workflow;
    }

    public synchronized List<Workflow> all() {
        return List.copyOf(workflows.values());
    }

    public synchronized void delete(String id) {
        if (workflows.remove(id) == null) {
            throw new SkillException(WORKFLOW_NOT_FOUND, id, "No workflow " + id);
        }
        store.saveWorkflows(List.copyOf(workflows.values()));
    }
}
