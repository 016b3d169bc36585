package com.skillflow.gateway.http;

import com.skillflow.engine.SkillEngine;
import com.skillflow.shared.model.Workflow;
import com.skillflow.shared.model.WorkflowResult;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/v1/workflows")
public class WorkflowController {

    public record RunWorkflowRequest(Map<String, Object> inputs) {}

    private final SkillEngine engine;

    public WorkflowController(SkillEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public List<Workflow> workflows() {
        return engine.listWorkflows();
    }

    @PutMapping
    public Workflow save(@RequestBody Workflow workflow) {
        return engine.saveWorkflow(workflow);
    }

    @GetMapping("/{id}")
    public Workflow get(@PathVariable String id) {
        return engine.getWorkflow(id);
    }

    @PostMapping("/{id}/validate")
    public Map<String, Object> validate(@PathVariable String id) {
        var plan = engine.validateWorkflow(id);
        return Map.of("workflowId", id, "valid", true, "order", plan.orderedIds());
    }

    /** Completes when the run ends; sensitive nodes hold the response until they are decided. */
    @PostMapping("/{id}/run")
    public CompletableFuture<WorkflowResult> run(@PathVariable String id,
                                                 @RequestBody(required = false) RunWorkflowRequest request) {
        return engine.executeWorkflow(id, request == null ? Map.of() : request.inputs());
    }
}
