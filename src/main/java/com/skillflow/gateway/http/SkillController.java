package com.skillflow.gateway.http;

import com.skillflow.engine.SkillEngine;
import com.skillflow.shared.model.AuditEntry;
import com.skillflow.shared.model.ExecutionSnapshot;
import com.skillflow.shared.model.SkillDefinition;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class SkillController {

    public record ExecuteSkillRequest(String skillId, Map<String, Object> parameters) {}

    private final SkillEngine engine;

    public SkillController(SkillEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/skills")
    public List<SkillDefinition> skills() {
        return engine.listSkills();
    }

    @PostMapping("/skills")
    @ResponseStatus(HttpStatus.CREATED)
    public SkillDefinition register(@RequestBody SkillDefinition definition) {
        engine.registerSkill(definition);
        return definition;
    }

    @PutMapping("/skills/{id}")
    public SkillDefinition update(@PathVariable String id, @RequestBody SkillDefinition definition) {
        if (!id.equals(definition.id())) {
            throw new IllegalArgumentException("Path id '" + id + "' does not match skill id '" + definition.id() + "'");
        }
        engine.updateSkill(definition);
        return definition;
    }

    @DeleteMapping("/skills/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unregister(@PathVariable String id) {
        engine.unregisterSkill(id);
    }

    /** Returns as soon as the execution is minted; sensitive ones show up under {@code /executions/pending}. */
    @PostMapping("/executions")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ExecutionSnapshot execute(@RequestBody ExecuteSkillRequest request) {
        var handle = engine.executeSkill(request.skillId(), request.parameters());
        return engine.getExecution(handle.executionId());
    }

    @GetMapping("/executions/pending")
    public List<ExecutionSnapshot> pending() {
        return engine.pendingApprovals();
    }

    @GetMapping("/executions/{id}")
    public ExecutionSnapshot execution(@PathVariable String id) {
        return engine.getExecution(id);
    }

    @PostMapping("/executions/{id}/approve")
    public ExecutionSnapshot approve(@PathVariable String id) {
        engine.approveExecution(id);
        return engine.getExecution(id);
    }

    @PostMapping("/executions/{id}/deny")
    public ExecutionSnapshot deny(@PathVariable String id) {
        engine.denyExecution(id);
        return engine.getExecution(id);
    }

    @GetMapping("/audit")
    public List<AuditEntry> audit(@RequestParam(required = false) String skillId) {
        return engine.getExecutionHistory(skillId);
    }
}
