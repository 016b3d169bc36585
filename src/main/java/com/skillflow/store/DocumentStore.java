package com.skillflow.store;

import com.skillflow.audit.AuditJournal;
import com.skillflow.shared.model.AuditEntry;
import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.Workflow;

import java.util.List;

/** Load/save boundary for skills, workflows and the audit trail. */
public interface DocumentStore extends AuditJournal {

    List<SkillDefinition> loadSkills();

    void saveSkills(List<SkillDefinition> skills);

    List<Workflow> loadWorkflows();

    void saveWorkflows(List<Workflow> workflows);

    List<AuditEntry> loadAudit();

    /** Keeps nothing; used when no storage directory is configured. */
    static DocumentStore none() {
        return new DocumentStore() {
            @Override public List<SkillDefinition> loadSkills() { return List.of(); }
            @Override public void saveSkills(List<SkillDefinition> skills) { }
            @Override public List<Workflow> loadWorkflows() { return List.of(); }
            @Override public void saveWorkflows(List<Workflow> workflows) { }
            @Override public List<AuditEntry> loadAudit() { return List.of(); }
            @Override public void append(AuditEntry entry) { }
        };
    }
}
