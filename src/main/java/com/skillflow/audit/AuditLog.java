package com.skillflow.audit;

import com.skillflow.shared.model.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only record of terminated executions. Appends are serialized and
 * hold at most one entry per execution id; reads see a consistent snapshot
 * without locking.
 */
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    private final CopyOnWriteArrayList<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private final Set<String> executionIds = new HashSet<>();
    private final AuditJournal journal;

    public AuditLog() {
        this(AuditJournal.NONE);
    }

    public AuditLog(AuditJournal journal) {
        this.journal = journal;
    }

    /** Loads entries written by an earlier run without journaling them again. */
    public synchronized void restore(Collection<AuditEntry> previous) {
        for (var entry : previous) {
            if (executionIds.add(entry.executionId())) {
                entries.add(entry);
            }
        }
    }

    public synchronized void append(AuditEntry entry) {
        if (!executionIds.add(entry.executionId())) {
            throw new IllegalStateException("Execution " + entry.executionId() + " already audited");
        }
        entries.add(entry);
        try {
            journal.append(entry);
        } catch (RuntimeException e) {
            log.error("Failed to journal audit entry for execution {}", entry.executionId(), e);
        }
    }

    public List<AuditEntry> history() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> history(String skillId) {
        if (skillId == null) return history();
        return entries.stream().filter(e -> skillId.equals(e.skillId())).toList();
    }

    public Optional<AuditEntry> find(String executionId) {
        return entries.stream().filter(e -> e.executionId().equals(executionId)).findFirst();
    }

    public int size() {
        return entries.size();
    }
}
