package com.skillflow.audit;

import com.skillflow.shared.model.AuditEntry;

/** Durable sink behind the in-memory audit log. */
public interface AuditJournal {

    AuditJournal NONE = entry -> { };

    void append(AuditEntry entry);
}
