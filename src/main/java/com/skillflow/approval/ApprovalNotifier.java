package com.skillflow.approval;

import com.skillflow.shared.model.ExecutionSnapshot;

/**
 * Surfaces a pending execution to the operator: title is the skill name,
 * body the parameters, actions {@link ApprovalGate#approve} and
 * {@link ApprovalGate#deny}. Must not block the caller.
 */
@FunctionalInterface
public interface ApprovalNotifier {
    void approvalRequested(ExecutionSnapshot execution, ApprovalGate gate);
}
