package com.skillflow.approval;

public enum ApprovalDecision {
    APPROVED,
    DENIED,
    /** No decision before the configured approval timeout. */
    EXPIRED,
    /** The gate shut down while the execution was pending. */
    WITHDRAWN
}
