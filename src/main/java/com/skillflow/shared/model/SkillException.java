package com.skillflow.shared.model;

/**
 * Every failure the engine reports, classified by {@link Kind}.
 *
 * Registration and validation failures are thrown to the caller. Once an
 * execution id exists the same kinds are recorded in the execution's
 * {@link ExecutionError} instead of being thrown.
 */
public class SkillException extends RuntimeException {

    public enum Kind {
        SIGNATURE_INVALID,
        SKILL_NOT_FOUND,
        PARAMETER_INVALID,
        APPROVAL_DENIED,
        APPROVAL_TIMED_OUT,
        EXECUTION_NOT_FOUND,
        ALREADY_DECIDED,
        COMMAND_TIMED_OUT,
        SPAWN_FAILED,
        PATH_NOT_FOUND,
        PERMISSION_DENIED,
        IO_ERROR,
        CYCLIC_GRAPH,
        TYPE_MISMATCH,
        INVALID_WORKFLOW,
        WORKFLOW_NOT_FOUND,
        WORKFLOW_NODE_FAILED
    }

    private final Kind kind;
    private final String detail;
    private final String reason;

    public SkillException(Kind kind, String message) {
        this(kind, null, message, null);
    }

    public SkillException(Kind kind, String detail, String message) {
        this(kind, detail, message, null);
    }

    public SkillException(Kind kind, String detail, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
        this.detail = detail;
        this.reason = message;
    }

    public Kind getKind() { return kind; }

    /** Field, parameter, edge or node the failure refers to; may be null. */
    public String getDetail() { return detail; }

    /** Message without the kind prefix. */
    public String getReason() { return reason; }
}
