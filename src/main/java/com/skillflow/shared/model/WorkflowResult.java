package com.skillflow.shared.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one workflow run. Nodes that completed before a failure keep
 * their outputs here; their effects are not rolled back.
 *
 * @param executedNodes nodes that ran, in run order, including the failed one
 * @param error         {@code WORKFLOW_NODE_FAILED} wrapping the cause, null on success
 * @param nodeError     the failed node's own error
 */
public record WorkflowResult(
    String workflowId,
    boolean success,
    List<String> executedNodes,
    List<String> skippedNodes,
    String failedNode,
    ExecutionError error,
    ExecutionError nodeError,
    Map<String, ActionOutput> nodeOutputs,
    Map<String, String> executionIds
) {}
