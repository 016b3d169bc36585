package com.skillflow.pipeline;

import com.skillflow.shared.model.SkillExecution;

import java.util.concurrent.CompletableFuture;

/**
 * Returned as soon as an execution id is minted. Poll by id or wait on
 * {@link #completion()}, which always completes normally with the terminal execution.
 */
public record ExecutionHandle(String executionId, CompletableFuture<SkillExecution> completion) {

    public SkillExecution await() {
        return completion.join();
    }
}
