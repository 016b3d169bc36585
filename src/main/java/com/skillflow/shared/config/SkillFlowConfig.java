package com.skillflow.shared.config;

public record SkillFlowConfig(
    int serverPort,
    int workerThreads,
    ExecutorConfig executor,
    ApprovalConfig approval,
    String storageDir,
    String skillsDir
) {
    public static SkillFlowConfig defaults() {
        return new SkillFlowConfig(18790, 4, ExecutorConfig.defaults(), ApprovalConfig.defaults(), null, null);
    }
}
