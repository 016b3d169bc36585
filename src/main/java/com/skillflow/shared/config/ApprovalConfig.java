package com.skillflow.shared.config;

/**
 * @param timeoutSeconds how long a sensitive execution may stay pending; 0 waits indefinitely
 * @param cliPrompt      prompt for decisions on the console
 */
public record ApprovalConfig(long timeoutSeconds, boolean cliPrompt) {
    public static ApprovalConfig defaults() {
        return new ApprovalConfig(0, false);
    }
}
