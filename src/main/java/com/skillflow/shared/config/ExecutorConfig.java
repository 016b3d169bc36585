package com.skillflow.shared.config;

import java.util.List;

/**
 * @param allowedDirs working directories terminal commands may run in; empty means any
 */
public record ExecutorConfig(
    long commandTimeoutSeconds,
    int maxOutputBytes,
    List<String> allowedDirs,
    String workDir
) {
    public static ExecutorConfig defaults() {
        return new ExecutorConfig(30, 1_048_576, List.of(), System.getProperty("user.dir"));
    }
}
