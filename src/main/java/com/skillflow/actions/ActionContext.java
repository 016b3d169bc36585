package com.skillflow.actions;

/**
 * @param workDir directory relative paths and commands resolve against
 */
public record ActionContext(String executionId, String workDir) {}
