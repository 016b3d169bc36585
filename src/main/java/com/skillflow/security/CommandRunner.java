package com.skillflow.security;

import com.skillflow.shared.model.SkillException;

public interface CommandRunner {

    /**
     * Runs a shell command to completion.
     *
     * @throws SkillException {@code COMMAND_TIMED_OUT}, {@code SPAWN_FAILED},
     *                        {@code PATH_NOT_FOUND} or {@code PERMISSION_DENIED}
     */
    CommandResult run(String command, String workDir, long timeoutSeconds);
}
