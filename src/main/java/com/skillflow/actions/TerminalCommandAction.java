package com.skillflow.actions;

import com.skillflow.security.CommandRunner;
import com.skillflow.shared.model.ActionOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class TerminalCommandAction implements Action {

    private static final Logger log = LoggerFactory.getLogger(TerminalCommandAction.class);

    private final CommandRunner runner;
    private final long timeoutSeconds;

    public TerminalCommandAction(CommandRunner runner, long timeoutSeconds) {
        this.runner = runner;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override public String skillId() { return "run_terminal_command"; }

    @Override
    public ActionOutput execute(ActionContext ctx, Map<String, Object> parameters) {
        var command = String.valueOf(parameters.get("command"));
        var workDir = parameters.get("workingDir") != null
                ? ActionPaths.resolve(ctx, parameters.get("workingDir")).toString()
                : ctx.workDir();
        log.info("Execution {} running command in {}: {}", ctx.executionId(), workDir, command);
        return run(runner, command, workDir, timeoutSeconds);
    }

    static ActionOutput run(CommandRunner runner, String command, String workDir, long timeoutSeconds) {
        var result = runner.run(command, workDir, timeoutSeconds);
        var details = new LinkedHashMap<String, Object>();
        details.put("stdout", result.stdout());
        details.put("stderr", result.stderr());
        details.put("exitCode", result.exitCode());
        return new ActionOutput(result.stdout(), details);
    }
}
