package com.skillflow.actions;

import com.skillflow.security.CommandRunner;
import com.skillflow.shared.config.ExecutorConfig;
import com.skillflow.shared.model.ActionOutput;
import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.SkillException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static com.skillflow.shared.model.SkillException.Kind.SKILL_NOT_FOUND;

/**
 * Dispatches a skill call to its built-in {@link Action}, or to the command
 * runner for skills defined by a command template.
 */
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final ActionRegistry actions;
    private final CommandRunner runner;
    private final long timeoutSeconds;
    private final String workDir;

    public ActionExecutor(ActionRegistry actions, CommandRunner runner, ExecutorConfig config) {
        this.actions = actions;
        this.runner = runner;
        this.timeoutSeconds = config.commandTimeoutSeconds();
        this.workDir = config.workDir();
    }

    public static ActionExecutor withBuiltins(CommandRunner runner, ExecutorConfig config) {
        var registry = new ActionRegistry();
        registry.register(new TerminalCommandAction(runner, config.commandTimeoutSeconds()));
        registry.register(new ReadFileAction());
        registry.register(new WriteFileAction());
        registry.register(new DeleteFileAction());
        registry.register(new ListDirectoryAction());
        return new ActionExecutor(registry, runner, config);
    }

    public boolean supports(SkillDefinition definition) {
        return actions.get(definition.id()) != null
                || (definition.commandTemplate() != null && !definition.commandTemplate().isBlank());
    }

    public ActionOutput execute(String executionId, SkillDefinition definition, Map<String, Object> parameters) {
        var ctx = new ActionContext(executionId, workDir);
        var action = actions.get(definition.id());
        if (action != null) {
            return action.execute(ctx, parameters);
        }
        if (definition.commandTemplate() != null && !definition.commandTemplate().isBlank()) {
            var command = CommandTemplate.render(definition.commandTemplate(), parameters);
            log.info("Execution {} running template skill '{}': {}", executionId, definition.id(), command);
            return TerminalCommandAction.run(runner, command, workDir, timeoutSeconds);
        }
        throw new SkillException(SKILL_NOT_FOUND, definition.id(),
                "No action bound to skill '" + definition.id() + "'");
    }
}
