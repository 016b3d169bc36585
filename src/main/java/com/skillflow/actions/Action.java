package com.skillflow.actions;

import com.skillflow.shared.model.ActionOutput;

import java.util.Map;

/**
 * Side-effecting implementation behind a built-in skill. Parameters arrive
 * already validated against the skill's signature.
 */
public interface Action {
    String skillId();
    ActionOutput execute(ActionContext ctx, Map<String, Object> parameters);
}
