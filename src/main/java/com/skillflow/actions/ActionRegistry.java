package com.skillflow.actions;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

public class ActionRegistry {
    private final Map<String, Action> actions = new LinkedHashMap<>();

    public void register(Action action) {
        if (actions.containsKey(action.skillId())) {
            throw new IllegalArgumentException("Duplicate action: " + action.skillId());
        }
        actions.put(action.skillId(), action);
    }

    public Action get(String skillId) {
        return actions.get(skillId);
    }

    public Collection<Action> all() {
        return actions.values();
    }
}
