package com.skillflow.skills;

import com.skillflow.shared.model.SkillDefinition;

import java.util.Set;

/**
 * Decides which skills need a human decision before they run. The reserved
 * built-ins are sensitive whatever flag they were registered with. Command
 * skills are sensitive unless they explicitly say {@code sensitive=false}.
 */
public final class SensitivityClassifier {

    public static final Set<String> RESERVED = Set.of(
            "run_terminal_command", "write_file", "delete_file");

    private SensitivityClassifier() {}

    public static boolean isReserved(String skillId) {
        return RESERVED.contains(skillId);
    }

    public static boolean requiresApproval(SkillDefinition definition) {
        if (isReserved(definition.id()) || Boolean.TRUE.equals(definition.sensitive())) return true;
        return definition.commandTemplate() != null && definition.sensitive() == null;
    }
}
