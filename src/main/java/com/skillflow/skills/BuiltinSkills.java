package com.skillflow.skills;

import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.ValueType;

import java.util.List;

import static com.skillflow.shared.model.ParameterType.PATH;
import static com.skillflow.shared.model.ParameterType.STRING;
import static com.skillflow.shared.model.SkillParameter.optional;
import static com.skillflow.shared.model.SkillParameter.required;

public final class BuiltinSkills {

    public static final SkillDefinition RUN_TERMINAL_COMMAND = new SkillDefinition(
            "run_terminal_command", "Run terminal command",
            "Run a shell command and capture stdout, stderr and exit code.", "terminal",
            List.of(required("command", STRING), optional("workingDir", PATH)),
            true, ValueType.STRING, null);

    public static final SkillDefinition READ_FILE = new SkillDefinition(
            "read_file", "Read file", "Read a text file.", "filesystem",
            List.of(required("path", PATH)),
            false, ValueType.STRING, null);

    public static final SkillDefinition WRITE_FILE = new SkillDefinition(
            "write_file", "Write file", "Write text to a file, creating parent directories.", "filesystem",
            List.of(required("path", PATH), required("content", STRING)),
            true, ValueType.PATH, null);

    public static final SkillDefinition DELETE_FILE = new SkillDefinition(
            "delete_file", "Delete file", "Delete a file or an empty directory.", "filesystem",
            List.of(required("path", PATH)),
            true, ValueType.PATH, null);

    public static final SkillDefinition LIST_DIRECTORY = new SkillDefinition(
            "list_directory", "List directory", "List a directory, directories first.", "filesystem",
            List.of(required("path", PATH)),
            false, ValueType.STRING, null);

    private BuiltinSkills() {}

    public static List<SkillDefinition> all() {
        return List.of(RUN_TERMINAL_COMMAND, READ_FILE, WRITE_FILE, DELETE_FILE, LIST_DIRECTORY);
    }

    public static boolean isBuiltin(String skillId) {
        return all().stream().anyMatch(d -> d.id().equals(skillId));
    }
}
