package com.skillflow.skills;

import com.skillflow.shared.model.ParameterType;
import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.SkillParameter;
import com.skillflow.shared.model.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads user-defined skills from YAML files:
 *
 * <pre>
 * id: git_log
 * name: Git log
 * category: git
 * command: git log -n {{count}}
 * output: string
 * parameters:
 *   - name: count
 *     type: number
 * </pre>
 *
 * Command skills are sensitive unless the file says {@code sensitive: false}.
 */
public class SkillLoader {

    private static final Logger log = LoggerFactory.getLogger(SkillLoader.class);

    public static List<SkillDefinition> loadFrom(Path dir) {
        if (dir == null || !Files.isDirectory(dir)) return List.of();
        var yaml = new Yaml();
        try (var stream = Files.list(dir)) {
            return stream
                .filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                .sorted()
                .map(p -> {
                    try (var in = Files.newInputStream(p)) {
                        Map<String, Object> raw = yaml.load(in);
                        return raw == null ? null : toDefinition(raw);
                    } catch (Exception e) {
                        log.warn("Failed to load skill from {}: {}", p, e.getMessage());
                        return null;
                    }
                })
                .filter(Objects::nonNull)
                .toList();
        } catch (IOException e) {
            log.warn("Failed to scan skills directory {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    @SuppressWarnings("unchecked")
    static SkillDefinition toDefinition(Map<String, Object> raw) {
        var params = new ArrayList<SkillParameter>();
        for (var p : (List<Map<String, Object>>) raw.getOrDefault("parameters", List.of())) {
            var type = p.get("type") == null ? null
                    : ParameterType.fromName(String.valueOf(p.get("type")));
            params.add(new SkillParameter(
                    (String) p.get("name"),
                    type,
                    !Boolean.FALSE.equals(p.getOrDefault("required", true)),
                    (String) p.get("description")));
        }
        var command = (String) raw.get("command");
        var sensitive = raw.containsKey("sensitive")
                ? Boolean.valueOf(String.valueOf(raw.get("sensitive")))
                : command != null ? Boolean.TRUE : null;
        var output = raw.get("output") == null ? ValueType.ANY
                : ValueType.fromName(String.valueOf(raw.get("output")));
        return new SkillDefinition(
                (String) raw.get("id"),
                (String) raw.get("name"),
                (String) raw.get("description"),
                (String) raw.getOrDefault("category", "custom"),
                params,
                sensitive,
                output,
                command);
    }
}
