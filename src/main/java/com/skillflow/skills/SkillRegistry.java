package com.skillflow.skills;

import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.SkillException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.skillflow.shared.model.SkillException.Kind.SIGNATURE_INVALID;
import static com.skillflow.shared.model.SkillException.Kind.SKILL_NOT_FOUND;

/**
 * Owns every skill definition. Writes replace an immutable snapshot under a
 * lock; lookups read the current snapshot without locking.
 */
public class SkillRegistry {

    private static final Logger log = LoggerFactory.getLogger(SkillRegistry.class);

    private volatile Map<String, SkillDefinition> skills = Map.of();

    public static SkillRegistry withBuiltins() {
        var registry = new SkillRegistry();
        BuiltinSkills.all().forEach(registry::register);
        return registry;
    }

    public synchronized void register(SkillDefinition definition) {
        validateSignature(definition);
        if (skills.containsKey(definition.id())) {
            throw new SkillException(SIGNATURE_INVALID, "id",
                    "Skill already registered: " + definition.id());
        }
        var next = new LinkedHashMap<>(skills);
        next.put(definition.id(), definition);
        skills = Collections.unmodifiableMap(next);
        log.info("Registered skill '{}' ({} parameters, sensitive={})", definition.id(),
                definition.parameters().size(), SensitivityClassifier.requiresApproval(definition));
        if (SensitivityClassifier.isReserved(definition.id()) && Boolean.FALSE.equals(definition.sensitive())) {
            log.warn("Skill '{}' is always sensitive; sensitive=false is ignored", definition.id());
        }
    }

    public synchronized void replace(SkillDefinition definition) {
        validateSignature(definition);
        if (!skills.containsKey(definition.id())) {
            throw new SkillException(SKILL_NOT_FOUND, definition.id(), "No skill registered: " + definition.id());
        }
        var next = new LinkedHashMap<>(skills);
        next.put(definition.id(), definition);
        skills = Collections.unmodifiableMap(next);
        log.info("Replaced skill '{}'", definition.id());
    }

    public synchronized void unregister(String id) {
        if (!skills.containsKey(id)) {
            throw new SkillException(SKILL_NOT_FOUND, id, "No skill registered: " + id);
        }
        var next = new LinkedHashMap<>(skills);
        next.remove(id);
        skills = Collections.unmodifiableMap(next);
        log.info("Unregistered skill '{}'", id);
    }

    public SkillDefinition lookup(String id) {
        var definition = id == null ? null : skills.get(id);
        if (definition == null) {
            throw new SkillException(SKILL_NOT_FOUND, id, "No skill registered: " + id);
        }
        return definition;
    }

    public boolean contains(String id) {
        return id != null && skills.containsKey(id);
    }

    public List<SkillDefinition> all() {
        return List.copyOf(skills.values());
    }

    static void validateSignature(SkillDefinition definition) {
        if (definition == null) {
            throw new SkillException(SIGNATURE_INVALID, "definition", "Skill definition is required");
        }
        if (definition.id() == null || definition.id().isBlank()) {
            throw new SkillException(SIGNATURE_INVALID, "id", "Skill id is required");
        }
        var names = new HashSet<String>();
        for (int i = 0; i < definition.parameters().size(); i++) {
            var p = definition.parameters().get(i);
            if (p == null || p.name() == null || p.name().isBlank()) {
                throw new SkillException(SIGNATURE_INVALID, "parameters[" + i + "].name",
                        "Parameter " + i + " of '" + definition.id() + "' has no name");
            }
            if (p.type() == null) {
                throw new SkillException(SIGNATURE_INVALID, "parameters[" + i + "].type",
                        "Parameter '" + p.name() + "' of '" + definition.id() + "' has no type");
            }
            if (!names.add(p.name())) {
                throw new SkillException(SIGNATURE_INVALID, "parameters[" + i + "].name",
                        "Duplicate parameter '" + p.name() + "' in '" + definition.id() + "'");
            }
        }
        if (SensitivityClassifier.isReserved(definition.id()) && definition.sensitive() == null) {
            throw new SkillException(SIGNATURE_INVALID, "sensitive",
                    "Reserved skill '" + definition.id() + "' must declare its sensitivity");
        }
    }
}
