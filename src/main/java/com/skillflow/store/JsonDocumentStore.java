package com.skillflow.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.skillflow.shared.model.AuditEntry;
import com.skillflow.shared.model.SkillDefinition;
import com.skillflow.shared.model.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON documents under one directory: {@code skills.json} and
 * {@code workflows.json} are rewritten whole (temp file, then move);
 * {@code audit.jsonl} gets one line per entry.
 */
public class JsonDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentStore.class);
    static final int VERSION = 1;

    record SkillsDocument(int version, List<SkillDefinition> skills) {}

    record WorkflowsDocument(int version, List<Workflow> workflows) {}

    private final Path dir;
    private final ObjectMapper mapper;

    public JsonDocumentStore(Path dir) {
        this.dir = dir;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create storage directory " + dir, e);
        }
    }

    @Override
    public List<SkillDefinition> loadSkills() {
        var doc = read("skills.json", SkillsDocument.class);
        return doc == null || doc.skills() == null ? List.of() : doc.skills();
    }

    @Override
    public void saveSkills(List<SkillDefinition> skills) {
        write("skills.json", new SkillsDocument(VERSION, skills));
    }

    @Override
    public List<Workflow> loadWorkflows() {
        var doc = read("workflows.json", WorkflowsDocument.class);
        return doc == null || doc.workflows() == null ? List.of() : doc.workflows();
    }

    @Override
    public void saveWorkflows(List<Workflow> workflows) {
        write("workflows.json", new WorkflowsDocument(VERSION, workflows));
    }

    @Override
    public synchronized List<AuditEntry> loadAudit() {
        var file = dir.resolve("audit.jsonl");
        if (!Files.exists(file)) return List.of();
        var entries = new ArrayList<AuditEntry>();
        try {
            for (var line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) continue;
                try {
                    entries.add(mapper.readValue(line, AuditEntry.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable audit line in {}: {}", file, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        return entries;
    }

    @Override
    public synchronized void append(AuditEntry entry) {
        var file = dir.resolve("audit.jsonl");
        try {
            var line = mapper.writeValueAsString(entry) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + file, e);
        }
    }

    private <T> T read(String name, Class<T> type) {
        var file = dir.resolve(name);
        if (!Files.exists(file)) return null;
        try {
            return mapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private synchronized void write(String name, Object document) {
        var file = dir.resolve(name);
        var tmp = dir.resolve(name + ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }
}
