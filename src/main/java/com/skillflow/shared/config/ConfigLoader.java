package com.skillflow.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".skillflow", "config.yaml"
    );

    public static SkillFlowConfig load() {
        return load(DEFAULT_PATH);
    }

    @SuppressWarnings("unchecked")
    public static SkillFlowConfig load(Path path) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var defaults = SkillFlowConfig.defaults();
        var server = (Map<String, Object>) raw.getOrDefault("server", Map.of());
        var pipeline = (Map<String, Object>) raw.getOrDefault("pipeline", Map.of());
        var executor = (Map<String, Object>) raw.getOrDefault("executor", Map.of());
        var approval = (Map<String, Object>) raw.getOrDefault("approval", Map.of());
        var storage = (Map<String, Object>) raw.getOrDefault("storage", Map.of());
        var skills = (Map<String, Object>) raw.getOrDefault("skills", Map.of());

        return new SkillFlowConfig(
            Integer.parseInt(envOrDefault("SKILLFLOW_PORT",
                String.valueOf(server.getOrDefault("port", defaults.serverPort())))),
            Integer.parseInt(String.valueOf(pipeline.getOrDefault("worker-threads", defaults.workerThreads()))),
            parseExecutorConfig(executor),
            parseApprovalConfig(approval),
            envOrDefault("SKILLFLOW_STORAGE_DIR", (String) storage.get("dir")),
            envOrDefault("SKILLFLOW_SKILLS_DIR", (String) skills.get("dir"))
        );
    }

    private static ExecutorConfig parseExecutorConfig(Map<String, Object> executor) {
        var defaults = ExecutorConfig.defaults();
        var allowed = executor.containsKey("allowed-dirs")
                ? ((List<?>) executor.get("allowed-dirs")).stream().map(String::valueOf).toList()
                : defaults.allowedDirs();
        var timeout = Long.parseLong(String.valueOf(
                executor.getOrDefault("command-timeout-seconds", defaults.commandTimeoutSeconds())));
        if (timeout <= 0) {
            throw new IllegalArgumentException("executor.command-timeout-seconds must be positive, got " + timeout);
        }
        return new ExecutorConfig(
            timeout,
            Integer.parseInt(String.valueOf(executor.getOrDefault("max-output-bytes", defaults.maxOutputBytes()))),
            allowed,
            String.valueOf(executor.getOrDefault("work-dir", defaults.workDir()))
        );
    }

    private static ApprovalConfig parseApprovalConfig(Map<String, Object> approval) {
        var defaults = ApprovalConfig.defaults();
        return new ApprovalConfig(
            Long.parseLong(String.valueOf(approval.getOrDefault("timeout-seconds", defaults.timeoutSeconds()))),
            Boolean.TRUE.equals(approval.getOrDefault("cli-prompt", defaults.cliPrompt()))
        );
    }

    private static String envOrDefault(String env, String fallback) {
        var val = System.getenv(env);
        return val != null ? val : fallback;
    }
}
