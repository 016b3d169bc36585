package com.skillflow.security;

import com.skillflow.shared.config.ExecutorConfig;
import com.skillflow.shared.model.SkillException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.skillflow.shared.model.SkillException.Kind.COMMAND_TIMED_OUT;
import static com.skillflow.shared.model.SkillException.Kind.IO_ERROR;
import static com.skillflow.shared.model.SkillException.Kind.PATH_NOT_FOUND;
import static com.skillflow.shared.model.SkillException.Kind.PERMISSION_DENIED;
import static com.skillflow.shared.model.SkillException.Kind.SPAWN_FAILED;

/**
 * Runs commands through the host shell. Stdout and stderr are drained on
 * separate threads and capped at {@code maxOutputBytes} each.
 */
public class NativeCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(NativeCommandRunner.class);

    private static final Set<String> UNIX_ENV = Set.of(
            "PATH", "HOME", "TERM", "LANG", "USER", "SHELL", "TMPDIR");
    private static final Set<String> WIN_ENV = Set.of(
            "PATH", "SystemRoot", "ComSpec", "TEMP", "TMP", "USERPROFILE", "HOMEDRIVE", "HOMEPATH");

    private final List<String> allowedDirs;
    private final int maxOutputBytes;

    public NativeCommandRunner(ExecutorConfig config) {
        this(config.allowedDirs(), config.maxOutputBytes());
    }

    public NativeCommandRunner(List<String> allowedDirs, int maxOutputBytes) {
        this.allowedDirs = allowedDirs;
        this.maxOutputBytes = maxOutputBytes;
    }

    @Override
    public CommandResult run(String command, String workDir, long timeoutSeconds) {
        if (workDir != null) {
            if (!isAllowedDir(workDir)) {
                throw new SkillException(PERMISSION_DENIED, "workingDir",
                        "Working directory not in allowed list: " + workDir);
            }
            if (!new File(workDir).isDirectory()) {
                throw new SkillException(PATH_NOT_FOUND, "workingDir",
                        "Working directory does not exist: " + workDir);
            }
        }

        var shell = isWindows()
                ? new String[]{"cmd", "/c", command}
                : new String[]{"bash", "-c", command};
        var pb = new ProcessBuilder(shell);
        if (workDir != null) pb.directory(new File(workDir));
        pb.environment().clear();
        pb.environment().putAll(sanitizedEnv());

        Process proc;
        try {
            proc = pb.start();
        } catch (IOException e) {
            throw new SkillException(SPAWN_FAILED, null, "Failed to start command: " + e.getMessage(), e);
        }
        log.debug("Started pid {} in {}: {}", proc.pid(), workDir, command);

        var stdout = new CappedBuffer(maxOutputBytes);
        var stderr = new CappedBuffer(maxOutputBytes);
        var outPump = drain(proc.getInputStream(), stdout, "stdout");
        var errPump = drain(proc.getErrorStream(), stderr, "stderr");
        try {
            if (!proc.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                proc.destroyForcibly();
                outPump.join(5000);
                errPump.join(5000);
                throw new SkillException(COMMAND_TIMED_OUT, null,
                        "Command exceeded " + timeoutSeconds + "s");
            }
            outPump.join(5000);
            errPump.join(5000);
        } catch (InterruptedException e) {
            proc.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SkillException(IO_ERROR, null, "Interrupted while waiting for command", e);
        }
        return new CommandResult(stdout.text(), stderr.text(), proc.exitValue());
    }

    private Thread drain(InputStream in, OutputStream sink, String stream) {
        var t = new Thread(() -> {
            try (in) {
                in.transferTo(sink);
            } catch (IOException e) {
                log.debug("Stopped reading {}: {}", stream, e.getMessage());
            }
        }, "skillflow-" + stream);
        t.setDaemon(true);
        t.start();
        return t;
    }

    private boolean isAllowedDir(String dir) {
        if (allowedDirs.isEmpty()) return true;
        var normalized = Path.of(dir).toAbsolutePath().normalize();
        return allowedDirs.stream()
                .anyMatch(a -> normalized.startsWith(Path.of(a).toAbsolutePath().normalize()));
    }

    Map<String, String> sanitizedEnv() {
        var allowed = isWindows() ? WIN_ENV : UNIX_ENV;
        return System.getenv().entrySet().stream()
                .filter(e -> allowed.contains(e.getKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().contains("win");
    }

    /** Keeps the first {@code limit} bytes and counts the rest. */
    static final class CappedBuffer extends OutputStream {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final int limit;
        private long dropped;

        CappedBuffer(int limit) {
            this.limit = limit;
        }

        @Override
        public synchronized void write(int b) {
            if (buffer.size() < limit) buffer.write(b);
            else dropped++;
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) {
            int room = Math.max(0, limit - buffer.size());
            int kept = Math.min(room, len);
            buffer.write(b, off, kept);
            dropped += len - kept;
        }

        synchronized String text() {
            var text = buffer.toString(StandardCharsets.UTF_8);
            return dropped > 0 ? text + "\n[truncated " + dropped + " bytes]" : text;
        }
    }
}
