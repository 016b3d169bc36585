package com.skillflow.security;

import com.skillflow.shared.model.SkillException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.skillflow.shared.model.SkillException.Kind.COMMAND_TIMED_OUT;
import static com.skillflow.shared.model.SkillException.Kind.PATH_NOT_FOUND;
import static com.skillflow.shared.model.SkillException.Kind.PERMISSION_DENIED;
import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class NativeCommandRunnerTest {

    @TempDir
    Path tempDir;

    private final NativeCommandRunner runner = new NativeCommandRunner(List.of(), 1024 * 1024);

    @Test
    void capturesStdoutStderrAndExitCode() {
        var result = runner.run("echo out; echo err 1>&2; exit 3", tempDir.toString(), 10);
        assertEquals("out\n", result.stdout());
        assertEquals("err\n", result.stderr());
        assertEquals(3, result.exitCode());
        assertTrue(result.isError());
    }

    @Test
    void runsInWorkingDirectory() throws Exception {
        Files.writeString(tempDir.resolve("marker.txt"), "x");
        var result = runner.run("ls", tempDir.toString(), 10);
        assertTrue(result.stdout().contains("marker.txt"));
        assertFalse(result.isError());
    }

    @Test
    void timesOut() {
        var e = assertThrows(SkillException.class, () -> runner.run("sleep 5", tempDir.toString(), 1));
        assertEquals(COMMAND_TIMED_OUT, e.getKind());
    }

    @Test
    void rejectsDirectoryOutsideAllowedList() throws Exception {
        var allowed = Files.createDirectory(tempDir.resolve("allowed"));
        var restricted = new NativeCommandRunner(List.of(allowed.toString()), 1024);
        var e = assertThrows(SkillException.class, () -> restricted.run("pwd", tempDir.toString(), 5));
        assertEquals(PERMISSION_DENIED, e.getKind());
        assertFalse(restricted.run("pwd", allowed.toString(), 5).isError());
    }

    @Test
    void rejectsMissingWorkingDirectory() {
        var e = assertThrows(SkillException.class,
                () -> runner.run("pwd", tempDir.resolve("nope").toString(), 5));
        assertEquals(PATH_NOT_FOUND, e.getKind());
    }

    @Test
    void truncatesLargeOutput() {
        var small = new NativeCommandRunner(List.of(), 10);
        var result = small.run("printf '%0100d' 0", tempDir.toString(), 10);
        assertTrue(result.stdout().startsWith("0000000000"));
        assertTrue(result.stdout().contains("[truncated 90 bytes]"));
    }

    @Test
    void sanitizedEnvDropsSecrets() {
        var env = runner.sanitizedEnv();
        assertTrue(env.keySet().stream().allMatch(k ->
                List.of("PATH", "HOME", "TERM", "LANG", "USER", "SHELL", "TMPDIR").contains(k)));
    }
}
