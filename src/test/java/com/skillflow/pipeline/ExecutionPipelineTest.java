package com.skillflow.pipeline;

import com.skillflow.actions.ActionExecutor;
import com.skillflow.approval.ApprovalGate;
import com.skillflow.audit.AuditLog;
import com.skillflow.observability.EngineMetrics;
import com.skillflow.security.CommandResult;
import com.skillflow.security.CommandRunner;
import com.skillflow.shared.config.ExecutorConfig;
import com.skillflow.shared.model.ActionOutput;
import com.skillflow.shared.model.ExecutionStatus;
import com.skillflow.shared.model.SkillException;
import com.skillflow.skills.SkillRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.skillflow.shared.model.SkillException.Kind.ALREADY_DECIDED;
import static com.skillflow.shared.model.SkillException.Kind.APPROVAL_DENIED;
import static com.skillflow.shared.model.SkillException.Kind.APPROVAL_TIMED_OUT;
import static com.skillflow.shared.model.SkillException.Kind.EXECUTION_NOT_FOUND;
import static com.skillflow.shared.model.SkillException.Kind.PARAMETER_INVALID;
import static com.skillflow.shared.model.SkillException.Kind.PATH_NOT_FOUND;
import static com.skillflow.shared.model.SkillException.Kind.SKILL_NOT_FOUND;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionPipelineTest {

    @TempDir
    Path tempDir;

    private final SkillRegistry registry = SkillRegistry.withBuiltins();
    private final AuditLog auditLog = new AuditLog();
    private final EngineMetrics metrics = new EngineMetrics();
    private final ExecutorService workers = Executors.newFixedThreadPool(2);
    private ApprovalGate gate = new ApprovalGate();
    private ExecutionPipeline pipeline;

    @AfterEach
    void tearDown() {
        if (pipeline != null) pipeline.shutdown();
        workers.shutdownNow();
    }

    private ExecutionPipeline pipeline(ActionExecutor actionExecutor) {
        pipeline = new ExecutionPipeline(registry, gate, actionExecutor, auditLog, metrics, workers,
                Clock.systemUTC());
        return pipeline;
    }

    private ExecutionPipeline realPipeline() {
        CommandRunner runner = (command, workDir, timeoutSeconds) -> new CommandResult(command, "", 0);
        var config = new ExecutorConfig(5, 1024, List.of(), tempDir.toString());
        return pipeline(ActionExecutor.withBuiltins(runner, config));
    }

    @Test
    void deniedDeleteLeavesFileInPlace() throws Exception {
        var file = Files.writeString(tempDir.resolve("x"), "keep");
        var pipeline = realPipeline();

        var handle = pipeline.submit("delete_file", Map.of("path", file.toString()));
        assertEquals(ExecutionStatus.PENDING, pipeline.find(handle.executionId()).orElseThrow().status());

        pipeline.deny(handle.executionId());
        var done = handle.await().snapshot();

        assertEquals(ExecutionStatus.FAILED, done.status());
        assertEquals(APPROVAL_DENIED, done.error().kind());
        assertTrue(Files.exists(file));
    }

    @Test
    void approvedDeleteRemovesFile() throws Exception {
        var file = Files.writeString(tempDir.resolve("x"), "bye");
        var pipeline = realPipeline();

        var handle = pipeline.submit("delete_file", Map.of("path", file.toString()));
        pipeline.approve(handle.executionId());
        var done = handle.await().snapshot();

        assertEquals(ExecutionStatus.COMPLETED, done.status());
        assertFalse(Files.exists(file));
        assertNotNull(done.decidedAt());
        assertNotNull(done.completedAt());
    }

    @Test
    void sensitiveSkillNeverReachesExecutorBeforeApproval() {
        var actionExecutor = mock(ActionExecutor.class);
        when(actionExecutor.execute(anyString(), any(), anyMap())).thenReturn(ActionOutput.of("done"));
        var pipeline = pipeline(actionExecutor);

        var handle = pipeline.submit("run_terminal_command", Map.of("command", "rm -rf build"));

        verify(actionExecutor, after(200).never()).execute(anyString(), any(), anyMap());
        pipeline.approve(handle.executionId());
        verify(actionExecutor, timeout(2000)).execute(anyString(), any(), anyMap());
        assertEquals(ExecutionStatus.COMPLETED, handle.await().status());
    }

    @Test
    void deniedExecutionNeverReachesExecutor() {
        var actionExecutor = mock(ActionExecutor.class);
        var pipeline = pipeline(actionExecutor);

        var handle = pipeline.submit("write_file", Map.of("path", "a.txt", "content", "x"));
        pipeline.deny(handle.executionId());
        handle.await();

        verify(actionExecutor, never()).execute(anyString(), any(), anyMap());
    }

    @Test
    void readOnlySkillRunsWithoutApproval() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "hello");
        var pipeline = realPipeline();

        var done = pipeline.submit("read_file", Map.of("path", "a.txt")).await().snapshot();

        assertEquals(ExecutionStatus.COMPLETED, done.status());
        assertEquals("hello", done.result().value());
        assertTrue(gate.pending().isEmpty());
    }

    @Test
    void actionFailureIsRecordedNotThrown() {
        var pipeline = realPipeline();

        var done = pipeline.submit("read_file", Map.of("path", "missing.txt")).await().snapshot();

        assertEquals(ExecutionStatus.FAILED, done.status());
        assertEquals(PATH_NOT_FOUND, done.error().kind());
        assertEquals(1, auditLog.size());
    }

    @Test
    void invalidSubmissionsAreThrownAndNotAudited() {
        var pipeline = realPipeline();

        var unknown = assertThrows(SkillException.class, () -> pipeline.submit("nope", Map.of()));
        var invalid = assertThrows(SkillException.class, () -> pipeline.submit("read_file", Map.of()));

        assertEquals(SKILL_NOT_FOUND, unknown.getKind());
        assertEquals(PARAMETER_INVALID, invalid.getKind());
        assertEquals(0, auditLog.size());
    }

    @Test
    void everyExecutionGetsExactlyOneAuditEntry() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "a");
        var pipeline = realPipeline();

        var read = pipeline.submit("read_file", Map.of("path", "a.txt"));
        var missing = pipeline.submit("read_file", Map.of("path", "b.txt"));
        var denied = pipeline.submit("delete_file", Map.of("path", "a.txt"));
        var approved = pipeline.submit("run_terminal_command", Map.of("command", "echo hi"));
        pipeline.deny(denied.executionId());
        pipeline.approve(approved.executionId());
        List.of(read, missing, denied, approved).forEach(ExecutionHandle::await);

        assertThat(auditLog.history()).extracting(e -> e.executionId())
                .containsExactlyInAnyOrder(read.executionId(), missing.executionId(),
                        denied.executionId(), approved.executionId());
        assertThat(auditLog.history(null)).hasSize(4);
        assertThat(auditLog.history("read_file")).hasSize(2);
        assertEquals(2.0, metrics.skillExecutions("read_file", "completed").count()
                + metrics.skillExecutions("read_file", "failed").count());
    }

    @Test
    void decidingTwiceIsAlreadyDecided() {
        var pipeline = realPipeline();
        var handle = pipeline.submit("write_file", Map.of("path", "a.txt", "content", "x"));
        pipeline.approve(handle.executionId());
        handle.await();

        var e = assertThrows(SkillException.class, () -> pipeline.deny(handle.executionId()));
        assertEquals(ALREADY_DECIDED, e.getKind());
    }

    @Test
    void auditedDecisionIsReleasedFromTheGate() {
        var pipeline = realPipeline();
        var handle = pipeline.submit("write_file", Map.of("path", "a.txt", "content", "x"));
        pipeline.approve(handle.executionId());
        handle.await();

        var fromGate = assertThrows(SkillException.class, () -> gate.deny(handle.executionId()));
        assertEquals(EXECUTION_NOT_FOUND, fromGate.getKind());
        var fromPipeline = assertThrows(SkillException.class, () -> pipeline.approve(handle.executionId()));
        assertEquals(ALREADY_DECIDED, fromPipeline.getKind());
    }

    @Test
    void decidingAnUngatedExecutionIsAlreadyDecided() throws Exception {
        Files.writeString(tempDir.resolve("a.txt"), "a");
        var pipeline = realPipeline();
        var handle = pipeline.submit("read_file", Map.of("path", "a.txt"));
        handle.await();

        var e = assertThrows(SkillException.class, () -> pipeline.approve(handle.executionId()));
        assertEquals(ALREADY_DECIDED, e.getKind());
    }

    @Test
    void decidingUnknownExecutionIsNotFound() {
        var pipeline = realPipeline();
        var e = assertThrows(SkillException.class, () -> pipeline.approve("ghost"));
        assertEquals(EXECUTION_NOT_FOUND, e.getKind());
    }

    @Test
    void expiredApprovalFailsWithTimeout() {
        gate = new ApprovalGate(1, Clock.systemUTC());
        var pipeline = realPipeline();

        var handle = pipeline.submit("write_file", Map.of("path", "a.txt", "content", "x"));
        var done = handle.completion().orTimeout(5, TimeUnit.SECONDS).join().snapshot();

        assertEquals(ExecutionStatus.FAILED, done.status());
        assertEquals(APPROVAL_TIMED_OUT, done.error().kind());
        assertFalse(Files.exists(tempDir.resolve("a.txt")));
    }

    @Test
    void shutdownFailsPendingApprovalsAndAuditsThem() {
        var pipeline = realPipeline();
        var handle = pipeline.submit("delete_file", Map.of("path", "a.txt"));

        pipeline.shutdown();
        var done = handle.completion().orTimeout(5, TimeUnit.SECONDS).join().snapshot();

        assertEquals(ExecutionStatus.FAILED, done.status());
        assertEquals(APPROVAL_DENIED, done.error().kind());
        assertTrue(auditLog.find(handle.executionId()).isPresent());
        assertThrows(IllegalStateException.class, () -> pipeline.submit("read_file", Map.of("path", "a.txt")));
    }
}
