package com.skillflow.approval;

import com.skillflow.shared.model.ExecutionSnapshot;
import com.skillflow.shared.model.SkillException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Prompts on the console, one request at a time, and forwards the answer to
 * the gate. Anything but "y" denies.
 */
public class CliApprovalNotifier implements ApprovalNotifier {

    private static final Logger log = LoggerFactory.getLogger(CliApprovalNotifier.class);

    private final BufferedReader reader;
    private final PrintStream out;
    private final ExecutorService prompter = Executors.newSingleThreadExecutor(r -> {
        var t = new Thread(r, "skillflow-cli-approval");
        t.setDaemon(true);
        return t;
    });

    public CliApprovalNotifier() {
        this(new BufferedReader(new InputStreamReader(System.in)), System.out);
    }

    public CliApprovalNotifier(BufferedReader reader, PrintStream out) {
        this.reader = reader;
        this.out = out;
    }

    @Override
    public void approvalRequested(ExecutionSnapshot execution, ApprovalGate gate) {
        prompter.submit(() -> prompt(execution, gate));
    }

    void prompt(ExecutionSnapshot execution, ApprovalGate gate) {
        if (!gate.isPending(execution.id())) return;
        out.printf("[APPROVAL] Skill '%s' requires confirmation.%n", execution.skillName());
        out.printf("  Parameters: %s%n", execution.parameters());
        out.print("  Allow? (y/n): ");
        out.flush();
        boolean allow;
        try {
            var line = reader.readLine();
            allow = line != null && line.trim().equalsIgnoreCase("y");
        } catch (IOException e) {
            log.warn("Could not read approval answer: {}", e.getMessage());
            allow = false;
        }
        try {
            if (allow) gate.approve(execution.id());
            else gate.deny(execution.id());
        } catch (SkillException e) {
            log.info("Execution {} decided elsewhere: {}", execution.id(), e.getReason());
        }
    }
}
