package com.fixagent.verifier;

import com.fixagent.core.model.VerificationResult;
import com.fixagent.sandbox.ExecResult;
import com.fixagent.sandbox.ExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs a task-supplied verification script instead of a build tool.
 * The script is copied into the sandbox and executed from the workspace.
 */
public class CustomScriptVerifier implements Verifier {

    private static final Logger log = LoggerFactory.getLogger(CustomScriptVerifier.class);

    static final String REMOTE_SCRIPT = "/tmp/fixagent-verify.sh";

    private final Path script;

    public CustomScriptVerifier(Path script) {
        this.script = script;
    }

    @Override
    public VerificationResult verify(ExecutionEnvironment environment, int timeoutSec) {
        long startNanos = System.nanoTime();
        try {
            environment.uploadFile(script, REMOTE_SCRIPT);
            ExecResult chmod = environment.execute("chmod +x " + REMOTE_SCRIPT,
                    BuildToolVerifier.PROBE_TIMEOUT_SECONDS);
            if (!chmod.succeeded()) {
                return new VerificationResult(false, chmod.stderr(), BuildToolVerifier.elapsed(startNanos),
                        "Failed to make verification script executable", List.of());
            }

            log.info("Running custom verification script {} (timeout {}s)", script, timeoutSec);
            ExecResult result = environment.execute(REMOTE_SCRIPT, timeoutSec);
            boolean success = result.succeeded();
            return new VerificationResult(
                    success,
                    result.stdout() + "\n" + result.stderr(),
                    BuildToolVerifier.elapsed(startNanos),
                    success ? null : "Verification script failed - see output",
                    List.of("custom"));
        } catch (Exception e) {
            log.error("Custom verification raised: {}", e.getMessage());
            return new VerificationResult(false, BuildToolVerifier.describe(e),
                    BuildToolVerifier.elapsed(startNanos),
                    "Verification exception: " + BuildToolVerifier.describe(e), List.of());
        }
    }

    @Override
    public String name() {
        return "custom";
    }
}
