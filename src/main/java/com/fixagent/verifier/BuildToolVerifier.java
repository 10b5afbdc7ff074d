package com.fixagent.verifier;

import com.fixagent.core.model.VerificationResult;
import com.fixagent.sandbox.ExecResult;
import com.fixagent.sandbox.ExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared verification flow for build tools that ship an optional wrapper script:
 * probe for the wrapper, make it executable, run one build command, map the
 * exit code to success.
 */
public abstract class BuildToolVerifier implements Verifier {

    private static final Logger log = LoggerFactory.getLogger(BuildToolVerifier.class);

    static final int PROBE_TIMEOUT_SECONDS = 10;
    static final String COMPILATION_FAILED = "Compilation failed - see output";

    /** Wrapper script relative to the workspace, e.g. {@code ./gradlew}. */
    protected abstract String wrapper();

    /** Executable used when the project has no wrapper. */
    protected abstract String systemExecutable();

    /** Build arguments appended to the executable. */
    protected abstract String buildArguments();

    /** Logical build tasks the command runs, in order. */
    protected abstract List<String> buildTasks();

    @Override
    public VerificationResult verify(ExecutionEnvironment environment, int timeoutSec) {
        long startNanos = System.nanoTime();
        var tasksRun = new ArrayList<String>();

        try {
            String executable;
            ExecResult probe = environment.execute(
                    "test -f " + wrapper() + " && echo 'yes' || echo 'no'", PROBE_TIMEOUT_SECONDS);

            if (probe.stdout().contains("yes")) {
                executable = wrapper();
                ExecResult chmod = environment.execute("chmod +x " + wrapper(), PROBE_TIMEOUT_SECONDS);
                if (!chmod.succeeded()) {
                    log.warn("Could not make {} executable: {}", wrapper(), chmod.stderr().strip());
                    return new VerificationResult(false, chmod.stderr(), elapsed(startNanos),
                            "Failed to make " + wrapperName() + " executable", List.of());
                }
            } else {
                executable = systemExecutable();
            }

            tasksRun.addAll(buildTasks());
            String command = executable + " " + buildArguments();
            log.info("Running {} verification: {} (timeout {}s)", name(), command, timeoutSec);

            ExecResult result = environment.execute(command, timeoutSec);
            boolean success = result.succeeded();
            log.info("{} verification {} with exit code {} in {}s",
                    name(), success ? "passed" : "failed", result.exitCode(),
                    String.format("%.1f", result.durationSec()));

            return new VerificationResult(
                    success,
                    result.stdout() + "\n" + result.stderr(),
                    elapsed(startNanos),
                    success ? null : COMPILATION_FAILED,
                    tasksRun);
        } catch (Exception e) {
            log.error("{} verification raised: {}", name(), e.getMessage());
            return new VerificationResult(false, describe(e), elapsed(startNanos),
                    "Verification exception: " + describe(e), tasksRun);
        }
    }

    private String wrapperName() {
        String w = wrapper();
        return w.startsWith("./") ? w.substring(2) : w;
    }

    static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }

    static double elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
