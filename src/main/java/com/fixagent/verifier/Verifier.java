package com.fixagent.verifier;

import com.fixagent.core.model.VerificationResult;
import com.fixagent.sandbox.ExecutionEnvironment;

/**
 * Runs the build/verify step for one project ecosystem inside a prepared sandbox.
 * Implementations: {@link GradleVerifier}, {@link MavenVerifier}, {@link CustomScriptVerifier}.
 */
public interface Verifier {

    /**
     * Verifies the workspace. Never throws: execution failures are reported as
     * an unsuccessful {@link VerificationResult}.
     *
     * @param environment started sandbox holding the merged workspace
     * @param timeoutSec  timeout for the build command
     */
    VerificationResult verify(ExecutionEnvironment environment, int timeoutSec);

    /** Short name used in logs and metrics, e.g. {@code gradle}. */
    String name();
}
