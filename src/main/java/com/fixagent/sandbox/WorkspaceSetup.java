package com.fixagent.sandbox;

import com.fixagent.core.model.PrInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a freshly started sandbox into a checked-out, PR-merged source tree.
 *
 * <p>Steps, one {@code execute} call each:
 * <ol>
 *   <li>shallow clone of the target branch</li>
 *   <li>fetch the target commit and the PR head into {@code pr-source}</li>
 *   <li>check out the exact target commit</li>
 *   <li>create the {@code mock-merge} branch</li>
 *   <li>merge {@code pr-source} without committing</li>
 * </ol>
 * Failures of steps 1-4 raise {@link WorkspaceException}. A failed merge does
 * not: the partially merged tree is handed to the verifier, which reports the
 * consequence as a build failure.
 */
@Component
public class WorkspaceSetup {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSetup.class);

    static final String PR_BRANCH = "pr-source";
    static final String MERGE_BRANCH = "mock-merge";
    static final int FETCH_DEPTH = 50;

    private final String workingDir;

    public WorkspaceSetup(SandboxProperties properties) {
        this(properties.getWorkingDir());
    }

    public WorkspaceSetup(String workingDir) {
        this.workingDir = workingDir;
    }

    public void prepare(ExecutionEnvironment environment, PrInfo pr) {
        log.info("Preparing workspace for PR #{} ({} <- {})",
                pr.prNumber(), pr.targetBranch(), pr.sourceBranch());

        run(environment, "/", "git clone --depth=1 --branch " + ShellQuote.quote(pr.targetBranch())
                + " " + ShellQuote.quote(pr.targetRepoUrl()) + " " + ShellQuote.quote(workingDir),
                "Failed to clone repository");

        run(environment, null, "git fetch --depth=" + FETCH_DEPTH + " origin " + ShellQuote.quote(pr.targetCommit())
                + " && git fetch origin pull/" + pr.prNumber() + "/head:" + PR_BRANCH,
                "Failed to fetch PR");

        run(environment, null, "git checkout " + ShellQuote.quote(pr.targetCommit()),
                "Failed to checkout target commit");

        run(environment, null, "git checkout -b " + MERGE_BRANCH,
                "Failed to create merge branch");

        ExecResult merge = environment.execute(
                "git -c user.name=fixagent -c user.email=fixagent@localhost merge "
                        + PR_BRANCH + " --no-commit --no-edit",
                null, null, null);
        if (merge.succeeded()) {
            log.info("Merged PR #{} into {} cleanly", pr.prNumber(), MERGE_BRANCH);
        } else {
            log.warn("Merge of PR #{} did not apply cleanly (exit {}); continuing with partial merge",
                    pr.prNumber(), merge.exitCode());
        }
    }

    private static void run(ExecutionEnvironment environment, String cwd, String command, String failure) {
        ExecResult result = environment.execute(command, cwd, null, null);
        if (!result.succeeded()) {
            throw new WorkspaceException(failure + ": " + result.stderr().strip());
        }
    }
}
