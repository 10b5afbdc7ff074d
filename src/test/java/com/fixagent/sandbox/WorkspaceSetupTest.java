package com.fixagent.sandbox;

import com.fixagent.core.model.PrInfo;
import com.fixagent.core.model.TestFixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceSetupTest {

    private final WorkspaceSetup setup = new WorkspaceSetup("/workspace");
    private final PrInfo pr = TestFixtures.prInfo(42);

    @Test
    void runsFiveStepsInOrder() {
        var env = FakeEnvironment.started();

        setup.prepare(env, pr);

        var commands = env.commands();
        assertEquals(5, commands.size());
        assertEquals("git clone --depth=1 --branch main https://github.com/acme/widgets.git /workspace",
                commands.get(0));
        assertTrue(commands.get(1).contains("git fetch --depth=50 origin " + TestFixtures.TARGET_SHA));
        assertTrue(commands.get(1).contains("git fetch origin pull/42/head:pr-source"));
        assertEquals("git checkout " + TestFixtures.TARGET_SHA, commands.get(2));
        assertEquals("git checkout -b mock-merge", commands.get(3));
        assertTrue(commands.get(4).contains("merge pr-source --no-commit --no-edit"));
    }

    @Test
    void cloneRunsFromRootDirectory() {
        var env = FakeEnvironment.started();

        setup.prepare(env, pr);

        assertEquals("/", env.workingDirs().get(0));
    }

    @Test
    void cloneFailureIsFatal() {
        var env = FakeEnvironment.started()
                .respond("git clone", 128, "", "fatal: repository not found\n");

        var ex = assertThrows(WorkspaceException.class, () -> setup.prepare(env, pr));

        assertEquals("Failed to clone repository: fatal: repository not found", ex.getMessage());
        assertEquals(1, env.commands().size());
    }

    @Test
    void fetchFailureIsFatal() {
        var env = FakeEnvironment.started()
                .respond("git fetch", 1, "", "couldn't find remote ref");

        var ex = assertThrows(WorkspaceException.class, () -> setup.prepare(env, pr));

        assertTrue(ex.getMessage().startsWith("Failed to fetch PR"));
    }

    @Test
    void mergeConflictDoesNotRaise() {
        var env = FakeEnvironment.started()
                .respond("merge pr-source", 1, "CONFLICT (content): Merge conflict in App.java", "");

        assertDoesNotThrow(() -> setup.prepare(env, pr));
        assertEquals(5, env.commands().size());
    }

    @Test
    void branchNamesAreShellQuoted() {
        var env = FakeEnvironment.started();
        var hostile = new PrInfo(pr.prUrl(), "acme", "widgets", 7, "x", TestFixtures.SOURCE_SHA,
                pr.sourceRepoUrl(), "main; rm -rf /", TestFixtures.TARGET_SHA, pr.targetRepoUrl(), "t", "open");

        setup.prepare(env, hostile);

        assertTrue(env.commands().get(0).contains("--branch 'main; rm -rf /'"));
    }
}
