package com.fixagent.sandbox;

import com.fixagent.core.model.EnvironmentBackend;
import com.fixagent.core.model.EnvironmentConfig;
import com.fixagent.core.model.ProjectType;
import com.fixagent.core.model.TestFixtures;
import com.fixagent.core.model.TrialConfig;
import com.github.dockerjava.api.DockerClient;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class EnvironmentFactoryTest {

    private final SandboxProperties properties = new SandboxProperties();
    private final EnvironmentFactory factory = new EnvironmentFactory(mock(DockerClient.class), properties);

    @Test
    void sandboxNameIsDerivedFromTrialId() {
        TrialConfig config = TestFixtures.trialConfig(Path.of("results"), ProjectType.JAVA_GRADLE);

        var env = (DockerEnvironment) factory.create(config);

        assertEquals("fixagent-" + config.trialId(), env.containerName());
        assertEquals(EnvironmentFactory.sandboxName(config), env.containerName());
    }

    @Test
    void imageFollowsProjectType() {
        TrialConfig config = TestFixtures.trialConfig(Path.of("results"), ProjectType.JAVA_MAVEN);

        assertEquals("fixagent-verifier:java-maven", factory.imageFor(config));
    }

    @Test
    void explicitImageOverridesProjectType() {
        TrialConfig base = TestFixtures.trialConfig(Path.of("results"), ProjectType.JAVA_GRADLE);
        var config = new TrialConfig(base.trialId(), base.trialName(), base.task(), base.prInfo(),
                new EnvironmentConfig(EnvironmentBackend.DOCKER, 1, 1024, false, "gradle:8-jdk17"),
                base.verifier(), base.outputDir(), base.retryAttempts());

        var env = (DockerEnvironment) factory.create(config);

        assertEquals("gradle:8-jdk17", env.imageName());
        assertEquals("none", env.networkMode());
    }

    @Test
    void concurrentTrialsGetDistinctSandboxes() {
        TrialConfig a = TestFixtures.trialConfig(Path.of("results"), ProjectType.JAVA_GRADLE);
        TrialConfig b = TestFixtures.trialConfig(Path.of("results"), ProjectType.JAVA_GRADLE);

        assertNotEquals(EnvironmentFactory.sandboxName(a), EnvironmentFactory.sandboxName(b));
    }
}
