package com.fixagent.verifier;

import com.fixagent.core.model.VerifierConfig;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Picks the verifier for a trial: the custom script when one is configured,
 * otherwise the build tool matching the project type.
 */
@Component
public class VerifierFactory {

    public Verifier forConfig(VerifierConfig config) {
        if (config.customScript() != null && !config.customScript().isBlank()) {
            return new CustomScriptVerifier(Path.of(config.customScript()));
        }
        return switch (config.projectType()) {
            case JAVA_GRADLE -> new GradleVerifier();
            case JAVA_MAVEN -> new MavenVerifier();
            default -> throw new UnsupportedProjectTypeException(config.projectType());
        };
    }
}
