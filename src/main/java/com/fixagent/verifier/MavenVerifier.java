package com.fixagent.verifier;

import java.util.List;

/**
 * Compiles Maven projects: {@code clean package} with tests skipped.
 */
public class MavenVerifier extends BuildToolVerifier {

    @Override
    protected String wrapper() {
        return "./mvnw";
    }

    @Override
    protected String systemExecutable() {
        return "mvn";
    }

    @Override
    protected String buildArguments() {
        return "-B clean package -DskipTests";
    }

    @Override
    protected List<String> buildTasks() {
        return List.of("clean", "package");
    }

    @Override
    public String name() {
        return "maven";
    }
}
