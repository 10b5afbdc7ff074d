package com.fixagent.verifier;

import java.util.List;

/**
 * Compiles Gradle projects: {@code clean build} with tests excluded.
 */
public class GradleVerifier extends BuildToolVerifier {

    @Override
    protected String wrapper() {
        return "./gradlew";
    }

    @Override
    protected String systemExecutable() {
        return "gradle";
    }

    @Override
    protected String buildArguments() {
        return "clean build -x test --no-daemon --stacktrace";
    }

    @Override
    protected List<String> buildTasks() {
        return List.of("clean", "build");
    }

    @Override
    public String name() {
        return "gradle";
    }
}
