package com.fixagent.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Build ecosystems a repository can belong to.
 */
public enum ProjectType {
    JAVA_GRADLE("java-gradle"),
    JAVA_MAVEN("java-maven"),
    NODEJS_NPM("nodejs-npm"),
    NODEJS_YARN("nodejs-yarn"),
    PYTHON_PIP("python-pip"),
    PYTHON_POETRY("python-poetry"),
    RUST_CARGO("rust-cargo"),
    GO_MOD("go-mod"),
    DOTNET("dotnet"),
    RUBY_BUNDLER("ruby-bundler"),
    UNKNOWN("unknown");

    private final String id;

    ProjectType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolves a project type from its id, enum name, or the short
     * {@code gradle} / {@code maven} aliases.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    @JsonCreator
    public static ProjectType fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Project type must not be blank");
        }
        String normalized = value.trim().toLowerCase();
        if ("gradle".equals(normalized)) return JAVA_GRADLE;
        if ("maven".equals(normalized)) return JAVA_MAVEN;
        for (ProjectType type : values()) {
            if (type.id.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown project type: " + value);
    }

    @Override
    public String toString() {
        return id;
    }
}
