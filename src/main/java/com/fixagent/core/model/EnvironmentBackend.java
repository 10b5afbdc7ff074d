package com.fixagent.core.model;

/**
 * Sandbox backends a trial can be provisioned on.
 */
public enum EnvironmentBackend {
    DOCKER
}
