package com.fixagent.core.model;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH
}
