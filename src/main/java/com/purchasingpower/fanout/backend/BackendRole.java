package com.purchasingpower.fanout.backend;

public enum BackendRole {
    PRIMARY,
    SECONDARY;

    public BackendRole other() {
        return this == PRIMARY ? SECONDARY : PRIMARY;
    }
}
