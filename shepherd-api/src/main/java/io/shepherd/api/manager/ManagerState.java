package io.shepherd.api.manager;

public enum ManagerState {
    NEW,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED
}
