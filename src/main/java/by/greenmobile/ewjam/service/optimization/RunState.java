package by.greenmobile.ewjam.service.optimization;

public enum RunState {
    NOT_STARTED,
    RUNNING,
    COMPLETED
}
