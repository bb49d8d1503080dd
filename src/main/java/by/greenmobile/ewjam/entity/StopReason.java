package by.greenmobile.ewjam.entity;

public enum StopReason {
    TIME_LIMIT,
    MAX_GENERATIONS
}
