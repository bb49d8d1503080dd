package by.greenmobile.ewjam.entity;

import lombok.Value;

import java.time.Instant;

/**
 * One entry of the controller's run history.
 */
@Value
public class RunRecord {
    String runId;
    Instant timestamp;
    boolean success;
    double optimizationTime;
    double bestFitness;
    int radarCount;
    int jammerCount;
}
