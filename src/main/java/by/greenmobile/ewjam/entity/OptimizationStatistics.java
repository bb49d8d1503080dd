package by.greenmobile.ewjam.entity;

import lombok.Value;

@Value
public class OptimizationStatistics {
    long totalRuns;
    double avgFitness;
    double stdFitness;
    double maxFitness;
    double avgTime;
    double successRate;

    public static OptimizationStatistics empty() {
        return new OptimizationStatistics(0, 0.0, 0.0, 0.0, 0.0, 0.0);
    }
}
