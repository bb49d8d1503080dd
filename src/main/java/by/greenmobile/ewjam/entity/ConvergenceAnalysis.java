package by.greenmobile.ewjam.entity;

import lombok.Value;

@Value
public class ConvergenceAnalysis {
    double finalBestFitness;
    double finalAvgFitness;
    int convergenceGeneration;
    double improvementRatio;
    double stability;

    public static ConvergenceAnalysis empty() {
        return new ConvergenceAnalysis(0.0, 0.0, 0, 0.0, 1.0);
    }
}
