package by.greenmobile.ewjam.entity;

import lombok.Value;

@Value
public class ConvergenceRecord {
    int generation;
    double avgFitness;
    double maxFitness;
    double bestFitness;
}
