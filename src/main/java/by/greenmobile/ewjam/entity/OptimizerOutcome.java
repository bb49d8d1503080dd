package by.greenmobile.ewjam.entity;

import lombok.Value;

import java.util.List;

/**
 * Raw optimizer output: the best-ever genome and the convergence series of the run.
 */
@Value
public class OptimizerOutcome {
    AssignmentMatrix bestAssignment;
    double bestFitness;
    List<ConvergenceRecord> convergenceHistory;
    int generationsCompleted;
    StopReason stopReason;
    double elapsedSeconds;
}
