package by.greenmobile.ewjam.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * What one optimization run hands back to the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptimizationResult {

    private boolean success;

    /** Wall time of the whole run (optimizer + analysis), seconds. */
    private double optimizationTime;

    /** jammerId -> assignment, in scenario jammer order. */
    private Map<String, SolutionEntry> bestSolution;

    private double bestFitness;

    private ConvergenceAnalysis convergenceAnalysis;

    private AssignmentReport assignmentReport;

    private List<ConvergenceRecord> convergenceData;

    private double resourceUtilization;

    private int interruptionCount;

    private int generationsCompleted;

    private StopReason stopReason;

    /** Set only when success == false. */
    private String error;
}
