package by.greenmobile.ewjam.service.optimization;

import by.greenmobile.ewjam.entity.Assignment;
import by.greenmobile.ewjam.entity.AssignmentEvaluation;
import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.BandwidthMode;
import by.greenmobile.ewjam.service.analysis.CombatAnalyzer;

/**
 * ePDE fitness:
 * total effect + 0.5 * resource utilization + 0.3 * interruptions - constraint penalty, floored at 0.
 */
public class FitnessEvaluator {

    static final double UTILIZATION_WEIGHT = 0.5;
    static final double INTERRUPTION_WEIGHT = 0.3;
    static final double DANGLING_PENALTY = 1.0;
    static final double OVERRUN_PENALTY = 0.5;

    private final CombatAnalyzer analyzer;
    private final ScenarioIndex index;

    public FitnessEvaluator(CombatAnalyzer analyzer, ScenarioIndex index) {
        this.analyzer = analyzer;
        this.index = index;
    }

    public double fitness(AssignmentMatrix genome) {
        AssignmentEvaluation ev = analyzer.evaluateAssignment(genome, index.radars(), index.jammers());
        double f = ev.getTotalEffectiveness()
                + UTILIZATION_WEIGHT * ev.getResourceUtilization()
                + INTERRUPTION_WEIGHT * ev.getInterruptionCount()
                - penalty(genome);
        return Math.max(0.0, f);
    }

    /**
     * 1.0 per gene aimed at an unknown radar + 0.5 per gene over a (radar, mode) capacity.
     */
    public double penalty(AssignmentMatrix genome) {
        BandwidthMode[] modes = BandwidthMode.values();
        int[][] counts = new int[index.radarCount()][modes.length];
        int dangling = 0;

        for (int i = 0; i < genome.size(); i++) {
            Assignment g = genome.gene(i);
            if (!g.isAssigned()) continue;
            int r = index.radarPosition(g.getTargetRadarId());
            if (r < 0) {
                dangling++;
                continue;
            }
            if (g.getBandwidthMode() != null) counts[r][g.getBandwidthMode().ordinal()]++;
        }

        int overrun = 0;
        for (int[] perMode : counts) {
            for (int m = 0; m < modes.length; m++) {
                overrun += Math.max(0, perMode[m] - modes[m].getCapacity());
            }
        }

        return DANGLING_PENALTY * dangling + OVERRUN_PENALTY * overrun;
    }
}
