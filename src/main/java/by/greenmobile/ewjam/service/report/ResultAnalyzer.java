package by.greenmobile.ewjam.service.report;

import by.greenmobile.ewjam.entity.Assignment;
import by.greenmobile.ewjam.entity.AssignmentEvaluation;
import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.AssignmentReport;
import by.greenmobile.ewjam.entity.AssignmentRow;
import by.greenmobile.ewjam.entity.ConvergenceAnalysis;
import by.greenmobile.ewjam.entity.ConvergenceRecord;
import by.greenmobile.ewjam.entity.Jammer;
import by.greenmobile.ewjam.entity.Radar;
import by.greenmobile.ewjam.entity.ReportSummary;
import by.greenmobile.ewjam.entity.Scenario;
import by.greenmobile.ewjam.service.analysis.CombatAnalyzer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Post-run analysis: convergence diagnostics and the per-jammer assignment report.
 */
@Service
public class ResultAnalyzer {

    /** Plateau window, generations. */
    static final int PLATEAU_WINDOW = 10;

    /** Std dev of best fitness below which a window counts as flat. */
    static final double PLATEAU_STD = 0.01;

    /** Shorter series are considered stable. */
    static final int MIN_STABILITY_SAMPLES = 5;

    private static final double EPS = 1e-6;

    public ConvergenceAnalysis analyzeConvergence(List<ConvergenceRecord> history) {
        if (history == null || history.isEmpty()) {
            return ConvergenceAnalysis.empty();
        }

        double[] best = history.stream().mapToDouble(ConvergenceRecord::getBestFitness).toArray();
        ConvergenceRecord last = history.get(history.size() - 1);

        double initial = best[0];
        double fin = best[best.length - 1];
        double improvement = initial > 0 ? (fin - initial) / initial : 0.0;

        return new ConvergenceAnalysis(
                last.getBestFitness(),
                last.getAvgFitness(),
                convergenceGeneration(history, best),
                improvement,
                stability(best));
    }

    /**
     * Generation at which the best-fitness plateau starts: the first 10-sample window from which
     * every later trailing window stays below {@link #PLATEAU_STD}. Series length if there is none.
     */
    int convergenceGeneration(List<ConvergenceRecord> history, double[] best) {
        int n = best.length;
        if (n < PLATEAU_WINDOW) return n;

        // scan windows backwards while they stay flat
        int plateauStart = -1;
        for (int end = n - 1; end >= PLATEAU_WINDOW - 1; end--) {
            int start = end - PLATEAU_WINDOW + 1;
            if (std(best, start, end + 1) < PLATEAU_STD) {
                plateauStart = start;
            } else {
                break;
            }
        }
        return plateauStart >= 0 ? history.get(plateauStart).getGeneration() : n;
    }

    /**
     * 1 - std/mean over the second half of the best-fitness series.
     */
    double stability(double[] best) {
        if (best.length < MIN_STABILITY_SAMPLES) return 1.0;
        int from = best.length / 2;
        double mean = mean(best, from, best.length);
        return 1.0 - std(best, from, best.length) / (mean + EPS);
    }

    public AssignmentReport generateAssignmentReport(AssignmentMatrix best, Scenario scenario, CombatAnalyzer analyzer) {
        List<Radar> radars = scenario.radarsOrEmpty();
        List<Jammer> jammers = scenario.jammersOrEmpty();

        AssignmentEvaluation evaluation = analyzer.evaluateAssignment(best, radars, jammers);

        Map<String, Radar> radarById = new HashMap<>();
        for (Radar r : radars) {
            if (r != null && r.getId() != null) radarById.putIfAbsent(r.getId(), r);
        }
        Map<String, Jammer> jammerById = new HashMap<>();
        for (Jammer j : jammers) {
            if (j != null && j.getId() != null) jammerById.putIfAbsent(j.getId(), j);
        }

        List<AssignmentRow> rows = new ArrayList<>();
        int assigned = 0;
        int n = best != null ? best.size() : 0;
        for (int i = 0; i < n; i++) {
            Assignment a = best.gene(i);
            if (!a.isAssigned()) continue;
            assigned++;

            Jammer jammer = jammerById.get(best.jammerIdAt(i));
            Radar radar = radarById.get(a.getTargetRadarId());
            if (jammer == null || radar == null) continue;

            double single = analyzer.singleEffect(radar, jammer, a.getTechnique(), a.getBandwidthMode(), 1);
            rows.add(new AssignmentRow(
                    jammer.getId(), jammer.getName(),
                    radar.getId(), radar.getName(),
                    a.getTechnique(), a.getBandwidthMode(),
                    single, radar.getCurrentStage()));
        }

        ReportSummary summary = new ReportSummary(
                evaluation.getTotalEffectiveness(),
                evaluation.getResourceUtilization(),
                evaluation.getInterruptionCount(),
                assigned,
                jammers.size());

        return new AssignmentReport(Collections.unmodifiableList(rows), summary, evaluation.getRadarEffects());
    }

    private static double mean(double[] v, int from, int to) {
        double s = 0.0;
        for (int i = from; i < to; i++) s += v[i];
        return s / (to - from);
    }

    /** Population standard deviation of v[from, to). */
    private static double std(double[] v, int from, int to) {
        double m = mean(v, from, to);
        double s = 0.0;
        for (int i = from; i < to; i++) s += (v[i] - m) * (v[i] - m);
        return Math.sqrt(s / (to - from));
    }
}
