package by.greenmobile.ewjam.service;

import by.greenmobile.ewjam.config.OptimizerProperties;
import by.greenmobile.ewjam.entity.Assignment;
import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.AssignmentReport;
import by.greenmobile.ewjam.entity.ConvergenceAnalysis;
import by.greenmobile.ewjam.entity.Jammer;
import by.greenmobile.ewjam.entity.OptimizationResult;
import by.greenmobile.ewjam.entity.OptimizationStatistics;
import by.greenmobile.ewjam.entity.OptimizerConfig;
import by.greenmobile.ewjam.entity.OptimizerOutcome;
import by.greenmobile.ewjam.entity.RunRecord;
import by.greenmobile.ewjam.entity.Scenario;
import by.greenmobile.ewjam.entity.SolutionEntry;
import by.greenmobile.ewjam.service.analysis.CombatAnalyzer;
import by.greenmobile.ewjam.service.engine.EffectivenessModel;
import by.greenmobile.ewjam.service.optimization.EpdeOptimizer;
import by.greenmobile.ewjam.service.optimization.LoggingGenerationListener;
import by.greenmobile.ewjam.service.optimization.ScenarioIndex;
import by.greenmobile.ewjam.service.report.ResultAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.time.StopWatch;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single entry point of an allocation run:
 * - ePDE optimization (EpdeOptimizer)
 * - convergence analysis and assignment report (ResultAnalyzer)
 * - run history and aggregate statistics
 *
 * Runs are synchronous; the caller blocks until the result is ready. History access is
 * synchronized because runs may arrive from several request threads.
 */
@Service
@Slf4j
public class OptimizationController {

    private final EpdeOptimizer optimizer;
    private final ResultAnalyzer resultAnalyzer;
    private final OptimizerProperties properties;

    private final CombatAnalyzer illuminatedAnalyzer;
    private final CombatAnalyzer simplifiedAnalyzer;

    private final Deque<RunRecord> history = new ArrayDeque<>();
    private long totalRuns;
    private OptimizationResult latest;

    public OptimizationController(EpdeOptimizer optimizer,
                                  ResultAnalyzer resultAnalyzer,
                                  OptimizerProperties properties) {
        this.optimizer = optimizer;
        this.resultAnalyzer = resultAnalyzer;
        this.properties = properties;
        this.illuminatedAnalyzer = new CombatAnalyzer(new EffectivenessModel(true));
        this.simplifiedAnalyzer = new CombatAnalyzer(new EffectivenessModel(false));
    }

    /**
     * Run with the configured defaults.
     */
    public OptimizationResult runOptimization(Scenario scenario) {
        return runOptimization(scenario, properties.toConfig(), properties.isConsiderPlatformIllumination());
    }

    /**
     * @throws IllegalArgumentException for a null scenario, duplicate jammer ids or an invalid config.
     *                                  Any other failure is logged and returned as success=false.
     */
    public OptimizationResult runOptimization(Scenario scenario, OptimizerConfig config,
                                              boolean considerPlatformIllumination) {
        if (scenario == null) throw new IllegalArgumentException("Scenario is required");
        if (config == null) throw new IllegalArgumentException("Optimizer config is required");
        config.validate();
        ScenarioIndex index = ScenarioIndex.of(scenario);

        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("run", runId);
        StopWatch clock = StopWatch.createStarted();
        try {
            CombatAnalyzer analyzer = analyzer(considerPlatformIllumination);

            log.info("RUN: scenario='{}' {} radars vs {} jammers, illumination={}",
                    scenario.getName(), index.radarCount(), index.jammerCount(), considerPlatformIllumination);

            OptimizerOutcome outcome = optimizer.optimize(scenario, analyzer, config,
                    new LoggingGenerationListener(properties.getProgressLogEvery()));

            ConvergenceAnalysis convergence = resultAnalyzer.analyzeConvergence(outcome.getConvergenceHistory());
            AssignmentReport report = resultAnalyzer.generateAssignmentReport(outcome.getBestAssignment(), scenario, analyzer);

            double elapsed = clock.getNanoTime() / 1e9;

            OptimizationResult result = OptimizationResult.builder()
                    .success(true)
                    .optimizationTime(elapsed)
                    .bestSolution(toSolution(outcome.getBestAssignment(), index))
                    .bestFitness(outcome.getBestFitness())
                    .convergenceAnalysis(convergence)
                    .assignmentReport(report)
                    .convergenceData(outcome.getConvergenceHistory())
                    .resourceUtilization(report.getSummary().getResourceUtilization())
                    .interruptionCount(report.getSummary().getInterruptionCount())
                    .generationsCompleted(outcome.getGenerationsCompleted())
                    .stopReason(outcome.getStopReason())
                    .build();

            record(runId, result, index);

            log.info("RUN summary: time={}s bestFitness={} RUR={} interruptions={} generations={} stop={}",
                    elapsed, outcome.getBestFitness(), result.getResourceUtilization(),
                    result.getInterruptionCount(), outcome.getGenerationsCompleted(), outcome.getStopReason());
            return result;

        } catch (RuntimeException e) {
            log.error("RUN failed: {}", e.getMessage(), e);
            OptimizationResult failed = OptimizationResult.builder()
                    .success(false)
                    .optimizationTime(clock.getNanoTime() / 1e9)
                    .bestSolution(Collections.emptyMap())
                    .convergenceAnalysis(ConvergenceAnalysis.empty())
                    .convergenceData(Collections.emptyList())
                    .error(e.getMessage())
                    .build();
            record(runId, failed, index);
            return failed;
        } finally {
            MDC.remove("run");
        }
    }

    /**
     * Aggregates over the most recent runs (window from optimizer.history.statistics-window).
     * Fitness figures come from the successful runs of the window, time and success rate from all of them.
     */
    public OptimizationStatistics getOptimizationStatistics() {
        List<RunRecord> recent;
        long total;
        synchronized (history) {
            if (history.isEmpty()) return OptimizationStatistics.empty();
            recent = recentRuns(properties.getHistory().getStatisticsWindow());
            total = totalRuns;
        }

        double[] fitness = recent.stream()
                .filter(RunRecord::isSuccess)
                .mapToDouble(RunRecord::getBestFitness)
                .toArray();

        double avgFitness = 0.0;
        double stdFitness = 0.0;
        double maxFitness = 0.0;
        if (fitness.length > 0) {
            double sum = 0.0;
            maxFitness = Double.NEGATIVE_INFINITY;
            for (double f : fitness) {
                sum += f;
                maxFitness = Math.max(maxFitness, f);
            }
            avgFitness = sum / fitness.length;
            double sq = 0.0;
            for (double f : fitness) sq += (f - avgFitness) * (f - avgFitness);
            stdFitness = Math.sqrt(sq / fitness.length);
        }

        double avgTime = recent.stream().mapToDouble(RunRecord::getOptimizationTime).average().orElse(0.0);
        double successRate = (double) recent.stream().filter(RunRecord::isSuccess).count() / recent.size();

        return new OptimizationStatistics(total, avgFitness, stdFitness, maxFitness, avgTime, successRate);
    }

    public Optional<OptimizationResult> latestResult() {
        synchronized (history) {
            return Optional.ofNullable(latest);
        }
    }

    /** Retained run records, oldest first. */
    public List<RunRecord> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public CombatAnalyzer analyzer(boolean considerPlatformIllumination) {
        return considerPlatformIllumination ? illuminatedAnalyzer : simplifiedAnalyzer;
    }

    private void record(String runId, OptimizationResult result, ScenarioIndex index) {
        RunRecord rec = new RunRecord(
                runId,
                Instant.now(),
                result.isSuccess(),
                result.getOptimizationTime(),
                result.getBestFitness(),
                index.radarCount(),
                index.jammerCount());

        int max = Math.max(1, properties.getHistory().getMaxRecords());
        synchronized (history) {
            history.addLast(rec);
            while (history.size() > max) history.removeFirst();
            totalRuns++;
            latest = result;
        }
    }

    private List<RunRecord> recentRuns(int window) {
        int n = Math.min(Math.max(1, window), history.size());
        List<RunRecord> out = new ArrayList<>(n);
        Iterator<RunRecord> it = history.descendingIterator();
        while (it.hasNext() && out.size() < n) out.add(it.next());
        Collections.reverse(out);
        return out;
    }

    private static Map<String, SolutionEntry> toSolution(AssignmentMatrix best, ScenarioIndex index) {
        Map<String, SolutionEntry> out = new LinkedHashMap<>();
        List<Jammer> jammers = index.jammers();
        for (int i = 0; i < best.size(); i++) {
            Assignment a = best.gene(i);
            Double power = i < jammers.size() ? jammers.get(i).getPower() : null;
            out.put(best.jammerIdAt(i), new SolutionEntry(a.getTargetRadarId(), a.getTechnique(), a.getBandwidthMode(), power));
        }
        return Collections.unmodifiableMap(out);
    }
}
