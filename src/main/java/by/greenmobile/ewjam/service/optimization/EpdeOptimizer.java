package by.greenmobile.ewjam.service.optimization;

import by.greenmobile.ewjam.entity.Assignment;
import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.BandwidthMode;
import by.greenmobile.ewjam.entity.ConvergenceRecord;
import by.greenmobile.ewjam.entity.JammingTechnique;
import by.greenmobile.ewjam.entity.OptimizerConfig;
import by.greenmobile.ewjam.entity.OptimizerOutcome;
import by.greenmobile.ewjam.entity.Scenario;
import by.greenmobile.ewjam.entity.StopReason;
import by.greenmobile.ewjam.service.analysis.CombatAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.time.StopWatch;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

/**
 * ePDE: extended permutation differential evolution over categorical genomes.
 *
 * Each generation, for every individual i:
 * 1) pick three donors a, b, c (distinct, != i) from the previous population;
 * 2) mutation: per gene, copy a or blend b/c (discrete stand-in for a + F * (b - c));
 * 3) crossover with i (mutant gene with probability CR);
 * 4) repair ({@link AssignmentRepairer});
 * 5) fitness ({@link FitnessEvaluator});
 * 6) trial replaces i only if strictly better.
 *
 * The best genome ever seen is kept apart from the population, so the answer never regresses.
 * The time budget is checked at each generation start; a started generation always completes.
 *
 * Individuals of a generation read only the frozen previous population and write only their own
 * slot, so they are evaluated on a parallel stream. Every individual draws from its own random
 * stream seeded in index order, which keeps seeded runs reproducible with or without parallelism.
 */
@Service
@Slf4j
public class EpdeOptimizer {

    private static final JammingTechnique[] TECHNIQUES = JammingTechnique.values();
    private static final BandwidthMode[] MODES = BandwidthMode.values();

    public OptimizerOutcome optimize(Scenario scenario, CombatAnalyzer analyzer, OptimizerConfig config) {
        return optimize(scenario, analyzer, config, GenerationListener.NOOP);
    }

    public OptimizerOutcome optimize(Scenario scenario, CombatAnalyzer analyzer,
                                     OptimizerConfig config, GenerationListener listener) {
        Objects.requireNonNull(scenario, "scenario");
        Objects.requireNonNull(analyzer, "analyzer");
        Objects.requireNonNull(config, "config");
        config.validate();

        Run run = new Run(ScenarioIndex.of(scenario), analyzer, config.copy(),
                listener != null ? listener : GenerationListener.NOOP);
        return run.execute();
    }

    /**
     * One optimization run: NOT_STARTED -> RUNNING(generation) -> COMPLETED.
     */
    private static final class Run {
        private final ScenarioIndex index;
        private final OptimizerConfig config;
        private final GenerationListener listener;
        private final FitnessEvaluator fitness;
        private final AssignmentRepairer repairer;
        private final SplittableRandom master;

        private RunState state = RunState.NOT_STARTED;
        private int generation;

        Run(ScenarioIndex index, CombatAnalyzer analyzer, OptimizerConfig config, GenerationListener listener) {
            this.index = index;
            this.config = config;
            this.listener = listener;
            this.fitness = new FitnessEvaluator(analyzer, index);
            this.repairer = new AssignmentRepairer(index);
            this.master = config.getSeed() != null ? new SplittableRandom(config.getSeed()) : new SplittableRandom();
        }

        OptimizerOutcome execute() {
            if (state != RunState.NOT_STARTED) {
                throw new IllegalStateException("Run already " + state);
            }
            StopWatch clock = StopWatch.createStarted();
            long budgetNanos = (long) (config.getTimeLimitSeconds() * TimeUnit.SECONDS.toNanos(1));

            log.info("ePDE start: population={} maxGenerations={} CR={} F={} timeLimit={}s, {} radars vs {} jammers",
                    config.getPopulationSize(), config.getMaxGenerations(), config.getCrossoverRate(),
                    config.getScalingFactor(), config.getTimeLimitSeconds(), index.radarCount(), index.jammerCount());

            state = RunState.RUNNING;
            Member[] population = initialize();
            Member best = bestOf(population);

            List<ConvergenceRecord> history = new ArrayList<>();
            StopReason stopReason = StopReason.MAX_GENERATIONS;

            for (generation = 0; generation < config.getMaxGenerations(); generation++) {
                if (clock.getNanoTime() >= budgetNanos) {
                    log.info("ePDE: time limit reached before generation {}", generation);
                    stopReason = StopReason.TIME_LIMIT;
                    break;
                }

                Member[] previous = population;
                Member[] trials = evolve(previous);

                Member[] next = new Member[previous.length];
                double sum = 0.0;
                double max = Double.NEGATIVE_INFINITY;
                Member generationBest = null;

                for (int i = 0; i < previous.length; i++) {
                    sum += previous[i].fitness;
                    max = Math.max(max, previous[i].fitness);

                    next[i] = trials[i].fitness > previous[i].fitness ? trials[i] : previous[i];
                    if (generationBest == null || next[i].fitness > generationBest.fitness) {
                        generationBest = next[i];
                    }
                }

                if (generationBest.fitness > best.fitness) {
                    best = generationBest;
                }
                population = next;

                ConvergenceRecord record = new ConvergenceRecord(generation, sum / previous.length, max, best.fitness);
                history.add(record);
                listener.onGeneration(new GenerationSnapshot(record, genomes(population), seconds(clock)));
            }

            state = RunState.COMPLETED;
            OptimizerOutcome outcome = new OptimizerOutcome(
                    best.genome,
                    best.fitness,
                    Collections.unmodifiableList(history),
                    history.size(),
                    stopReason,
                    seconds(clock));
            listener.onCompleted(outcome);
            return outcome;
        }

        /**
         * Random genomes: uniform target radar, technique and bandwidth mode per jammer.
         */
        private Member[] initialize() {
            int n = config.getPopulationSize();
            List<String> jammerIds = index.jammerIds();
            List<String> radarIds = index.radarIds();

            AssignmentMatrix template = AssignmentMatrix.of(jammerIds, idleGenes(jammerIds.size()));

            AssignmentMatrix[] genomes = new AssignmentMatrix[n];
            for (int k = 0; k < n; k++) {
                Assignment[] genes = new Assignment[jammerIds.size()];
                for (int j = 0; j < genes.length; j++) {
                    String target = radarIds.isEmpty() ? null : radarIds.get(master.nextInt(radarIds.size()));
                    JammingTechnique technique = TECHNIQUES[master.nextInt(TECHNIQUES.length)];
                    BandwidthMode mode = MODES[master.nextInt(MODES.length)];
                    genes[j] = Assignment.of(target, technique, mode);
                }
                genomes[k] = template.withGenes(genes);
            }

            return stream(n)
                    .mapToObj(k -> new Member(genomes[k], fitness.fitness(genomes[k])))
                    .toArray(Member[]::new);
        }

        private Member[] evolve(Member[] previous) {
            long[] seeds = new long[previous.length];
            for (int i = 0; i < seeds.length; i++) {
                seeds[i] = master.nextLong();
            }
            return stream(previous.length)
                    .mapToObj(i -> trial(previous, i, new SplittableRandom(seeds[i])))
                    .toArray(Member[]::new);
        }

        private Member trial(Member[] population, int i, SplittableRandom rng) {
            int[] donors = pickDonors(i, population.length, rng);
            AssignmentMatrix target = population[i].genome;

            Assignment[] mutant = mutate(
                    population[donors[0]].genome,
                    population[donors[1]].genome,
                    population[donors[2]].genome,
                    rng);

            Assignment[] crossed = new Assignment[target.size()];
            for (int j = 0; j < crossed.length; j++) {
                crossed[j] = rng.nextDouble() < config.getCrossoverRate() ? mutant[j] : target.gene(j);
            }

            AssignmentMatrix repaired = repairer.repair(target.withGenes(crossed), rng);
            return new Member(repaired, fitness.fitness(repaired));
        }

        /**
         * Per gene: with probability mutationRate either copy a (inheritRate) or take b (F) / c
         * when both carry a target, else a; otherwise copy a.
         */
        private Assignment[] mutate(AssignmentMatrix a, AssignmentMatrix b, AssignmentMatrix c, SplittableRandom rng) {
            Assignment[] mutant = new Assignment[a.size()];
            for (int j = 0; j < mutant.length; j++) {
                Assignment gene = a.gene(j);
                if (rng.nextDouble() < config.getMutationRate() && rng.nextDouble() >= config.getInheritRate()) {
                    Assignment gb = b.gene(j);
                    Assignment gc = c.gene(j);
                    if (gb.isAssigned() && gc.isAssigned()) {
                        gene = rng.nextDouble() < config.getScalingFactor() ? gb : gc;
                    }
                }
                mutant[j] = gene;
            }
            return mutant;
        }

        private IntStream stream(int n) {
            IntStream s = IntStream.range(0, n);
            return config.isParallel() && n > 1 ? s.parallel() : s;
        }

        private Assignment[] idleGenes(int n) {
            Assignment[] genes = new Assignment[n];
            Arrays.fill(genes, Assignment.idle(TECHNIQUES[0], MODES[0]));
            return genes;
        }
    }

    /**
     * Three donor indices != i, distinct when the population allows it.
     */
    static int[] pickDonors(int i, int n, SplittableRandom rng) {
        int[] d = new int[3];
        if (n == 1) {
            Arrays.fill(d, i);
            return d;
        }
        boolean distinct = n - 1 >= 3;
        for (int k = 0; k < 3; k++) {
            int candidate;
            do {
                candidate = rng.nextInt(n - 1);
                if (candidate >= i) candidate++;
            } while (distinct && contains(d, k, candidate));
            d[k] = candidate;
        }
        return d;
    }

    private static boolean contains(int[] values, int length, int v) {
        for (int k = 0; k < length; k++) {
            if (values[k] == v) return true;
        }
        return false;
    }

    /** First member with the highest fitness. */
    private static Member bestOf(Member[] population) {
        Member best = population[0];
        for (int i = 1; i < population.length; i++) {
            if (population[i].fitness > best.fitness) best = population[i];
        }
        return best;
    }

    private static List<AssignmentMatrix> genomes(Member[] population) {
        List<AssignmentMatrix> out = new ArrayList<>(population.length);
        for (Member m : population) out.add(m.genome);
        return Collections.unmodifiableList(out);
    }

    private static double seconds(StopWatch clock) {
        return clock.getNanoTime() / 1e9;
    }

    private static final class Member {
        final AssignmentMatrix genome;
        final double fitness;

        Member(AssignmentMatrix genome, double fitness) {
            this.genome = genome;
            this.fitness = fitness;
        }
    }
}
