package by.greenmobile.ewjam.entity;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ePDE run parameters. Field defaults are the reference settings.
 */
@Data
@NoArgsConstructor
public class OptimizerConfig {

    private int populationSize = 50;

    private int maxGenerations = 100;

    /** CR: probability of taking the mutant gene during crossover. */
    private double crossoverRate = 0.9;

    /** F: probability of taking donor b over donor c when blending. */
    private double scalingFactor = 0.5;

    /** Wall-clock budget, polled at each generation start. */
    private double timeLimitSeconds = 1.0;

    /** Probability that a gene goes through the blend step at all. */
    private double mutationRate = 0.8;

    /** Inside the blend step: probability of copying donor a unchanged. */
    private double inheritRate = 0.5;

    /** Null = nondeterministic run. */
    private Long seed;

    /** Evaluate the individuals of a generation on the common pool. */
    private boolean parallel = true;

    public OptimizerConfig copy() {
        OptimizerConfig c = new OptimizerConfig();
        c.setPopulationSize(populationSize);
        c.setMaxGenerations(maxGenerations);
        c.setCrossoverRate(crossoverRate);
        c.setScalingFactor(scalingFactor);
        c.setTimeLimitSeconds(timeLimitSeconds);
        c.setMutationRate(mutationRate);
        c.setInheritRate(inheritRate);
        c.setSeed(seed);
        c.setParallel(parallel);
        return c;
    }

    public void validate() {
        if (populationSize < 1) {
            throw new IllegalArgumentException("populationSize must be >= 1, got " + populationSize);
        }
        if (maxGenerations < 0) {
            throw new IllegalArgumentException("maxGenerations must be >= 0, got " + maxGenerations);
        }
        if (timeLimitSeconds < 0 || Double.isNaN(timeLimitSeconds)) {
            throw new IllegalArgumentException("timeLimitSeconds must be >= 0, got " + timeLimitSeconds);
        }
        requireProbability("crossoverRate", crossoverRate);
        requireProbability("scalingFactor", scalingFactor);
        requireProbability("mutationRate", mutationRate);
        requireProbability("inheritRate", inheritRate);
    }

    private static void requireProbability(String name, double v) {
        if (!(v >= 0.0 && v <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + v);
        }
    }
}
