package by.greenmobile.ewjam.config;

import by.greenmobile.ewjam.entity.OptimizerConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for optimization runs that do not carry their own settings.
 */
@Data
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    private int populationSize = 50;
    private int maxGenerations = 100;
    private double crossoverRate = 0.9;
    private double scalingFactor = 0.5;
    private double timeLimitSeconds = 1.0;
    private double mutationRate = 0.8;
    private double inheritRate = 0.5;
    private Long seed;
    private boolean parallel = true;

    /** Stage table variant used when the request does not say. */
    private boolean considerPlatformIllumination = true;

    /** INFO progress line every N generations. */
    private int progressLogEvery = 10;

    private History history = new History();

    public OptimizerConfig toConfig() {
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

    @Data
    public static class History {
        /** Oldest run records are evicted past this size. */
        private int maxRecords = 1000;
        /** Statistics cover this many most recent runs. */
        private int statisticsWindow = 10;
    }
}
