package by.greenmobile.ewjam.service.optimization;

import by.greenmobile.ewjam.entity.ConvergenceRecord;
import by.greenmobile.ewjam.entity.OptimizerOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * Logs every {@code every}-th generation at INFO, the rest at DEBUG.
 */
@Slf4j
public class LoggingGenerationListener implements GenerationListener {

    private final int every;

    public LoggingGenerationListener(int every) {
        this.every = Math.max(1, every);
    }

    @Override
    public void onGeneration(GenerationSnapshot snapshot) {
        ConvergenceRecord r = snapshot.getRecord();
        if (r.getGeneration() % every == 0) {
            log.info("ePDE gen {}: avg={} max={} best={} t={}s",
                    r.getGeneration(), fmt(r.getAvgFitness()), fmt(r.getMaxFitness()), fmt(r.getBestFitness()),
                    fmt(snapshot.getElapsedSeconds()));
        } else if (log.isDebugEnabled()) {
            log.debug("ePDE gen {}: avg={} max={} best={}",
                    r.getGeneration(), fmt(r.getAvgFitness()), fmt(r.getMaxFitness()), fmt(r.getBestFitness()));
        }
    }

    @Override
    public void onCompleted(OptimizerOutcome outcome) {
        log.info("ePDE done: generations={} stop={} best={} t={}s",
                outcome.getGenerationsCompleted(), outcome.getStopReason(),
                fmt(outcome.getBestFitness()), fmt(outcome.getElapsedSeconds()));
    }

    private static String fmt(double v) {
        return String.format(Locale.US, "%.3f", v);
    }
}
