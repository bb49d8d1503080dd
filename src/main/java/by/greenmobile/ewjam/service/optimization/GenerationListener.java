package by.greenmobile.ewjam.service.optimization;

import by.greenmobile.ewjam.entity.OptimizerOutcome;

/**
 * Progress observer of an ePDE run. Called on the thread that runs the optimizer.
 */
public interface GenerationListener {

    GenerationListener NOOP = snapshot -> { };

    void onGeneration(GenerationSnapshot snapshot);

    default void onCompleted(OptimizerOutcome outcome) {
    }
}
