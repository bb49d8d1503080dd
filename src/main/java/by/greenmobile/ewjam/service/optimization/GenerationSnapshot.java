package by.greenmobile.ewjam.service.optimization;

import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.ConvergenceRecord;
import lombok.Value;

import java.util.List;

/**
 * State after one generation. The population list is read-only and replaced each generation.
 */
@Value
public class GenerationSnapshot {
    ConvergenceRecord record;
    List<AssignmentMatrix> population;
    double elapsedSeconds;
}
