package by.greenmobile.ewjam.entity;

import lombok.Value;

import java.util.Map;

@Value
public class AssignmentEvaluation {
    /** Sum of per-radar cooperative effects, within [-radars, radars]. */
    double totalEffectiveness;
    /** radarId -> cooperative effect, in scenario radar order. */
    Map<String, Double> radarEffects;
    /** Share of jammers with a target. */
    double resourceUtilization;
    int interruptionCount;
}
