package by.greenmobile.ewjam.entity;

import lombok.Value;

/**
 * Serialized form of one gene of the best solution.
 */
@Value
public class SolutionEntry {
    String targetId;
    JammingTechnique technique;
    BandwidthMode bwType;
    Double jammerPower;
}
