package by.greenmobile.ewjam.entity;

import lombok.Value;

@Value
public class AssignmentRow {
    String jammerId;
    String jammerName;
    String targetId;
    String targetName;
    JammingTechnique technique;
    BandwidthMode bandwidth;
    /** Standalone effect of this jammer on its target. */
    double singleEffectiveness;
    RadarStage targetStage;
}
