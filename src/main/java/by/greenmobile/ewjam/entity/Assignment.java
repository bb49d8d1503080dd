package by.greenmobile.ewjam.entity;

import lombok.Value;
import lombok.With;

/**
 * One gene: what a single jammer does. A null target means the jammer stays idle.
 */
@Value
@With
public class Assignment {
    String targetRadarId;
    JammingTechnique technique;
    BandwidthMode bandwidthMode;

    public static Assignment of(String targetRadarId, JammingTechnique technique, BandwidthMode bandwidthMode) {
        return new Assignment(targetRadarId, technique, bandwidthMode);
    }

    public static Assignment idle(JammingTechnique technique, BandwidthMode bandwidthMode) {
        return new Assignment(null, technique, bandwidthMode);
    }

    public boolean isAssigned() {
        return targetRadarId != null;
    }
}
