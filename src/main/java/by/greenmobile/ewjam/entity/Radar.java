package by.greenmobile.ewjam.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Radar as supplied by the caller. Read-only for the optimizer.
 *
 * Units:
 * - frequency: GHz
 * - power: kW
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Radar {

    public static final double DEFAULT_INTERRUPTION_THRESHOLD = 0.3;

    private String id;

    private String name;

    private GeoPosition position;

    private Double frequency;

    private Double power;

    /** Current stage; null contributes no stage effectiveness. */
    private RadarStage currentStage;

    /** Denial threshold 0..1; the radar is interrupted when the jamming effect exceeds 1 - threshold. */
    private Double interruptionThreshold;

    public double interruptionThresholdOrDefault() {
        return interruptionThreshold != null ? interruptionThreshold : DEFAULT_INTERRUPTION_THRESHOLD;
    }
}
