package by.greenmobile.ewjam.service.engine;

import by.greenmobile.ewjam.entity.BandwidthMode;
import by.greenmobile.ewjam.entity.JammingTechnique;
import by.greenmobile.ewjam.entity.RadarStage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Lookup tables of the jamming effectiveness model.
 *
 * Tables:
 * 1) stage effectiveness [stage][technique], two variants (with / without platform illumination)
 * 2) technique interaction [technique][technique], symmetric
 * 3) bandwidth adjustment [mode][assignedCount - 1], NaN = infeasible
 * 4) stage interaction [stage][stage], reserved
 *
 * Indexed by enum ordinal. Constant data, safe to share between threads.
 */
public final class EffectivenessModel {

    // RGPO/VGPO: pulling range/velocity gates exposes the illuminated platform
    private static final double[][] STAGE_WITH_ILLUMINATION = {
            //  NJ    CP    MFT   RGPO  VGPO
            {0.8, 0.9, 1.0, -0.9, -0.9},   // search
            {0.9, 0.9, 1.0, -0.9, -0.9},   // acquisition
            {-0.9, -0.9, 0.0, -0.9, -0.8}, // tracking
            {-0.9, -0.9, 0.0, -0.8, -0.9}  // guidance
    };

    private static final double[][] STAGE_WITHOUT_ILLUMINATION = {
            {0.8, 0.9, 1.0, 0.2, 0.2},
            {0.9, 0.9, 1.0, 0.1, 0.1},
            {0.0, 0.0, 0.0, 0.9, 0.8},
            {0.0, 0.0, 0.0, 0.8, 0.9}
    };

    private static final double[][] TECHNIQUE_INTERACTION = {
            //  NJ    CP    MFT   RGPO  VGPO
            {0.0, 0.0, 0.2, -0.3, -0.3},
            {0.0, 0.0, 0.1, 0.2, 0.2},
            {0.2, 0.1, 0.0, -0.2, -0.2},
            {-0.3, 0.2, -0.2, 0.0, 0.2},
            {-0.3, 0.2, -0.2, 0.2, 0.0}
    };

    private static final double X = Double.NaN;

    private static final double[][] BANDWIDTH_ADJUSTMENT = {
            //  1      2      3      4     5
            {0.0, X, X, X, X},                 // narrow
            {-0.1, -0.2, -0.35, X, X},         // medium
            {-0.15, -0.25, -0.4, -0.6, -0.8}   // wide
    };

    private static final double[][] STAGE_INTERACTION = {
            {0.1, 0.0, 0.0, 0.0},
            {0.2, 0.1, 0.0, 0.0},
            {0.3, 0.2, 0.1, 0.0},
            {0.4, 0.3, 0.2, 0.1}
    };

    private final boolean considerPlatformIllumination;
    private final double[][] stageTable;

    public EffectivenessModel(boolean considerPlatformIllumination) {
        this.considerPlatformIllumination = considerPlatformIllumination;
        this.stageTable = considerPlatformIllumination ? STAGE_WITH_ILLUMINATION : STAGE_WITHOUT_ILLUMINATION;
    }

    public boolean isConsiderPlatformIllumination() {
        return considerPlatformIllumination;
    }

    /**
     * 0.0 for an unknown stage or technique.
     */
    public double stageEffectiveness(RadarStage stage, JammingTechnique technique) {
        if (stage == null || technique == null) return 0.0;
        return stageTable[stage.ordinal()][technique.ordinal()];
    }

    public double techniqueInteraction(JammingTechnique t1, JammingTechnique t2) {
        if (t1 == null || t2 == null) return 0.0;
        return TECHNIQUE_INTERACTION[t1.ordinal()][t2.ordinal()];
    }

    /**
     * Empty when the mode cannot serve {@code assignedCount} simultaneous targets.
     */
    public OptionalDouble bandwidthAdjustment(BandwidthMode mode, int assignedCount) {
        if (mode == null || assignedCount < 1 || assignedCount > mode.getCapacity()) {
            return OptionalDouble.empty();
        }
        double[] row = BANDWIDTH_ADJUSTMENT[mode.ordinal()];
        if (assignedCount > row.length) return OptionalDouble.empty();
        double v = row[assignedCount - 1];
        return Double.isNaN(v) ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public double stageInteraction(RadarStage s1, RadarStage s2) {
        if (s1 == null || s2 == null) return 0.0;
        return STAGE_INTERACTION[s1.ordinal()][s2.ordinal()];
    }

    /**
     * All four tables keyed by their codes, for display.
     */
    public Map<String, Object> snapshot() {
        Map<String, Map<String, Double>> stage = new LinkedHashMap<>();
        for (RadarStage s : RadarStage.values()) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (JammingTechnique t : JammingTechnique.values()) {
                row.put(t.name(), stageEffectiveness(s, t));
            }
            stage.put(s.getCode(), row);
        }

        Map<String, Map<String, Double>> tech = new LinkedHashMap<>();
        for (JammingTechnique t1 : JammingTechnique.values()) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (JammingTechnique t2 : JammingTechnique.values()) {
                row.put(t2.name(), techniqueInteraction(t1, t2));
            }
            tech.put(t1.name(), row);
        }

        Map<String, Map<Integer, Double>> bw = new LinkedHashMap<>();
        for (BandwidthMode m : BandwidthMode.values()) {
            Map<Integer, Double> row = new LinkedHashMap<>();
            for (int count = 1; count <= BandwidthMode.WIDE.getCapacity(); count++) {
                OptionalDouble adj = bandwidthAdjustment(m, count);
                row.put(count, adj.isPresent() ? adj.getAsDouble() : null);
            }
            bw.put(m.getCode(), row);
        }

        Map<String, Map<String, Double>> stageInter = new LinkedHashMap<>();
        for (RadarStage s1 : RadarStage.values()) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (RadarStage s2 : RadarStage.values()) {
                row.put(s2.getCode(), stageInteraction(s1, s2));
            }
            stageInter.put(s1.getCode(), row);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("consider_platform_illumination", considerPlatformIllumination);
        out.put("stage_effectiveness", stage);
        out.put("technique_interaction", tech);
        out.put("bandwidth_adjustment", bw);
        out.put("stage_interaction", stageInter);
        return out;
    }
}
