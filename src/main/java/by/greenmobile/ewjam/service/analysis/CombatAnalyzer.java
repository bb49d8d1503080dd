package by.greenmobile.ewjam.service.analysis;

import by.greenmobile.ewjam.entity.Assignment;
import by.greenmobile.ewjam.entity.AssignmentEvaluation;
import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.BandwidthMode;
import by.greenmobile.ewjam.entity.GeoPosition;
import by.greenmobile.ewjam.entity.Jammer;
import by.greenmobile.ewjam.entity.JammingTechnique;
import by.greenmobile.ewjam.entity.Radar;
import by.greenmobile.ewjam.service.engine.EffectivenessModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Jammer-vs-radar effect model on top of {@link EffectivenessModel}:
 * - single effect: one jammer, one technique, one radar
 * - cooperative effect: everything aimed at one radar, with pairwise technique interaction
 * - whole-matrix evaluation
 *
 * Stateless apart from the tables, so one instance is shared by all optimizer workers.
 * Nothing here throws on bad entity data: missing references count as zero effect,
 * malformed positions/powers fall back to {@link #NEUTRAL_FACTOR}.
 */
@Slf4j
public class CombatAnalyzer {

    /** Effective jamming range, metres. */
    static final double EFFECTIVE_RANGE_M = 50_000.0;

    /** Distance factor beyond the effective range. */
    static final double FAR_FACTOR = 0.1;

    /** Distance factor drop across the effective range (1.0 at 0 m -> 0.2 at 50 km). */
    static final double RANGE_FALLOFF = 0.8;

    static final double EARTH_RADIUS_M = 6_371_000.0;

    /** Used when distance or power cannot be computed. */
    public static final double NEUTRAL_FACTOR = 0.5;

    private static final double POWER_EPS = 1e-6;

    private final EffectivenessModel model;

    public CombatAnalyzer(EffectivenessModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    public EffectivenessModel getModel() {
        return model;
    }

    /**
     * (stage + bandwidth adjustment) * distance factor * power factor, clamped to [-1, 1].
     *
     * @param assignedCount how many jammers share this (radar, bandwidth mode) pair
     * @return 0.0 when the mode cannot serve {@code assignedCount} targets
     */
    public double singleEffect(Radar radar, Jammer jammer, JammingTechnique technique,
                               BandwidthMode mode, int assignedCount) {
        if (radar == null || jammer == null) return 0.0;

        OptionalDouble bw = model.bandwidthAdjustment(mode, assignedCount);
        if (bw.isEmpty()) return 0.0;

        double base = model.stageEffectiveness(radar.getCurrentStage(), technique);
        double total = (base + bw.getAsDouble()) * distanceFactor(radar, jammer) * powerFactor(radar, jammer);
        return clamp(total);
    }

    /**
     * Sum of single effects plus techniqueInteraction(ti, tj) over every unordered pair of
     * techniques aimed at the radar, clamped to [-1, 1].
     * Infeasible entries (bandwidth overrun) add nothing and take no part in the pairs.
     */
    public double cooperativeEffect(Radar radar, List<TargetedAssignment> assignments) {
        if (radar == null || assignments == null || assignments.isEmpty()) return 0.0;

        double total = 0.0;
        List<JammingTechnique> active = new ArrayList<>(assignments.size());

        for (TargetedAssignment ta : assignments) {
            if (ta == null || ta.jammer == null || ta.assignment == null) continue;
            BandwidthMode mode = ta.assignment.getBandwidthMode();
            if (model.bandwidthAdjustment(mode, ta.assignedCount).isEmpty()) continue;

            JammingTechnique technique = ta.assignment.getTechnique();
            double single = singleEffect(radar, ta.jammer, technique, mode, ta.assignedCount);

            double interaction = 0.0;
            for (JammingTechnique other : active) {
                interaction += model.techniqueInteraction(technique, other);
            }

            total += single + interaction;
            active.add(technique);
        }

        return clamp(total);
    }

    /**
     * Evaluates a whole assignment matrix against the scenario entities.
     */
    public AssignmentEvaluation evaluateAssignment(AssignmentMatrix matrix, List<Radar> radars, List<Jammer> jammers) {
        List<Radar> radarList = radars != null ? radars : Collections.emptyList();
        List<Jammer> jammerList = jammers != null ? jammers : Collections.emptyList();

        Map<String, Radar> radarById = new HashMap<>(radarList.size() * 2);
        for (Radar r : radarList) {
            if (r != null && r.getId() != null) radarById.putIfAbsent(r.getId(), r);
        }
        Map<String, Jammer> jammerById = new HashMap<>(jammerList.size() * 2);
        for (Jammer j : jammerList) {
            if (j != null && j.getId() != null) jammerById.putIfAbsent(j.getId(), j);
        }

        // (radar, mode) -> number of genes sharing it
        Map<String, int[]> pairCounts = new HashMap<>();
        int n = matrix != null ? matrix.size() : 0;
        for (int i = 0; i < n; i++) {
            Assignment a = matrix.gene(i);
            if (!a.isAssigned() || a.getBandwidthMode() == null) continue;
            pairCounts.computeIfAbsent(a.getTargetRadarId(), k -> new int[BandwidthMode.values().length])
                    [a.getBandwidthMode().ordinal()]++;
        }

        Map<String, List<TargetedAssignment>> byRadar = new HashMap<>();
        for (int i = 0; i < n; i++) {
            Assignment a = matrix.gene(i);
            if (!a.isAssigned()) continue;
            Radar radar = radarById.get(a.getTargetRadarId());
            Jammer jammer = jammerById.get(matrix.jammerIdAt(i));
            if (radar == null || jammer == null) {
                // dangling reference: zero effect
                continue;
            }
            int count = a.getBandwidthMode() != null
                    ? pairCounts.get(a.getTargetRadarId())[a.getBandwidthMode().ordinal()]
                    : 0;
            byRadar.computeIfAbsent(radar.getId(), k -> new ArrayList<>())
                    .add(new TargetedAssignment(jammer, a, count));
        }

        double totalEffect = 0.0;
        int interruptions = 0;
        Map<String, Double> radarEffects = new LinkedHashMap<>();
        for (Radar radar : radarList) {
            // id-less radars cannot be targeted or keyed
            if (radar == null || radar.getId() == null) continue;
            double effect = cooperativeEffect(radar, byRadar.getOrDefault(radar.getId(), Collections.emptyList()));
            radarEffects.put(radar.getId(), effect);
            totalEffect += effect;
            if (effect > 1.0 - radar.interruptionThresholdOrDefault()) {
                interruptions++;
            }
        }

        int used = 0;
        for (Jammer j : jammerList) {
            if (j == null || matrix == null) continue;
            if (matrix.get(j.getId()).map(Assignment::isAssigned).orElse(false)) used++;
        }
        double utilization = jammerList.isEmpty() ? 0.0 : (double) used / jammerList.size();

        return new AssignmentEvaluation(totalEffect, Collections.unmodifiableMap(radarEffects), utilization, interruptions);
    }

    // =====================================================================
    // Distance / power factors
    // =====================================================================

    double distanceFactor(Radar radar, Jammer jammer) {
        OptionalDouble d = distanceMeters(radar.getPosition(), jammer.getPosition());
        if (d.isEmpty()) {
            if (log.isTraceEnabled()) {
                log.trace("DISTANCE: malformed position radar={} jammer={}, neutral factor", radar.getId(), jammer.getId());
            }
            return NEUTRAL_FACTOR;
        }
        double distance = d.getAsDouble();
        if (distance > EFFECTIVE_RANGE_M) return FAR_FACTOR;
        return 1.0 - (distance / EFFECTIVE_RANGE_M) * RANGE_FALLOFF;
    }

    double powerFactor(Radar radar, Jammer jammer) {
        Double jp = jammer.getPower();
        Double rp = radar.getPower();
        if (!isValidPower(jp) || !isValidPower(rp)) {
            if (log.isTraceEnabled()) {
                log.trace("POWER: malformed power radar={} jammer={}, neutral factor", radar.getId(), jammer.getId());
            }
            return NEUTRAL_FACTOR;
        }
        double ratio = jp / (rp + POWER_EPS);
        return Math.min(1.0, ratio / 10.0);
    }

    /**
     * Haversine great-circle distance, metres. Empty for a missing or out-of-range coordinate.
     */
    static OptionalDouble distanceMeters(GeoPosition p1, GeoPosition p2) {
        if (p1 == null || p2 == null) return OptionalDouble.empty();
        if (!isLatitude(p1.getLat()) || !isLatitude(p2.getLat())
                || !isLongitude(p1.getLon()) || !isLongitude(p2.getLon())) {
            return OptionalDouble.empty();
        }

        double lat1 = Math.toRadians(p1.getLat());
        double lat2 = Math.toRadians(p2.getLat());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(p2.getLon() - p1.getLon());

        double a = Math.pow(Math.sin(dLat / 2), 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(dLon / 2), 2);
        double c = 2 * Math.asin(Math.sqrt(Math.min(1.0, a)));
        return OptionalDouble.of(c * EARTH_RADIUS_M);
    }

    private static boolean isLatitude(Double v) {
        return v != null && !v.isNaN() && v >= -90.0 && v <= 90.0;
    }

    private static boolean isLongitude(Double v) {
        return v != null && !v.isNaN() && v >= -180.0 && v <= 180.0;
    }

    private static boolean isValidPower(Double v) {
        return v != null && !v.isNaN() && !v.isInfinite() && v >= 0.0;
    }

    private static double clamp(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }

    /**
     * One jammer's assignment aimed at a radar, with the occupancy of its (radar, mode) pair.
     */
    public static class TargetedAssignment {
        final Jammer jammer;
        final Assignment assignment;
        final int assignedCount;

        public TargetedAssignment(Jammer jammer, Assignment assignment, int assignedCount) {
            this.jammer = jammer;
            this.assignment = assignment;
            this.assignedCount = assignedCount;
        }
    }
}
