package by.greenmobile.ewjam.service.optimization;

import by.greenmobile.ewjam.entity.Jammer;
import by.greenmobile.ewjam.entity.Radar;
import by.greenmobile.ewjam.entity.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Frozen view of a scenario for one optimizer run: jammer order and radar id -> position.
 */
public final class ScenarioIndex {

    private final List<Radar> radars;
    private final List<Jammer> jammers;
    private final List<String> radarIds;
    private final Map<String, Integer> radarPositions;
    private final List<String> jammerIds;

    private ScenarioIndex(List<Radar> radars, List<Jammer> jammers,
                          List<String> radarIds, Map<String, Integer> radarPositions, List<String> jammerIds) {
        this.radars = radars;
        this.jammers = jammers;
        this.radarIds = radarIds;
        this.radarPositions = radarPositions;
        this.jammerIds = jammerIds;
    }

    /**
     * @throws IllegalArgumentException when a jammer or radar has no id, or two jammers share one
     */
    public static ScenarioIndex of(Scenario scenario) {
        Objects.requireNonNull(scenario, "scenario");

        List<Jammer> jammers = new ArrayList<>();
        List<String> jammerIds = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Jammer j : scenario.jammersOrEmpty()) {
            if (j == null || j.getId() == null) {
                throw new IllegalArgumentException("Jammer without id in scenario " + scenario.getName());
            }
            if (!seen.add(j.getId())) {
                throw new IllegalArgumentException("Duplicate jammer id: " + j.getId());
            }
            jammers.add(j);
            jammerIds.add(j.getId());
        }

        List<Radar> radars = new ArrayList<>();
        List<String> radarIds = new ArrayList<>();
        Map<String, Integer> positions = new HashMap<>();
        for (Radar r : scenario.radarsOrEmpty()) {
            if (r == null) continue;
            if (r.getId() == null) {
                throw new IllegalArgumentException("Radar without id in scenario " + scenario.getName());
            }
            radars.add(r);
            // only the first radar with a given id is a valid target
            if (!positions.containsKey(r.getId())) {
                positions.put(r.getId(), radarIds.size());
                radarIds.add(r.getId());
            }
        }

        return new ScenarioIndex(
                Collections.unmodifiableList(radars),
                Collections.unmodifiableList(jammers),
                Collections.unmodifiableList(radarIds),
                Collections.unmodifiableMap(positions),
                Collections.unmodifiableList(jammerIds));
    }

    public List<Radar> radars() {
        return radars;
    }

    public List<Jammer> jammers() {
        return jammers;
    }

    /** Distinct target ids, scenario order. */
    public List<String> radarIds() {
        return radarIds;
    }

    public List<String> jammerIds() {
        return jammerIds;
    }

    public int radarCount() {
        return radarIds.size();
    }

    public int jammerCount() {
        return jammerIds.size();
    }

    public boolean hasRadar(String radarId) {
        return radarId != null && radarPositions.containsKey(radarId);
    }

    /** -1 for an unknown id. */
    public int radarPosition(String radarId) {
        if (radarId == null) return -1;
        Integer p = radarPositions.get(radarId);
        return p != null ? p : -1;
    }
}
