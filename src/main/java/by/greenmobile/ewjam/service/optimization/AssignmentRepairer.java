package by.greenmobile.ewjam.service.optimization;

import by.greenmobile.ewjam.entity.Assignment;
import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.BandwidthMode;

import java.util.List;
import java.util.SplittableRandom;

/**
 * Feasibility pass over a trial genome.
 *
 * 1) a gene aimed at a radar that does not exist goes to a random existing radar
 *    (or becomes idle when the scenario has no radars);
 * 2) every gene that overloads its (radar, bandwidth mode) pair moves to the least loaded radar
 *    with spare capacity for that mode; failing that it is widened in place, failing that it goes idle.
 *
 * After repair no (radar, mode) pair holds more genes than the mode's capacity.
 */
public class AssignmentRepairer {

    private static final BandwidthMode[] MODES = BandwidthMode.values();

    private final ScenarioIndex index;

    public AssignmentRepairer(ScenarioIndex index) {
        this.index = index;
    }

    public AssignmentMatrix repair(AssignmentMatrix trial, SplittableRandom rng) {
        Assignment[] genes = trial.genesCopy();
        List<String> radarIds = index.radarIds();
        int radarCount = radarIds.size();
        boolean changed = false;

        // 1) dangling targets
        for (int i = 0; i < genes.length; i++) {
            Assignment g = genes[i];
            if (g.isAssigned() && !index.hasRadar(g.getTargetRadarId())) {
                String newTarget = radarCount > 0 ? radarIds.get(rng.nextInt(radarCount)) : null;
                genes[i] = g.withTargetRadarId(newTarget);
                changed = true;
            }
        }

        // 2) bandwidth capacity
        int[][] counts = countPairs(genes);
        for (int i = 0; i < genes.length; i++) {
            Assignment g = genes[i];
            if (!g.isAssigned() || g.getBandwidthMode() == null) continue;

            int m = g.getBandwidthMode().ordinal();
            int r = index.radarPosition(g.getTargetRadarId());
            if (r < 0 || counts[r][m] <= MODES[m].getCapacity()) continue;

            counts[r][m]--;
            changed = true;

            int target = leastLoadedWithSpare(counts, m);
            if (target >= 0) {
                counts[target][m]++;
                genes[i] = g.withTargetRadarId(radarIds.get(target));
                continue;
            }

            int wider = widerModeWithSpare(counts, r, m);
            if (wider >= 0) {
                counts[r][wider]++;
                genes[i] = g.withBandwidthMode(MODES[wider]);
                continue;
            }

            genes[i] = g.withTargetRadarId(null);
        }

        return changed ? trial.withGenes(genes) : trial;
    }

    /**
     * [radar position][mode ordinal] -> genes aimed at that pair. Unknown targets are not counted.
     */
    int[][] countPairs(Assignment[] genes) {
        int[][] counts = new int[index.radarCount()][MODES.length];
        for (Assignment g : genes) {
            if (!g.isAssigned() || g.getBandwidthMode() == null) continue;
            int r = index.radarPosition(g.getTargetRadarId());
            if (r >= 0) counts[r][g.getBandwidthMode().ordinal()]++;
        }
        return counts;
    }

    private static int leastLoadedWithSpare(int[][] counts, int mode) {
        int capacity = MODES[mode].getCapacity();
        int best = -1;
        for (int r = 0; r < counts.length; r++) {
            if (counts[r][mode] >= capacity) continue;
            if (best < 0 || counts[r][mode] < counts[best][mode]) best = r;
        }
        return best;
    }

    private static int widerModeWithSpare(int[][] counts, int radar, int mode) {
        for (int w = mode + 1; w < MODES.length; w++) {
            if (counts[radar][w] < MODES[w].getCapacity()) return w;
        }
        return -1;
    }
}
