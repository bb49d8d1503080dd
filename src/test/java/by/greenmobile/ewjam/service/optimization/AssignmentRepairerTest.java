package by.greenmobile.ewjam.service.optimization;

import by.greenmobile.ewjam.entity.Assignment;
import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.BandwidthMode;
import by.greenmobile.ewjam.entity.Jammer;
import by.greenmobile.ewjam.entity.JammingTechnique;
import by.greenmobile.ewjam.entity.RadarStage;
import by.greenmobile.ewjam.entity.Scenario;
import by.greenmobile.ewjam.support.TestScenarios;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;

import static by.greenmobile.ewjam.support.TestScenarios.jammer;
import static by.greenmobile.ewjam.support.TestScenarios.radar;
import static org.junit.jupiter.api.Assertions.*;

class AssignmentRepairerTest {

    @Test
    void overloadedPairMovesToLeastLoadedRadar() {
        ScenarioIndex index = ScenarioIndex.of(TestScenarios.twoVsThree());
        AssignmentRepairer repairer = new AssignmentRepairer(index);

        AssignmentMatrix trial = AssignmentMatrix.of(index.jammerIds(), new Assignment[]{
                Assignment.of("R1", JammingTechnique.NJ, BandwidthMode.NARROW),
                Assignment.of("R1", JammingTechnique.CP, BandwidthMode.NARROW),
                Assignment.idle(JammingTechnique.MFT, BandwidthMode.WIDE)});

        AssignmentMatrix repaired = repairer.repair(trial, new SplittableRandom(1));

        assertEquals("R2", repaired.gene(0).getTargetRadarId());
        assertEquals(BandwidthMode.NARROW, repaired.gene(0).getBandwidthMode());
        assertEquals("R1", repaired.gene(1).getTargetRadarId());
        assertFalse(repaired.gene(2).isAssigned());
    }

    @Test
    void widensInPlaceWhenNoRadarHasSpareCapacity() {
        Scenario s = Scenario.builder()
                .radars(List.of(radar("R1", RadarStage.SEARCH, 40.0, 116.0, 100)))
                .jammers(List.of(jammer("J1", 40.0, 116.0, 1000), jammer("J2", 40.0, 116.0, 1000)))
                .build();
        ScenarioIndex index = ScenarioIndex.of(s);

        AssignmentMatrix trial = AssignmentMatrix.of(index.jammerIds(), new Assignment[]{
                Assignment.of("R1", JammingTechnique.NJ, BandwidthMode.NARROW),
                Assignment.of("R1", JammingTechnique.MFT, BandwidthMode.NARROW)});

        AssignmentMatrix repaired = new AssignmentRepairer(index).repair(trial, new SplittableRandom(1));

        assertEquals("R1", repaired.gene(0).getTargetRadarId());
        assertEquals(BandwidthMode.MEDIUM, repaired.gene(0).getBandwidthMode());
        assertEquals(BandwidthMode.NARROW, repaired.gene(1).getBandwidthMode());
    }

    @Test
    void danglingTargetIsRedirectedOrCleared() {
        ScenarioIndex index = ScenarioIndex.of(TestScenarios.twoVsThree());
        AssignmentMatrix trial = AssignmentMatrix.of(index.jammerIds(), new Assignment[]{
                Assignment.of("R404", JammingTechnique.NJ, BandwidthMode.WIDE),
                Assignment.idle(JammingTechnique.NJ, BandwidthMode.WIDE),
                Assignment.idle(JammingTechnique.NJ, BandwidthMode.WIDE)});

        AssignmentMatrix repaired = new AssignmentRepairer(index).repair(trial, new SplittableRandom(3));
        assertTrue(index.hasRadar(repaired.gene(0).getTargetRadarId()));

        Scenario noRadars = Scenario.builder().jammers(List.of(jammer("J1", 40.0, 116.0, 1000))).build();
        ScenarioIndex empty = ScenarioIndex.of(noRadars);
        AssignmentMatrix lone = AssignmentMatrix.of(empty.jammerIds(), new Assignment[]{
                Assignment.of("R1", JammingTechnique.NJ, BandwidthMode.NARROW)});
        assertFalse(new AssignmentRepairer(empty).repair(lone, new SplittableRandom(3)).gene(0).isAssigned());
    }

    @Test
    void feasibleGenomeIsReturnedUnchanged() {
        ScenarioIndex index = ScenarioIndex.of(TestScenarios.twoVsThree());
        AssignmentMatrix trial = AssignmentMatrix.of(index.jammerIds(), new Assignment[]{
                Assignment.of("R1", JammingTechnique.MFT, BandwidthMode.NARROW),
                Assignment.of("R2", JammingTechnique.RGPO, BandwidthMode.NARROW),
                Assignment.of("R2", JammingTechnique.VGPO, BandwidthMode.MEDIUM)});

        assertSame(trial, new AssignmentRepairer(index).repair(trial, new SplittableRandom(1)));
    }

    @Test
    void noPairExceedsCapacityAfterRepair() {
        Scenario s = TestScenarios.fourVsFive();
        // twelve jammers against five radars
        List<Jammer> jammers = new ArrayList<>(s.getJammers());
        for (int k = 5; k <= 12; k++) {
            jammers.add(jammer("J" + k, 40.0, 116.5, 1000));
        }
        s.setJammers(jammers);
        ScenarioIndex index = ScenarioIndex.of(s);
        AssignmentRepairer repairer = new AssignmentRepairer(index);
        SplittableRandom rng = new SplittableRandom(42);

        for (int round = 0; round < 200; round++) {
            Assignment[] genes = new Assignment[index.jammerCount()];
            for (int j = 0; j < genes.length; j++) {
                String target = rng.nextInt(5) == 0 ? "ghost" : index.radarIds().get(rng.nextInt(index.radarCount()));
                genes[j] = Assignment.of(target, JammingTechnique.NJ,
                        BandwidthMode.values()[rng.nextInt(BandwidthMode.values().length)]);
            }
            AssignmentMatrix repaired = repairer.repair(AssignmentMatrix.of(index.jammerIds(), genes), rng);

            assertEquals(index.jammerCount(), repaired.size());
            int[][] counts = repairer.countPairs(repaired.genesCopy());
            for (int[] perMode : counts) {
                for (BandwidthMode mode : BandwidthMode.values()) {
                    assertTrue(perMode[mode.ordinal()] <= mode.getCapacity());
                }
            }
            for (int j = 0; j < repaired.size(); j++) {
                Assignment g = repaired.gene(j);
                assertTrue(!g.isAssigned() || index.hasRadar(g.getTargetRadarId()));
            }
        }
    }
}
