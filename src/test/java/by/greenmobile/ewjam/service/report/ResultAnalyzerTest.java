package by.greenmobile.ewjam.service.report;

import by.greenmobile.ewjam.entity.Assignment;
import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.AssignmentReport;
import by.greenmobile.ewjam.entity.AssignmentRow;
import by.greenmobile.ewjam.entity.BandwidthMode;
import by.greenmobile.ewjam.entity.ConvergenceAnalysis;
import by.greenmobile.ewjam.entity.ConvergenceRecord;
import by.greenmobile.ewjam.entity.JammingTechnique;
import by.greenmobile.ewjam.entity.RadarStage;
import by.greenmobile.ewjam.entity.Scenario;
import by.greenmobile.ewjam.service.analysis.CombatAnalyzer;
import by.greenmobile.ewjam.service.engine.EffectivenessModel;
import by.greenmobile.ewjam.support.TestScenarios;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultAnalyzerTest {

    private final ResultAnalyzer analyzer = new ResultAnalyzer();

    private static List<ConvergenceRecord> history(double... best) {
        List<ConvergenceRecord> out = new ArrayList<>();
        for (int g = 0; g < best.length; g++) {
            out.add(new ConvergenceRecord(g, best[g] / 2, best[g], best[g]));
        }
        return out;
    }

    @Test
    void emptyHistoryGivesNeutralAnalysis() {
        assertEquals(ConvergenceAnalysis.empty(), analyzer.analyzeConvergence(List.of()));
        assertEquals(ConvergenceAnalysis.empty(), analyzer.analyzeConvergence(null));
        assertEquals(1.0, ConvergenceAnalysis.empty().getStability());
    }

    @Test
    void plateauStartIsTheConvergenceGeneration() {
        double[] best = new double[25];
        for (int g = 0; g < best.length; g++) {
            best[g] = Math.min(g + 1, 5);
        }

        ConvergenceAnalysis a = analyzer.analyzeConvergence(history(best));

        assertEquals(4, a.getConvergenceGeneration());
        assertEquals(5.0, a.getFinalBestFitness(), 1e-12);
        assertEquals(2.5, a.getFinalAvgFitness(), 1e-12);
        assertEquals(4.0, a.getImprovementRatio(), 1e-12);
        assertEquals(1.0, a.getStability(), 1e-9);
    }

    @Test
    void noPlateauReportsSeriesLength() {
        double[] best = new double[15];
        for (int g = 0; g < best.length; g++) {
            best[g] = 0.1 * g + 1;
        }
        assertEquals(15, analyzer.analyzeConvergence(history(best)).getConvergenceGeneration());

        assertEquals(6, analyzer.analyzeConvergence(history(1, 1, 1, 1, 1, 1)).getConvergenceGeneration());
    }

    @Test
    void improvementRatioIsZeroForNonPositiveStart() {
        assertEquals(0.0, analyzer.analyzeConvergence(history(0, 1, 2)).getImprovementRatio());
    }

    @Test
    void stabilityDropsWhenTheTailMoves() {
        assertEquals(1.0, analyzer.stability(new double[]{1, 2, 3}));

        double steady = analyzer.stability(new double[]{1, 1, 1, 1, 1, 1, 1, 1});
        double moving = analyzer.stability(new double[]{1, 1, 1, 1, 1, 2, 3, 4});
        assertEquals(1.0, steady, 1e-9);
        assertTrue(moving < steady);
    }

    @Test
    void reportListsAssignedJammersWithStandaloneEffect() {
        Scenario s = TestScenarios.twoVsThree();
        CombatAnalyzer combat = new CombatAnalyzer(new EffectivenessModel(false));
        AssignmentMatrix best = AssignmentMatrix.of(List.of("J1", "J2", "J3"), new Assignment[]{
                Assignment.of("R1", JammingTechnique.MFT, BandwidthMode.NARROW),
                Assignment.idle(JammingTechnique.NJ, BandwidthMode.NARROW),
                Assignment.of("R2", JammingTechnique.RGPO, BandwidthMode.MEDIUM)});

        AssignmentReport report = analyzer.generateAssignmentReport(best, s, combat);

        assertEquals(2, report.getAssignments().size());
        AssignmentRow first = report.getAssignments().get(0);
        assertEquals("J1", first.getJammerId());
        assertEquals("R1", first.getTargetId());
        assertEquals("Search radar", first.getTargetName());
        assertEquals(RadarStage.SEARCH, first.getTargetStage());
        assertEquals(combat.singleEffect(s.getRadars().get(0), s.getJammers().get(0),
                JammingTechnique.MFT, BandwidthMode.NARROW, 1), first.getSingleEffectiveness(), 1e-12);

        AssignmentRow second = report.getAssignments().get(1);
        assertEquals(RadarStage.TRACKING, second.getTargetStage());
        assertTrue(second.getSingleEffectiveness() > 0);

        assertEquals(2, report.getSummary().getAssignedJammers());
        assertEquals(3, report.getSummary().getTotalJammers());
        assertEquals(2.0 / 3.0, report.getSummary().getResourceUtilization(), 1e-12);
        assertEquals(List.of("R1", "R2"), List.copyOf(report.getRadarEffects().keySet()));
    }
}
