package by.greenmobile.ewjam.service.optimization;

import by.greenmobile.ewjam.entity.Assignment;
import by.greenmobile.ewjam.entity.AssignmentEvaluation;
import by.greenmobile.ewjam.entity.AssignmentMatrix;
import by.greenmobile.ewjam.entity.BandwidthMode;
import by.greenmobile.ewjam.entity.JammingTechnique;
import by.greenmobile.ewjam.service.analysis.CombatAnalyzer;
import by.greenmobile.ewjam.service.engine.EffectivenessModel;
import by.greenmobile.ewjam.support.TestScenarios;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FitnessEvaluatorTest {

    private CombatAnalyzer analyzer;
    private ScenarioIndex index;
    private FitnessEvaluator evaluator;

    @BeforeEach
    void setUp() {
        analyzer = new CombatAnalyzer(new EffectivenessModel(true));
        index = ScenarioIndex.of(TestScenarios.twoVsThree());
        evaluator = new FitnessEvaluator(analyzer, index);
    }

    @Test
    void penaltyCountsDanglingTargetsAndCapacityOverrun() {
        AssignmentMatrix m = AssignmentMatrix.of(index.jammerIds(), new Assignment[]{
                Assignment.of("R1", JammingTechnique.NJ, BandwidthMode.NARROW),
                Assignment.of("R1", JammingTechnique.CP, BandwidthMode.NARROW),
                Assignment.of("R404", JammingTechnique.MFT, BandwidthMode.WIDE)});

        assertEquals(FitnessEvaluator.DANGLING_PENALTY + FitnessEvaluator.OVERRUN_PENALTY, evaluator.penalty(m), 1e-12);
        assertTrue(evaluator.fitness(m) >= 0.0);
    }

    @Test
    void feasibleGenomeScoresEffectPlusBonuses() {
        AssignmentMatrix m = AssignmentMatrix.of(index.jammerIds(), new Assignment[]{
                Assignment.of("R1", JammingTechnique.MFT, BandwidthMode.NARROW),
                Assignment.of("R1", JammingTechnique.CP, BandwidthMode.MEDIUM),
                Assignment.of("R2", JammingTechnique.MFT, BandwidthMode.WIDE)});

        AssignmentEvaluation ev = analyzer.evaluateAssignment(m, index.radars(), index.jammers());
        double expected = ev.getTotalEffectiveness()
                + FitnessEvaluator.UTILIZATION_WEIGHT * ev.getResourceUtilization()
                + FitnessEvaluator.INTERRUPTION_WEIGHT * ev.getInterruptionCount();

        assertEquals(0.0, evaluator.penalty(m), 1e-12);
        assertEquals(Math.max(0.0, expected), evaluator.fitness(m), 1e-12);
        assertEquals(1.0, ev.getResourceUtilization(), 1e-12);
    }

    @Test
    void allIdleGenomeHasZeroFitness() {
        AssignmentMatrix m = AssignmentMatrix.of(index.jammerIds(), new Assignment[]{
                Assignment.idle(JammingTechnique.NJ, BandwidthMode.NARROW),
                Assignment.idle(JammingTechnique.NJ, BandwidthMode.NARROW),
                Assignment.idle(JammingTechnique.NJ, BandwidthMode.NARROW)});

        assertEquals(0.0, evaluator.fitness(m), 1e-12);
    }

    @Test
    void fitnessIsFlooredAtZero() {
        // RGPO against a tracking radar with illumination hurts; the dangling genes add penalty
        AssignmentMatrix m = AssignmentMatrix.of(index.jammerIds(), new Assignment[]{
                Assignment.of("R2", JammingTechnique.RGPO, BandwidthMode.NARROW),
                Assignment.of("ghost", JammingTechnique.NJ, BandwidthMode.NARROW),
                Assignment.of("ghost", JammingTechnique.NJ, BandwidthMode.NARROW)});

        assertEquals(0.0, evaluator.fitness(m), 1e-12);
    }
}
