package by.greenmobile.ewjam.service.analysis;

import by.greenmobile.ewjam.entity.AssessmentCriterion;
import by.greenmobile.ewjam.entity.OptimizationResult;
import by.greenmobile.ewjam.entity.PerformanceAssessment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Checks a finished run against the operational targets.
 */
@Service
@Slf4j
public class PerformanceAssessmentService {

    // decision time, seconds (upper bound)
    @Value("${assessment.max-decision-time-seconds:1.0}")
    private double maxDecisionTimeSeconds = 1.0;

    @Value("${assessment.min-resource-utilization:0.97}")
    private double minResourceUtilization = 0.97;

    @Value("${assessment.min-interruptions:3}")
    private int minInterruptions = 3;

    @Value("${assessment.min-best-fitness:0.9}")
    private double minBestFitness = 0.9;

    public PerformanceAssessment assess(OptimizationResult result) {
        if (result == null) throw new IllegalArgumentException("Result is required");

        List<AssessmentCriterion> criteria = new ArrayList<>(4);
        criteria.add(atMost("decision_time", result.getOptimizationTime(), maxDecisionTimeSeconds));
        criteria.add(atLeast("resource_utilization", result.getResourceUtilization(), minResourceUtilization));
        criteria.add(atLeast("interruptions", result.getInterruptionCount(), minInterruptions));
        criteria.add(atLeast("best_fitness", result.getBestFitness(), minBestFitness));

        int passed = (int) criteria.stream().filter(AssessmentCriterion::isPassed).count();

        if (log.isDebugEnabled()) {
            log.debug("ASSESS: passed {}/{} {}", passed, criteria.size(), criteria);
        }
        return new PerformanceAssessment(
                Collections.unmodifiableList(criteria),
                passed,
                criteria.size(),
                (double) passed / criteria.size());
    }

    private static AssessmentCriterion atLeast(String name, double actual, double target) {
        return new AssessmentCriterion(name, actual, target, true, actual >= target);
    }

    private static AssessmentCriterion atMost(String name, double actual, double target) {
        return new AssessmentCriterion(name, actual, target, false, actual <= target);
    }
}
