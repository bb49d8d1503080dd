package by.greenmobile.ewjam.entity;

import lombok.Value;

import java.util.List;

@Value
public class PerformanceAssessment {
    List<AssessmentCriterion> criteria;
    int passedCount;
    int totalCount;
    /** passedCount / totalCount, 0..1. */
    double passRate;
}
