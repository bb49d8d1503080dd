package by.greenmobile.ewjam.entity;

import lombok.Value;

@Value
public class AssessmentCriterion {
    String name;
    double actual;
    double target;
    /** true: actual must be >= target; false: actual must be <= target. */
    boolean higherIsBetter;
    boolean passed;
}
