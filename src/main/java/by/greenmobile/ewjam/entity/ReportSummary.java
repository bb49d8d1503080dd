package by.greenmobile.ewjam.entity;

import lombok.Value;

@Value
public class ReportSummary {
    double totalEffectiveness;
    double resourceUtilization;
    int interruptionCount;
    int assignedJammers;
    int totalJammers;
}
