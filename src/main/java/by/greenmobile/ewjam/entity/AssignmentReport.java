package by.greenmobile.ewjam.entity;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class AssignmentReport {
    List<AssignmentRow> assignments;
    ReportSummary summary;
    Map<String, Double> radarEffects;
}
