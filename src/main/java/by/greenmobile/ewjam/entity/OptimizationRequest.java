package by.greenmobile.ewjam.entity;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * HTTP request body: the scenario plus optional run settings.
 */
@Data
@NoArgsConstructor
public class OptimizationRequest {

    private String name;

    private List<Radar> radars;

    private List<Jammer> jammers;

    /** Null = use the configured defaults. */
    private OptimizerConfig config;

    /** Null = use the configured default. */
    private Boolean considerPlatformIllumination;

    public Scenario toScenario() {
        return Scenario.builder()
                .name(name)
                .radars(radars)
                .jammers(jammers)
                .build();
    }
}
