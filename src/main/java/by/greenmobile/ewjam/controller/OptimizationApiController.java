package by.greenmobile.ewjam.controller;

import by.greenmobile.ewjam.config.OptimizerProperties;
import by.greenmobile.ewjam.entity.OptimizationRequest;
import by.greenmobile.ewjam.entity.OptimizationResult;
import by.greenmobile.ewjam.entity.OptimizationStatistics;
import by.greenmobile.ewjam.entity.OptimizerConfig;
import by.greenmobile.ewjam.entity.PerformanceAssessment;
import by.greenmobile.ewjam.service.OptimizationController;
import by.greenmobile.ewjam.service.analysis.PerformanceAssessmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/optimization")
@RequiredArgsConstructor
@Slf4j
public class OptimizationApiController {

    private final OptimizationController optimizationController;
    private final PerformanceAssessmentService assessmentService;
    private final OptimizerProperties properties;

    @PostMapping
    public OptimizationResult optimize(@RequestBody OptimizationRequest request) {
        if (request == null) throw new IllegalArgumentException("Request body is required");

        OptimizerConfig config = request.getConfig() != null ? request.getConfig() : properties.toConfig();
        boolean illumination = request.getConsiderPlatformIllumination() != null
                ? request.getConsiderPlatformIllumination()
                : properties.isConsiderPlatformIllumination();

        return optimizationController.runOptimization(request.toScenario(), config, illumination);
    }

    @GetMapping("/statistics")
    public OptimizationStatistics statistics() {
        return optimizationController.getOptimizationStatistics();
    }

    @GetMapping("/latest/assessment")
    public ResponseEntity<PerformanceAssessment> latestAssessment() {
        return optimizationController.latestResult()
                .map(assessmentService::assess)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
