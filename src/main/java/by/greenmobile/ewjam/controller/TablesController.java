package by.greenmobile.ewjam.controller;

import by.greenmobile.ewjam.config.OptimizerProperties;
import by.greenmobile.ewjam.service.OptimizationController;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Read-only view of the effectiveness tables.
 */
@RestController
@RequiredArgsConstructor
public class TablesController {

    private final OptimizationController optimizationController;
    private final OptimizerProperties properties;

    @GetMapping("/api/tables")
    public Map<String, Object> tables(
            @RequestParam(name = "consider_platform_illumination", required = false) Boolean illumination) {
        boolean variant = illumination != null ? illumination : properties.isConsiderPlatformIllumination();
        return optimizationController.analyzer(variant).getModel().snapshot();
    }
}
