package org.example.stylelock.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.stylelock.config.RequestCorrelation;
import org.example.stylelock.service.GenerationMetricsService;
import org.example.stylelock.service.generation.GenerationClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

@RestController
public class HealthController {

    private final GenerationClient generationClient;
    private final GenerationMetricsService generationMetricsService;

    public HealthController(GenerationClient generationClient, GenerationMetricsService generationMetricsService) {
        this.generationClient = generationClient;
        this.generationMetricsService = generationMetricsService;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        boolean generationAvailable = generationClient.isAvailable();
        return new HealthDetails(
                generationAvailable ? "ok" : "degraded",
                generationAvailable,
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now(),
                generationMetricsService.snapshot()
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            boolean generationServiceAvailable,
            String requestId,
            LocalDateTime asOf,
            Map<String, Object> generationMetrics
    ) {
    }
}
