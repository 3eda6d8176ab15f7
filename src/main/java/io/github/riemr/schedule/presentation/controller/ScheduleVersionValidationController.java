package io.github.riemr.schedule.presentation.controller;

import io.github.riemr.schedule.application.dto.CompatibilityCheckRequest;
import io.github.riemr.schedule.application.dto.ConflictReport;
import io.github.riemr.schedule.application.dto.ScheduleMetrics;
import io.github.riemr.schedule.application.dto.ScheduleSuggestion;
import io.github.riemr.schedule.application.dto.SuggestionRequest;
import io.github.riemr.schedule.application.dto.ValidationResult;
import io.github.riemr.schedule.application.service.DateRangeValidationService;
import io.github.riemr.schedule.application.service.ScheduleConflictAnalysisService;
import io.github.riemr.schedule.application.service.ScheduleMetricsService;
import io.github.riemr.schedule.application.service.ScheduleSuggestionService;
import io.github.riemr.schedule.application.service.ScheduleVersionTransformService;
import io.github.riemr.schedule.application.service.VersionCompatibilityService;
import io.github.riemr.schedule.domain.model.DateRangeCandidate;
import io.github.riemr.schedule.domain.model.ExportFormat;
import io.github.riemr.schedule.domain.model.ScheduleVersion;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * JSON endpoints used by the date range picker and the version management screens.
 * Negative validation outcomes are normal results and are returned with 200.
 */
@RestController
@RequestMapping("/api/schedule-versions/validation")
@RequiredArgsConstructor
public class ScheduleVersionValidationController {
    private final DateRangeValidationService dateRangeValidationService;
    private final VersionCompatibilityService compatibilityService;
    private final ScheduleConflictAnalysisService conflictAnalysisService;
    private final ScheduleMetricsService metricsService;
    private final ScheduleSuggestionService suggestionService;
    private final ScheduleVersionTransformService transformService;

    @PostMapping(path = "/date-range", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ValidationResult validateDateRange(@RequestBody DateRangeCandidate candidate) {
        return dateRangeValidationService.validate(candidate);
    }

    @PostMapping(path = "/compatibility", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> checkCompatibility(@RequestBody CompatibilityCheckRequest req) {
        if (req.current() == null || req.target() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "current and target are required"));
        }
        return ResponseEntity.ok(compatibilityService.check(req.current(), req.target()));
    }

    @PostMapping(path = "/conflicts", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ConflictReport analyzeConflicts(@RequestBody List<ScheduleVersion> versions) {
        return conflictAnalysisService.analyze(versions);
    }

    @PostMapping(path = "/metrics", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ScheduleMetrics computeMetrics(@RequestBody ScheduleVersion version) {
        return metricsService.compute(version);
    }

    @PostMapping(path = "/suggestions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public List<ScheduleSuggestion> suggest(@RequestBody SuggestionRequest req) {
        return suggestionService.suggest(req.toCandidate(), req.existingVersions());
    }

    @PostMapping(path = "/transform", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> transform(@RequestBody ScheduleVersion version,
                                       @RequestParam(name = "format", defaultValue = "standard") String format) {
        ExportFormat exportFormat = ExportFormat.fromCode(format);
        if (exportFormat == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unsupported format: " + format));
        }
        return ResponseEntity.ok(transformService.transform(version, exportFormat));
    }
}
