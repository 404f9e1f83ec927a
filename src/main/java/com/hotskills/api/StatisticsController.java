package com.hotskills.api;

import com.hotskills.domain.model.Language;
import com.hotskills.domain.model.LanguageProfile;
import com.hotskills.domain.model.MetricSeries;
import com.hotskills.domain.model.SalaryEntry;
import com.hotskills.domain.service.AggregateResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the statistics front end.
 *
 * Endpoints:
 * - GET /api/salaries - Salary ranges per language
 * - GET /api/languages - Language reference list
 * - GET /api/languages/{code} - Language page data (404 if unknown)
 * - GET /api/vacancy-statistics[/{query}] - Daily/hourly vacancy series
 * - GET /api/resume-statistics - Daily/hourly resume series
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class StatisticsController {

    private final AggregateResolver aggregateResolver;

    @GetMapping("/salaries")
    public ResponseEntity<List<SalaryEntry>> salaries() {
        log.info("Get salaries");
        return ResponseEntity.ok(aggregateResolver.resolveSalaries());
    }

    /**
     * Response: [{"code":"one_c","name":"1C","color":"#E31E24"}, ...]
     */
    @GetMapping("/languages")
    public ResponseEntity<List<Language>> languages() {
        log.info("Get languages");
        return ResponseEntity.ok(aggregateResolver.resolveLanguages());
    }

    @GetMapping("/languages/{code}")
    public ResponseEntity<LanguageProfile> language(@PathVariable String code) {
        log.info("Get language profile: code={}", code);
        return aggregateResolver.resolveLanguageProfile(code)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Vacancy statistics, optionally for one language or profession.
     *
     * Response:
     * {"python":             {"daily": [["2025-05-22", [1200, 1600]], ...],
     *                         "hourly": [["2025-05-23T17:00:00Z", [1100, 1500]], ...]},
     *  "software_developer": {"daily": [["2025-05-22", 14500], ...], ...}}
     */
    @GetMapping({"/vacancy-statistics", "/vacancy-statistics/{query}"})
    public ResponseEntity<Map<String, MetricSeries>> vacancyStatistics(
            @PathVariable(required = false) String query) {
        log.info("Get vacancy statistics: query={}", query);
        return ResponseEntity.ok(aggregateResolver.resolveVacancyStatistics(query));
    }

    @GetMapping("/resume-statistics")
    public ResponseEntity<Map<String, MetricSeries>> resumeStatistics() {
        log.info("Get resume statistics");
        return ResponseEntity.ok(aggregateResolver.resolveResumeStatistics());
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
