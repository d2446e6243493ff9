package com.fluforecast.controller;

import com.fluforecast.dto.SampleDataResponse;
import com.fluforecast.dto.SampleForecastResponse;
import com.fluforecast.dto.SampleStatsResponse;
import com.fluforecast.service.SampleDataService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only endpoints over the bundled synthetic ILI series. */
@Validated
@RestController
@RequestMapping("/api/v1/sample")
@RequiredArgsConstructor
public class SampleDataController {

    private final SampleDataService sampleDataService;

    @GetMapping("/data")
    public ResponseEntity<SampleDataResponse> data(
            @RequestParam(defaultValue = "20") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(sampleDataService.recent(limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<SampleStatsResponse> stats() {
        return ResponseEntity.ok(sampleDataService.statistics());
    }

    @GetMapping("/forecast")
    public ResponseEntity<SampleForecastResponse> forecast() {
        return ResponseEntity.ok(sampleDataService.forecast());
    }
}
