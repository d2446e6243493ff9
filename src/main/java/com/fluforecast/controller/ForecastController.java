package com.fluforecast.controller;

import com.fluforecast.config.RequestIdFilter;
import com.fluforecast.dto.AsyncJobResponse;
import com.fluforecast.dto.ForecastRequest;
import com.fluforecast.dto.ForecastResponse;
import com.fluforecast.service.AsyncJobService;
import com.fluforecast.service.ForecastService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastService forecastService;
    private final AsyncJobService asyncJobService;

    @PostMapping("/forecasts")
    public Mono<ResponseEntity<ForecastResponse>> forecast(
            @Valid @RequestBody ForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestIdOf(httpRequest);
        log.info("POST /forecasts | observations={} | modelType={} | requestId={}",
                 request.getValues().size(), request.getModelType(), requestId);
        return forecastService.forecast(request, requestId)
            .map(r -> ResponseEntity.ok().header(RequestIdFilter.HEADER, requestId).body(r));
    }

    @PostMapping("/forecasts/async")
    public ResponseEntity<AsyncJobResponse> forecastAsync(
            @Valid @RequestBody ForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestIdOf(httpRequest);
        UUID jobId = asyncJobService.submit(
            "FORECAST",
            requestId,
            listener -> forecastService.forecastBlocking(request, requestId, listener)
        );
        return ResponseEntity.accepted()
            .header(RequestIdFilter.HEADER, requestId)
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }
}
