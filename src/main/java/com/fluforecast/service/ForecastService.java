package com.fluforecast.service;

import com.fluforecast.dto.ForecastRequest;
import com.fluforecast.dto.ForecastResponse;
import com.fluforecast.exception.FittingException;
import com.fluforecast.exception.InsufficientDataException;
import com.fluforecast.exception.InvalidArgumentException;
import com.fluforecast.model.ArimaOrder;
import com.fluforecast.model.ModelType;
import com.fluforecast.model.PipelineReport;
import com.fluforecast.model.TimeSeries;
import com.fluforecast.pipeline.ForecastPipeline;
import com.fluforecast.pipeline.PipelineOptions;
import com.fluforecast.pipeline.PipelineStageListener;
import com.fluforecast.sample.WeekLabel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Caller-side policy around {@link ForecastPipeline}: request defaults, a deadline for the
 * whole run, and the optional moving-average fallback. The pipeline itself never retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final ForecastPipeline pipeline;

    @Value("${forecast.defaults.forecast-weeks:4}")
    private int defaultForecastWeeks;

    @Value("${forecast.defaults.test-weeks:12}")
    private int defaultTestWeeks;

    @Value("${forecast.defaults.window:4}")
    private int defaultWindow;

    @Value("${forecast.defaults.order:2,1,2}")
    private int[] defaultOrder;

    @Value("${forecast.pipeline.timeout-seconds:30}")
    private long timeoutSeconds;

    public Mono<ForecastResponse> forecast(ForecastRequest request, String requestId) {
        return Mono.fromCallable(() -> forecastBlocking(request, requestId, PipelineStageListener.NOOP))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(Duration.ofSeconds(timeoutSeconds));
    }

    public ForecastResponse forecastBlocking(ForecastRequest request, String requestId, PipelineStageListener listener) {
        TimeSeries series = TimeSeries.of(request.getValues());
        PipelineOptions options = resolveOptions(request);
        WeekLabel lastLabel = resolveLastLabel(request);
        log.info("Forecast requested | observations={} | model={} | horizon={} | holdout={} | requestId={}",
                 series.size(), options.getModelType().label(), options.getForecastWeeks(),
                 options.getTestWeeks(), requestId);

        boolean fallbackApplied = false;
        PipelineReport report;
        try {
            report = pipeline.run(series, options, listener);
        } catch (FittingException | InsufficientDataException ex) {
            if (!request.isFallbackToMovingAverage() || options.getModelType() != ModelType.ARIMA) {
                throw ex;
            }
            log.warn("ARIMA unavailable, falling back to moving average | errorCode={} | reason={} | requestId={}",
                     ex.getErrorCode(), ex.getMessage(), requestId);
            report = pipeline.run(series, options.withModelType(ModelType.MOVING_AVERAGE), listener);
            fallbackApplied = true;
        }
        return toResponse(report, lastLabel, options.getForecastWeeks(), fallbackApplied, requestId);
    }

    PipelineOptions resolveOptions(ForecastRequest request) {
        int[] order = defaultOrder != null && defaultOrder.length == 3 ? defaultOrder : new int[] {2, 1, 2};
        return PipelineOptions.builder()
            .forecastWeeks(request.getForecastWeeks() != null ? request.getForecastWeeks() : defaultForecastWeeks)
            .testWeeks(request.getTestWeeks() != null ? request.getTestWeeks() : defaultTestWeeks)
            .window(request.getWindow() != null ? request.getWindow() : defaultWindow)
            .order(request.getOrder() != null
                ? ArimaOrder.of(request.getOrder())
                : new ArimaOrder(order[0], order[1], order[2]))
            .modelType(request.getModelType() != null ? ModelType.fromLabel(request.getModelType()) : ModelType.ARIMA)
            .build();
    }

    private WeekLabel resolveLastLabel(ForecastRequest request) {
        List<Integer> years = request.getYears();
        List<Integer> weeks = request.getWeeks();
        if (years == null && weeks == null) {
            return null;
        }
        int n = request.getValues().size();
        if (years == null || weeks == null || years.size() != n || weeks.size() != n) {
            throw new InvalidArgumentException("years and weeks must both be given with one entry per value");
        }
        return new WeekLabel(years.get(n - 1), weeks.get(n - 1));
    }

    private ForecastResponse toResponse(PipelineReport report, WeekLabel lastLabel, int horizon,
                                        boolean fallbackApplied, String requestId) {
        return ForecastResponse.builder()
            .modelType(report.getModelType())
            .modelSummary(report.getModelSummary())
            .metrics(report.getMetrics())
            .testActual(report.getTestActual())
            .testPredicted(report.getTestPredicted())
            .futureForecast(report.getFutureForecast())
            .futureWeeks(lastLabel != null ? lastLabel.following(horizon) : null)
            .trainSize(report.getTrainSize())
            .testSize(report.getTestActual().size())
            .fallbackApplied(fallbackApplied)
            .requestId(requestId)
            .generatedAt(Instant.now())
            .build();
    }
}
