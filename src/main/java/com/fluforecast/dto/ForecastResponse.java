package com.fluforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fluforecast.model.EvaluationMetrics;
import com.fluforecast.model.ModelType;
import com.fluforecast.sample.WeekLabel;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResponse {
    ModelType modelType;
    String modelSummary;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    EvaluationMetrics metrics;
    List<Double> testActual;
    List<Double> testPredicted;
    List<Double> futureForecast;
    List<WeekLabel> futureWeeks;
    int trainSize;
    int testSize;
    boolean fallbackApplied;
    String requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
}
