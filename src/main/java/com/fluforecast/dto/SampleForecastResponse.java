package com.fluforecast.dto;

import com.fluforecast.model.EvaluationMetrics;
import com.fluforecast.model.ModelType;
import com.fluforecast.sample.WeekLabel;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SampleForecastResponse {
    String status;
    ModelType model;
    EvaluationMetrics metrics;
    List<Double> forecast;
    List<WeekLabel> forecastWeeks;
}
