package com.fluforecast.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class PipelineReport {
    EvaluationMetrics metrics;
    List<Double> testActual;
    List<Double> testPredicted;
    List<Double> futureForecast;
    ModelType modelType;
    String modelSummary;
    int trainSize;

    /** Plain key/value view for presentation layers. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("metrics", metrics.toMap());
        map.put("test_actual", testActual);
        map.put("test_predicted", testPredicted);
        map.put("future_forecast", futureForecast);
        map.put("model_type", modelType.label());
        return map;
    }
}
