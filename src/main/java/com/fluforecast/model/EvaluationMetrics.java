package com.fluforecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Forecast accuracy over a holdout window. {@code mape} is {@code null} when every actual
 * value was zero.
 */
public record EvaluationMetrics(
    @JsonProperty("MAE") double mae,
    @JsonProperty("RMSE") double rmse,
    @JsonProperty("MAPE") Double mape
) {

    public Optional<Double> mapeIfDefined() {
        return Optional.ofNullable(mape);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("MAE", mae);
        map.put("RMSE", rmse);
        map.put("MAPE", mape);
        return map;
    }
}
