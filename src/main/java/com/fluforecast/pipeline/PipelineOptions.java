package com.fluforecast.pipeline;

import com.fluforecast.exception.InvalidArgumentException;
import com.fluforecast.forecaster.ArimaTrainer;
import com.fluforecast.forecaster.ModelTrainer;
import com.fluforecast.forecaster.MovingAverageTrainer;
import com.fluforecast.model.ArimaOrder;
import com.fluforecast.model.ModelState;
import com.fluforecast.model.ModelType;
import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@With
@Builder
public class PipelineOptions {

    @Builder.Default
    int forecastWeeks = 4;

    @Builder.Default
    int testWeeks = 12;

    @Builder.Default
    ArimaOrder order = ArimaOrder.DEFAULT;

    @Builder.Default
    int window = MovingAverageTrainer.DEFAULT_WINDOW;

    @Builder.Default
    ModelType modelType = ModelType.ARIMA;

    public static PipelineOptions defaults() {
        return PipelineOptions.builder().build();
    }

    public void validate() {
        if (forecastWeeks < 1) {
            throw new InvalidArgumentException("forecastWeeks must be at least 1, got " + forecastWeeks);
        }
        if (testWeeks < 1) {
            throw new InvalidArgumentException("testWeeks must be at least 1, got " + testWeeks);
        }
        if (window < 1) {
            throw new InvalidArgumentException("window must be at least 1, got " + window);
        }
        if (order == null || modelType == null) {
            throw new InvalidArgumentException("order and modelType are required");
        }
    }

    /** Trainer for the configured strategy; a fresh instance per call. */
    public ModelTrainer<? extends ModelState> newTrainer() {
        return switch (modelType) {
            case ARIMA -> new ArimaTrainer(order);
            case MOVING_AVERAGE -> new MovingAverageTrainer(window);
        };
    }
}
