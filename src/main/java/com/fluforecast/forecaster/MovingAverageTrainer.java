package com.fluforecast.forecaster;

import com.fluforecast.exception.InsufficientDataException;
import com.fluforecast.exception.InvalidArgumentException;
import com.fluforecast.model.ForecastResult;
import com.fluforecast.model.ModelType;
import com.fluforecast.model.MovingAverageModelState;
import com.fluforecast.model.TimeSeries;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Baseline that predicts the mean of the most recent {@code window} values, sliding the
 * window over its own predictions. Multi-step output flattens toward the recent mean.
 */
public class MovingAverageTrainer implements ModelTrainer<MovingAverageModelState> {

    public static final int DEFAULT_WINDOW = 4;

    @Getter
    private final int window;

    public MovingAverageTrainer() {
        this(DEFAULT_WINDOW);
    }

    public MovingAverageTrainer(int window) {
        if (window < 1) {
            throw new InvalidArgumentException("Moving average window must be at least 1, got " + window);
        }
        this.window = window;
    }

    @Override
    public ModelType type() {
        return ModelType.MOVING_AVERAGE;
    }

    @Override
    public MovingAverageModelState fit(TimeSeries train) {
        if (train.isEmpty()) {
            throw new InsufficientDataException("Moving average needs at least one observation", 1, 0);
        }
        return new MovingAverageModelState(window, train.tail(window).toList(), train.size());
    }

    @Override
    public ForecastResult forecast(MovingAverageModelState state, int steps) {
        ModelTrainer.checkForecastRequest(state, steps);
        List<Double> values = new ArrayList<>(state.lastValues());
        double[] predictions = new double[steps];
        for (int i = 0; i < steps; i++) {
            List<Double> recent = values.subList(Math.max(0, values.size() - state.window()), values.size());
            double prediction = recent.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
            predictions[i] = prediction;
            values.add(prediction);
        }
        return ForecastResult.of(predictions);
    }
}
