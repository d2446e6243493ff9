package com.fluforecast.forecaster;

import com.fluforecast.exception.NotFittedException;
import com.fluforecast.model.ArimaOrder;
import com.fluforecast.model.EvaluationMetrics;
import com.fluforecast.model.ForecastResult;
import com.fluforecast.model.ModelState;
import com.fluforecast.model.ModelType;
import com.fluforecast.model.TimeSeries;

import java.util.Optional;

/**
 * Holds the fitted model for a single pipeline run. Each fit replaces the held state with
 * a new immutable {@link ModelState}; instances are never shared between runs.
 */
public class FluForecaster {

    private final TrainTestSplitter splitter;
    private final ForecastEvaluator evaluator;

    private Fitted<?> fitted;

    public FluForecaster() {
        this(new TrainTestSplitter(), new ForecastEvaluator());
    }

    public FluForecaster(TrainTestSplitter splitter, ForecastEvaluator evaluator) {
        this.splitter = splitter;
        this.evaluator = evaluator;
    }

    public SeriesSplit prepareData(TimeSeries series, int testSize) {
        return splitter.split(series, testSize);
    }

    public <S extends ModelState> S fit(ModelTrainer<S> trainer, TimeSeries train) {
        S state = trainer.fit(train);
        this.fitted = new Fitted<>(trainer, state);
        return state;
    }

    public ModelState fitArima(TimeSeries train, ArimaOrder order) {
        return fit(new ArimaTrainer(order), train);
    }

    public ModelState fitMovingAverage(TimeSeries train, int window) {
        return fit(new MovingAverageTrainer(window), train);
    }

    public ForecastResult predict(int steps) {
        if (fitted == null) {
            throw new NotFittedException();
        }
        return fitted.forecast(steps);
    }

    public EvaluationMetrics evaluate(TimeSeries actual, ForecastResult predicted) {
        return evaluator.evaluate(actual, predicted);
    }

    public boolean isFitted() {
        return fitted != null;
    }

    public Optional<ModelState> state() {
        return fitted == null ? Optional.empty() : Optional.of(fitted.state());
    }

    public Optional<ModelType> modelType() {
        return state().map(ModelState::type);
    }

    public String summary() {
        return state().map(ModelState::summary).orElse("No model fitted yet");
    }

    private record Fitted<S extends ModelState>(ModelTrainer<S> trainer, S state) {
        ForecastResult forecast(int steps) {
            return trainer.forecast(state, steps);
        }
    }
}
