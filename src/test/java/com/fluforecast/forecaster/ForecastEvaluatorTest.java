package com.fluforecast.forecaster;

import com.fluforecast.exception.InvalidArgumentException;
import com.fluforecast.model.EvaluationMetrics;
import com.fluforecast.model.ForecastResult;
import com.fluforecast.model.TimeSeries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ForecastEvaluatorTest {

    private final ForecastEvaluator evaluator = new ForecastEvaluator();

    @Test
    void evaluate_perfectForecast_isZero() {
        EvaluationMetrics metrics = evaluator.evaluate(List.of(1.0, 2.0, 3.0), List.of(1.0, 2.0, 3.0));

        assertThat(metrics.mae()).isZero();
        assertThat(metrics.rmse()).isZero();
        assertThat(metrics.mape()).isZero();
    }

    @Test
    void evaluate_symmetricErrors_computesAllThreeMetrics() {
        EvaluationMetrics metrics = evaluator.evaluate(List.of(100.0, 100.0), List.of(110.0, 90.0));

        assertThat(metrics.mae()).isEqualTo(10.0);
        assertThat(metrics.rmse()).isEqualTo(10.0);
        assertThat(metrics.mape()).isEqualTo(10.0);
        assertThat(metrics.toMap()).containsKeys("MAE", "RMSE", "MAPE");
    }

    @Test
    void evaluate_roundsMaeToFourAndMapeToTwoPlaces() {
        EvaluationMetrics metrics = evaluator.evaluate(List.of(3.0), List.of(13.0 / 3.0));

        assertThat(metrics.mae()).isEqualTo(1.3333);
        assertThat(metrics.mape()).isEqualTo(44.44);
    }

    @Test
    void evaluate_tiesRoundHalfToEven() {
        EvaluationMetrics metrics = evaluator.evaluate(List.of(1.0), List.of(1.03125));

        assertThat(metrics.mae()).isEqualTo(0.0312);
        assertThat(metrics.rmse()).isEqualTo(0.0312);
        assertThat(metrics.mape()).isEqualTo(3.12);
    }

    @Test
    void evaluate_lengthMismatch_truncatesToShorter() {
        EvaluationMetrics metrics = evaluator.evaluate(
            TimeSeries.of(1.0, 2.0, 3.0, 4.0), new ForecastResult(List.of(2.0, 3.0)));

        assertThat(metrics.mae()).isEqualTo(1.0);
        assertThat(metrics.rmse()).isEqualTo(1.0);
    }

    @Test
    void evaluate_allZeroActuals_leavesMapeUndefined() {
        EvaluationMetrics metrics = evaluator.evaluate(List.of(0.0, 0.0), List.of(1.0, 1.0));

        assertThat(metrics.mape()).isNull();
        assertThat(metrics.mapeIfDefined()).isEmpty();
        assertThat(metrics.mae()).isEqualTo(1.0);
    }

    @Test
    void evaluate_zeroActualsSkippedForMape() {
        EvaluationMetrics metrics = evaluator.evaluate(List.of(0.0, 2.0), List.of(5.0, 3.0));

        assertThat(metrics.mape()).isEqualTo(50.0);
    }

    @Test
    void evaluate_emptyWindow_throwsInvalidArgument() {
        assertThatThrownBy(() -> evaluator.evaluate(List.of(), List.of()))
            .isInstanceOf(InvalidArgumentException.class);
    }
}
