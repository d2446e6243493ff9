package com.fluforecast.forecaster;

import com.fluforecast.exception.InsufficientDataException;
import com.fluforecast.exception.InvalidArgumentException;
import com.fluforecast.model.ForecastResult;
import com.fluforecast.model.MovingAverageModelState;
import com.fluforecast.model.TimeSeries;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MovingAverageTrainerTest {

    @Test
    void forecast_firstStepIsMeanOfLastWindow() {
        MovingAverageTrainer trainer = new MovingAverageTrainer(4);
        MovingAverageModelState state = trainer.fit(TimeSeries.of(9.0, 1.0, 2.0, 3.0, 4.0));

        ForecastResult result = trainer.forecast(state, 1);

        assertThat(state.lastValues()).containsExactly(1.0, 2.0, 3.0, 4.0);
        assertThat(result.get(0)).isCloseTo(2.5, within(1e-12));
    }

    @Test
    void forecast_slidesOverOwnPredictions() {
        MovingAverageTrainer trainer = new MovingAverageTrainer(2);
        MovingAverageModelState state = trainer.fit(TimeSeries.of(2.0, 4.0));

        ForecastResult result = trainer.forecast(state, 3);

        assertThat(result.values()).containsExactly(3.0, 3.5, 3.25);
    }

    @Test
    void forecast_constantSeries_staysFlat() {
        MovingAverageTrainer trainer = new MovingAverageTrainer();
        MovingAverageModelState state = trainer.fit(TimeSeries.of(1.5, 1.5, 1.5, 1.5, 1.5, 1.5));

        assertThat(trainer.forecast(state, 6).values()).containsOnly(1.5);
    }

    @Test
    void fit_seriesShorterThanWindow_usesAllValues() {
        MovingAverageTrainer trainer = new MovingAverageTrainer(4);
        MovingAverageModelState state = trainer.fit(TimeSeries.of(1.0, 3.0));

        assertThat(trainer.forecast(state, 1).get(0)).isEqualTo(2.0);
        assertThat(state.summary()).isEqualTo("Moving Average (window=4)");
    }

    @Test
    void fit_emptySeries_throwsInsufficientData() {
        assertThatThrownBy(() -> new MovingAverageTrainer().fit(TimeSeries.of()))
            .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void constructor_rejectsNonPositiveWindow() {
        assertThatThrownBy(() -> new MovingAverageTrainer(0))
            .isInstanceOf(InvalidArgumentException.class);
    }
}
