package com.fluforecast.forecaster;

import com.fluforecast.exception.NotFittedException;
import com.fluforecast.model.ArimaOrder;
import com.fluforecast.model.ModelType;
import com.fluforecast.model.TimeSeries;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FluForecasterTest {

    @Test
    void predict_beforeFit_throwsNotFitted() {
        FluForecaster forecaster = new FluForecaster();

        assertThat(forecaster.isFitted()).isFalse();
        assertThat(forecaster.state()).isEmpty();
        assertThat(forecaster.summary()).isEqualTo("No model fitted yet");
        assertThatThrownBy(() -> forecaster.predict(4))
            .isInstanceOf(NotFittedException.class)
            .hasMessageContaining("Model not fitted");
    }

    @Test
    void fitMovingAverage_thenPredict() {
        FluForecaster forecaster = new FluForecaster();
        forecaster.fitMovingAverage(TimeSeries.of(1.0, 2.0, 3.0, 4.0), 2);

        assertThat(forecaster.isFitted()).isTrue();
        assertThat(forecaster.modelType()).contains(ModelType.MOVING_AVERAGE);
        assertThat(forecaster.predict(1).get(0)).isEqualTo(3.5);
    }

    @Test
    void refit_replacesPreviousModel() {
        FluForecaster forecaster = new FluForecaster();
        TimeSeries series = SeriesFixtures.seasonal(80);
        forecaster.fitMovingAverage(series, 4);

        forecaster.fitArima(series, ArimaOrder.DEFAULT);

        assertThat(forecaster.modelType()).contains(ModelType.ARIMA);
        assertThat(forecaster.summary()).startsWith("ARIMA(2,1,2)");
        assertThat(forecaster.predict(3).size()).isEqualTo(3);
    }

    @Test
    void prepareData_andEvaluate_delegate() {
        FluForecaster forecaster = new FluForecaster();
        SeriesSplit split = forecaster.prepareData(SeriesFixtures.ramp(30), 5);
        forecaster.fitMovingAverage(split.train(), 1);

        assertThat(forecaster.evaluate(split.test(), forecaster.predict(5)).mae()).isPositive();
    }
}
