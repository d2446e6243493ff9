package com.fluforecast.forecaster;

import com.fluforecast.exception.FittingException;
import com.fluforecast.exception.InsufficientDataException;
import com.fluforecast.model.ArimaModelState;
import com.fluforecast.model.ArimaOrder;
import com.fluforecast.model.ForecastResult;
import com.fluforecast.model.ModelType;
import com.fluforecast.model.TimeSeries;
import com.github.signaflo.timeseries.model.arima.Arima;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * ARIMA(p,d,q) estimated by signaflo's conditional-sum-of-squares plus maximum-likelihood fit.
 * Any failure inside the estimator surfaces as {@link FittingException} with the cause kept.
 */
@Slf4j
public class ArimaTrainer implements ModelTrainer<ArimaModelState> {

    public static final int MIN_OBSERVATIONS = 20;

    @Getter
    private final ArimaOrder order;

    public ArimaTrainer() {
        this(ArimaOrder.DEFAULT);
    }

    public ArimaTrainer(ArimaOrder order) {
        this.order = order != null ? order : ArimaOrder.DEFAULT;
    }

    @Override
    public ModelType type() {
        return ModelType.ARIMA;
    }

    @Override
    public ArimaModelState fit(TimeSeries train) {
        if (train.size() < MIN_OBSERVATIONS) {
            throw new InsufficientDataException("Need at least " + MIN_OBSERVATIONS + " data points for ARIMA",
                MIN_OBSERVATIONS, train.size());
        }
        int parameters = order.p() + order.q() + (order.d() == 0 ? 1 : 0);
        int usable = train.size() - order.d() - order.p();
        if (usable <= parameters) {
            throw new FittingException("ARIMA" + order + " needs more than " + parameters
                + " usable observations after differencing, got " + Math.max(usable, 0));
        }

        Arima model;
        try {
            model = Arima.model(
                com.github.signaflo.timeseries.TimeSeries.from(train.toArray()),
                com.github.signaflo.timeseries.model.arima.ArimaOrder.order(order.p(), order.d(), order.q()));
        } catch (RuntimeException ex) {
            throw new FittingException("ARIMA" + order + " fitting failed: " + ex.getMessage(), ex);
        }

        double sigma2 = model.sigma2();
        if (!Double.isFinite(sigma2)) {
            throw new FittingException("ARIMA" + order + " produced a non-finite innovation variance: " + sigma2);
        }
        log.debug("ARIMA fitted | order={} | nobs={} | sigma2={} | aic={}", order, train.size(), sigma2, model.aic());
        return new ArimaModelState(order, model, model.coefficients(), sigma2, model.aic(), train.size());
    }

    @Override
    public ForecastResult forecast(ArimaModelState state, int steps) {
        ModelTrainer.checkForecastRequest(state, steps);
        List<Double> path;
        try {
            path = state.model().forecast(steps).pointEstimates().asList();
        } catch (RuntimeException ex) {
            throw new FittingException("ARIMA" + state.order() + " forecast failed: " + ex.getMessage(), ex);
        }
        if (path.stream().anyMatch(v -> v == null || !Double.isFinite(v))) {
            throw new FittingException("ARIMA" + state.order() + " produced a non-finite forecast");
        }
        return new ForecastResult(path);
    }
}
