package com.fluforecast.model;

import com.github.signaflo.timeseries.model.arima.Arima;
import com.github.signaflo.timeseries.model.arima.ArimaCoefficients;

import java.util.Locale;

/**
 * Fitted ARIMA model together with the figures reported for it.
 *
 * @param order        (p, d, q) the model was fitted with
 * @param model        the estimated model; forecasts are produced from it
 * @param coefficients estimated AR/MA coefficients and mean
 * @param sigma2       innovation variance of the fit
 * @param aic          Akaike information criterion of the fit
 * @param observations length of the training series
 */
public record ArimaModelState(
    ArimaOrder order,
    Arima model,
    ArimaCoefficients coefficients,
    double sigma2,
    double aic,
    int observations
) implements ModelState {

    @Override
    public ModelType type() {
        return ModelType.ARIMA;
    }

    @Override
    public String summary() {
        return String.format(Locale.ROOT, "ARIMA%s | nobs=%d | sigma2=%.6f | aic=%.2f | coefficients=%s",
            order, observations, sigma2, aic, coefficients);
    }
}
