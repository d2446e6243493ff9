package com.fluforecast.forecaster;

import com.fluforecast.exception.InvalidArgumentException;
import com.fluforecast.model.Decimals;
import com.fluforecast.model.EvaluationMetrics;
import com.fluforecast.model.ForecastResult;
import com.fluforecast.model.TimeSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class ForecastEvaluator {

    public EvaluationMetrics evaluate(TimeSeries actual, ForecastResult predicted) {
        return evaluate(actual.toList(), predicted.values());
    }

    /**
     * Scores {@code predicted} against {@code actual}. Sequences of different length are
     * truncated to the shorter one. MAPE skips zero actuals and is {@code null} when all
     * of them are zero.
     */
    public EvaluationMetrics evaluate(List<Double> actual, List<Double> predicted) {
        int n = Math.min(actual.size(), predicted.size());
        if (n == 0) {
            throw new InvalidArgumentException("Cannot evaluate an empty forecast window");
        }
        if (actual.size() != predicted.size()) {
            log.debug("Evaluation length mismatch | actual={} | predicted={} | truncatedTo={}",
                actual.size(), predicted.size(), n);
        }

        double absErrorSum = 0.0;
        double squaredErrorSum = 0.0;
        double apeSum = 0.0;
        int apeCount = 0;

        for (int i = 0; i < n; i++) {
            double a = actual.get(i);
            double error = predicted.get(i) - a;
            absErrorSum += Math.abs(error);
            squaredErrorSum += error * error;
            if (a != 0.0d) {
                apeSum += Math.abs(error / a);
                apeCount++;
            }
        }

        Double mape = apeCount > 0 ? Decimals.round((apeSum / apeCount) * 100.0, 2) : null;
        return new EvaluationMetrics(
            Decimals.round(absErrorSum / n, 4),
            Decimals.round(Math.sqrt(squaredErrorSum / n), 4),
            mape
        );
    }
}
