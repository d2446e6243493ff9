package com.fluforecast.forecaster;

import com.fluforecast.exception.InsufficientDataException;
import com.fluforecast.exception.InvalidArgumentException;
import com.fluforecast.model.TimeSeries;
import org.springframework.stereotype.Component;

/**
 * Last-k holdout split. Purely positional; shuffling would leak future weeks into training.
 */
@Component
public class TrainTestSplitter {

    /** Training points required beyond the holdout. */
    public static final int MIN_TRAINING_SURPLUS = 10;

    public SeriesSplit split(TimeSeries series, int testSize) {
        if (testSize < 1) {
            throw new InvalidArgumentException("testSize must be at least 1, got " + testSize);
        }
        int required = testSize + MIN_TRAINING_SURPLUS;
        if (series.size() < required) {
            throw new InsufficientDataException("Not enough data for train/test split", required, series.size());
        }
        int cut = series.size() - testSize;
        return new SeriesSplit(series.slice(0, cut), series.slice(cut, series.size()));
    }
}
