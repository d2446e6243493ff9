package com.fluforecast.sample;

import com.fluforecast.model.TimeSeries;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic stand-in for national ILINet data: winter peaks, summer lows and a small
 * year-over-year drift. Only the sample endpoints use it; the forecasting engine never
 * substitutes it for real input.
 */
@Component
public class SampleSeriesGenerator {

    public static final long SEED = 42L;
    public static final int FIRST_YEAR = 2020;
    public static final int LAST_YEAR = 2025;
    public static final int WEEKS_PER_YEAR = 52;

    public List<WeeklyObservation> generate() {
        Random random = new Random(SEED);
        List<WeeklyObservation> rows = new ArrayList<>();
        for (int year = FIRST_YEAR; year <= LAST_YEAR; year++) {
            for (int week = 1; week <= WEEKS_PER_YEAR; week++) {
                double baseIli;
                if (week <= 10 || week >= 48) {
                    baseIli = uniform(random, 3.5, 7.5);
                } else if (week >= 20 && week <= 35) {
                    baseIli = uniform(random, 0.8, 2.0);
                } else {
                    baseIli = uniform(random, 1.5, 4.0);
                }
                int direction = random.nextBoolean() ? 1 : -1;
                double yearFactor = 1 + (year - FIRST_YEAR) * 0.05 * direction;

                rows.add(WeeklyObservation.builder()
                    .year(year)
                    .week(week)
                    .region("National")
                    .iliPercentage(Math.round(baseIli * yearFactor * 100.0) / 100.0)
                    .numProviders(2000 + random.nextInt(1500))
                    .totalPatients(50_000 + random.nextInt(70_000))
                    .totalIli(1000 + random.nextInt(7000))
                    .build());
            }
        }
        return rows;
    }

    public TimeSeries iliSeries() {
        return iliSeries(generate());
    }

    public static TimeSeries iliSeries(List<WeeklyObservation> rows) {
        return TimeSeries.of(rows.stream().mapToDouble(WeeklyObservation::getIliPercentage).toArray());
    }

    private static double uniform(Random random, double low, double high) {
        return low + (high - low) * random.nextDouble();
    }
}
