package com.fluforecast.sample;

import com.fluforecast.model.TimeSeries;
import lombok.Builder;
import lombok.Value;
import com.fluforecast.model.Decimals;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

@Value
@Builder
public class SeriesStatistics {
    double mean;
    double std;
    double min;
    double max;
    int records;

    /** Summary rounded to two decimals; {@code std} is the sample (n-1) deviation. */
    public static SeriesStatistics of(TimeSeries series) {
        DescriptiveStatistics stats = new DescriptiveStatistics(series.toArray());
        return SeriesStatistics.builder()
            .mean(Decimals.round(stats.getMean(), 2))
            .std(Decimals.round(stats.getStandardDeviation(), 2))
            .min(Decimals.round(stats.getMin(), 2))
            .max(Decimals.round(stats.getMax(), 2))
            .records(series.size())
            .build();
    }
}
