package com.fluforecast.service;

import com.fluforecast.dto.SampleDataResponse;
import com.fluforecast.dto.SampleForecastResponse;
import com.fluforecast.dto.SampleStatsResponse;
import com.fluforecast.model.Decimals;
import com.fluforecast.model.PipelineReport;
import com.fluforecast.model.TimeSeries;
import com.fluforecast.pipeline.ForecastPipeline;
import com.fluforecast.pipeline.PipelineOptions;
import com.fluforecast.sample.SampleSeriesGenerator;
import com.fluforecast.sample.SeriesStatistics;
import com.fluforecast.sample.WeekLabel;
import com.fluforecast.sample.WeeklyObservation;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SampleDataService {

    static final int SAMPLE_FORECAST_WEEKS = 8;
    static final int SAMPLE_TEST_WEEKS = 12;

    private final ForecastPipeline pipeline;
    private final List<WeeklyObservation> rows;

    public SampleDataService(ForecastPipeline pipeline, SampleSeriesGenerator generator) {
        this.pipeline = pipeline;
        this.rows = List.copyOf(generator.generate());
    }

    public SampleDataResponse recent(int limit) {
        List<WeeklyObservation> tail = rows.subList(Math.max(0, rows.size() - limit), rows.size());
        return SampleDataResponse.builder()
            .status("success")
            .count(rows.size())
            .data(tail)
            .build();
    }

    public SampleStatsResponse statistics() {
        int firstYear = rows.get(0).getYear();
        int lastYear = rows.get(rows.size() - 1).getYear();
        return SampleStatsResponse.builder()
            .status("success")
            .years(firstYear + " - " + lastYear)
            .statistics(SeriesStatistics.of(SampleSeriesGenerator.iliSeries(rows)))
            .build();
    }

    public SampleForecastResponse forecast() {
        TimeSeries series = SampleSeriesGenerator.iliSeries(rows);
        PipelineReport report = pipeline.run(series, PipelineOptions.builder()
            .forecastWeeks(SAMPLE_FORECAST_WEEKS)
            .testWeeks(SAMPLE_TEST_WEEKS)
            .build());
        WeeklyObservation last = rows.get(rows.size() - 1);
        return SampleForecastResponse.builder()
            .status("success")
            .model(report.getModelType())
            .metrics(report.getMetrics())
            .forecast(report.getFutureForecast().stream()
                .map(v -> Decimals.round(v, 2))
                .toList())
            .forecastWeeks(new WeekLabel(last.getYear(), last.getWeek()).following(SAMPLE_FORECAST_WEEKS))
            .build();
    }
}
