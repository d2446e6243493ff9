package com.fluforecast.dto;

import com.fluforecast.sample.SeriesStatistics;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SampleStatsResponse {
    String status;
    String years;
    SeriesStatistics statistics;
}
