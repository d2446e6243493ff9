package com.fluforecast.dto;

import com.fluforecast.sample.WeeklyObservation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SampleDataResponse {
    String status;
    int count;
    List<WeeklyObservation> data;
}
