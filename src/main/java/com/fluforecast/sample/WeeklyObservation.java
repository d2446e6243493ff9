package com.fluforecast.sample;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WeeklyObservation {
    int year;
    int week;
    String region;
    double iliPercentage;
    int numProviders;
    int totalPatients;
    int totalIli;
}
