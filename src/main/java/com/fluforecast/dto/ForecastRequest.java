package com.fluforecast.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    @NotNull(message = "values is required")
    @Size(min = 1, max = 10_000, message = "values must contain between 1 and 10000 observations")
    List<@NotNull(message = "values must not contain nulls") Double> values;

    List<@NotNull @Min(value = 1997, message = "years must be >= 1997") Integer> years;

    List<@NotNull @Min(value = 1, message = "weeks must be between 1 and 53")
         @Max(value = 53, message = "weeks must be between 1 and 53") Integer> weeks;

    @Min(value = 1, message = "forecastWeeks must be >= 1")
    @Max(value = 104, message = "forecastWeeks must be <= 104")
    Integer forecastWeeks;

    @Min(value = 1, message = "testWeeks must be >= 1")
    @Max(value = 260, message = "testWeeks must be <= 260")
    Integer testWeeks;

    @Size(min = 3, max = 3, message = "order must be a triple [p, d, q]")
    List<@NotNull @Min(value = 0, message = "order components must be >= 0")
         @Max(value = 10, message = "order components must be <= 10") Integer> order;

    @Min(value = 1, message = "window must be >= 1")
    @Max(value = 52, message = "window must be <= 52")
    Integer window;

    @Pattern(regexp = "ARIMA|MovingAverage",
             message = "modelType must be one of: ARIMA, MovingAverage")
    String modelType;

    boolean fallbackToMovingAverage;
}
