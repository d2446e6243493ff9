package com.fluforecast.model;

import java.util.List;

/**
 * Baseline state: the configured window and the trailing training values, stored verbatim.
 * {@code lastValues} is shorter than {@code window} when the training series was.
 */
public record MovingAverageModelState(int window, List<Double> lastValues, int observations)
        implements ModelState {

    public MovingAverageModelState {
        lastValues = List.copyOf(lastValues);
    }

    @Override
    public ModelType type() {
        return ModelType.MOVING_AVERAGE;
    }

    @Override
    public String summary() {
        return "Moving Average (window=" + window + ")";
    }
}
