package com.fluforecast.model;

/**
 * Immutable result of one fit. A refit always yields a new instance.
 */
public sealed interface ModelState permits ArimaModelState, MovingAverageModelState {

    ModelType type();

    /** Number of observations the model was fitted on. */
    int observations();

    String summary();
}
