package com.fluforecast.pipeline;

public enum PipelineStage {
    IDLE(0),
    SPLIT(5),
    TRAIN_FIT(15),
    TEST_FORECAST(40),
    SCORED(50),
    REFIT_FULL(60),
    FUTURE_FORECAST(85),
    DONE(100),
    FAILED(100);

    private final int progressPercent;

    PipelineStage(int progressPercent) {
        this.progressPercent = progressPercent;
    }

    public int progressPercent() {
        return progressPercent;
    }
}
