package com.fluforecast.pipeline;

@FunctionalInterface
public interface PipelineStageListener {

    PipelineStageListener NOOP = stage -> { };

    void onStage(PipelineStage stage);
}
