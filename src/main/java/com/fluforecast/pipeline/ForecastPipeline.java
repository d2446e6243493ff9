package com.fluforecast.pipeline;

import com.fluforecast.forecaster.FluForecaster;
import com.fluforecast.forecaster.ForecastEvaluator;
import com.fluforecast.forecaster.SeriesSplit;
import com.fluforecast.forecaster.TrainTestSplitter;
import com.fluforecast.model.EvaluationMetrics;
import com.fluforecast.model.ForecastResult;
import com.fluforecast.model.ModelState;
import com.fluforecast.model.PipelineReport;
import com.fluforecast.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * End-to-end forecasting run.
 * <p>
 * The model is fitted twice. The first fit sees only the training prefix, so the holdout
 * metrics are computed against weeks the model never saw. The second fit uses the whole
 * series and produces the future forecast. Both fits are kept as separate steps.
 * <p>
 * This bean has no mutable fields; every run builds its own {@link FluForecaster}, so
 * concurrent runs never see each other's models.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastPipeline {

    private final TrainTestSplitter splitter;
    private final ForecastEvaluator evaluator;

    public PipelineReport run(TimeSeries series, PipelineOptions options) {
        return run(series, options, PipelineStageListener.NOOP);
    }

    public PipelineReport run(TimeSeries series, PipelineOptions options, PipelineStageListener listener) {
        options.validate();
        FluForecaster forecaster = new FluForecaster(splitter, evaluator);
        PipelineStage stage = PipelineStage.IDLE;
        try {
            stage = enter(PipelineStage.SPLIT, listener);
            SeriesSplit split = forecaster.prepareData(series, options.getTestWeeks());

            stage = enter(PipelineStage.TRAIN_FIT, listener);
            forecaster.fit(options.newTrainer(), split.train());

            stage = enter(PipelineStage.TEST_FORECAST, listener);
            ForecastResult testPredicted = forecaster.predict(split.test().size());

            stage = enter(PipelineStage.SCORED, listener);
            EvaluationMetrics metrics = forecaster.evaluate(split.test(), testPredicted);

            stage = enter(PipelineStage.REFIT_FULL, listener);
            ModelState full = forecaster.fit(options.newTrainer(), series);

            stage = enter(PipelineStage.FUTURE_FORECAST, listener);
            ForecastResult future = forecaster.predict(options.getForecastWeeks());

            PipelineReport report = PipelineReport.builder()
                .metrics(metrics)
                .testActual(split.test().toList())
                .testPredicted(testPredicted.values())
                .futureForecast(future.values())
                .modelType(full.type())
                .modelSummary(full.summary())
                .trainSize(split.train().size())
                .build();

            enter(PipelineStage.DONE, listener);
            log.info("Pipeline done | model={} | observations={} | train={} | test={} | horizon={} | mae={} | rmse={} | mape={}",
                report.getModelType().label(), series.size(), split.train().size(), split.test().size(),
                options.getForecastWeeks(), metrics.mae(), metrics.rmse(), metrics.mape());
            return report;
        } catch (RuntimeException ex) {
            log.warn("Pipeline failed | stage={} | model={} | reason={}", stage, options.getModelType().label(), ex.getMessage());
            listener.onStage(PipelineStage.FAILED);
            throw ex;
        }
    }

    private PipelineStage enter(PipelineStage stage, PipelineStageListener listener) {
        log.debug("Pipeline stage -> {}", stage);
        listener.onStage(stage);
        return stage;
    }
}
