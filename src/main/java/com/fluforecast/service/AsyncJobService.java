package com.fluforecast.service;

import com.fluforecast.dto.AsyncJobResponse;
import com.fluforecast.dto.AsyncJobStatus;
import com.fluforecast.exception.FluForecastException;
import com.fluforecast.exception.JobNotFoundException;
import com.fluforecast.pipeline.PipelineStage;
import com.fluforecast.pipeline.PipelineStageListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Runs pipeline invocations off the request thread. Each job reports the pipeline stage it
 * has reached, so progress follows the split/fit/score/refit sequence.
 */
@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, Function<PipelineStageListener, Object> task) {
        UUID jobId = UUID.randomUUID();
        JobState state = JobState.queued(jobId, jobType, requestId);
        jobs.put(jobId, state);
        cleanupIfNeeded();

        CompletableFuture.runAsync(() -> execute(state, task), executor);
        log.info("Job submitted | jobId={} | type={} | requestId={}", jobId, jobType, requestId);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state, Function<PipelineStageListener, Object> task) {
        state.markRunning();
        try {
            Object result = task.apply(state::onStage);
            state.markCompleted(result);
            log.info("Job completed | jobId={} | type={}", state.jobId, state.jobType);
        } catch (FluForecastException ex) {
            state.markFailed(ex.getErrorCode(), ex.getMessage());
            log.warn("Job failed | jobId={} | errorCode={} | reason={}", state.jobId, ex.getErrorCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            state.markFailed("INTERNAL_ERROR", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            log.error("Job crashed | jobId={} | type={}", state.jobId, state.jobType, ex);
        }
    }

    private void cleanupIfNeeded() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status == AsyncJobStatus.COMPLETED || e.getValue().status == AsyncJobStatus.FAILED)
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status;
        private volatile PipelineStage stage;
        private volatile String message;
        private volatile String errorCode;
        private volatile Object result;

        private JobState(UUID jobId, String jobType, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
            this.createdAt = createdAt;
            this.status = AsyncJobStatus.QUEUED;
            this.stage = PipelineStage.IDLE;
            this.message = "Queued";
        }

        private static JobState queued(UUID id, String type, String requestId) {
            return new JobState(id, type, requestId, Instant.now());
        }

        private synchronized void markRunning() {
            this.startedAt = Instant.now();
            this.status = AsyncJobStatus.RUNNING;
            this.message = "Job started";
        }

        private synchronized void onStage(PipelineStage stage) {
            if (status == AsyncJobStatus.RUNNING && stage != PipelineStage.FAILED) {
                this.stage = stage;
                this.message = "Stage " + stage;
            }
        }

        private synchronized void markCompleted(Object result) {
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.COMPLETED;
            this.stage = PipelineStage.DONE;
            this.result = result;
            this.message = "Job completed";
        }

        private synchronized void markFailed(String errorCode, String message) {
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.FAILED;
            this.stage = PipelineStage.FAILED;
            this.errorCode = errorCode;
            this.message = message;
        }

        private synchronized AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .stage(stage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .progressPercent(stage.progressPercent())
                .message(message)
                .errorCode(errorCode)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
