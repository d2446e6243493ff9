package com.fluforecast.exception;

import java.util.UUID;

public class JobNotFoundException extends FluForecastException {
    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "Job with id '" + jobId + "' not found.");
    }
}
