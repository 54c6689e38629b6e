package com.simod.discovery.service.job;

import java.util.Objects;

/**
 * Outcome reported by a worker for one processing attempt.
 */
public sealed interface JobOutcome permits JobOutcome.Succeeded, JobOutcome.Failed {

    JobStatus status();

    static JobOutcome succeeded(String outputPath) {
        return new Succeeded(outputPath);
    }

    static JobOutcome failed(String errorDetail) {
        return new Failed(errorDetail);
    }

    /**
     * The engine produced an artifact, stored at {@code outputPath}.
     */
    record Succeeded(String outputPath) implements JobOutcome {

        public Succeeded {
            Objects.requireNonNull(outputPath, "outputPath");
        }

        @Override
        public JobStatus status() {
            return JobStatus.SUCCEEDED;
        }
    }

    /**
     * The engine or result handling failed with {@code errorDetail}.
     */
    record Failed(String errorDetail) implements JobOutcome {

        public Failed {
            Objects.requireNonNull(errorDetail, "errorDetail");
        }

        @Override
        public JobStatus status() {
            return JobStatus.FAILED;
        }
    }
}
