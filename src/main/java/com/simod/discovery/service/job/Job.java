package com.simod.discovery.service.job;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Discovery job record.
 *
 * One document per submitted discovery request. Status transitions are
 * applied exclusively through {@link JobRepository#updateIfStatus}, so the
 * setters are only used while building a new record or a detached copy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "discoveries")
public class Job {

    @Id
    private String id;

    private JobStatus status;

    // Timing
    private Instant submittedAt;
    private Instant startedAt;
    private Instant completedAt;

    private Instant expiresAt;

    // Artifacts
    private String inputLogPath;
    private String inputConfigPath;
    private String outputPath;

    // Outcome
    private String errorDetail;

    // Notification
    private String callbackUrl;

    @Builder.Default
    private boolean notified = false;

    // Dispatch bookkeeping
    @Builder.Default
    private int attempts = 0;

    private Instant dispatchedAt;
    private Instant nextDispatchAt;
    private Instant heartbeatAt;

    /**
     * Detached copy, so callers never share a mutable record with a store.
     */
    public Job copy() {
        return toBuilder().build();
    }

    /**
     * Whether the record is past its retention window or already expired.
     */
    public boolean isExpiredAt(Instant now) {
        return status == JobStatus.EXPIRED
                || (expiresAt != null && !expiresAt.isAfter(now));
    }
}
