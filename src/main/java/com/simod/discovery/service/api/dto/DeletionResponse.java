package com.simod.discovery.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.simod.discovery.service.job.JobStatus;

/**
 * Response of the delete endpoints: either the removed discovery or the
 * number of discoveries removed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeletionResponse(
        @JsonProperty("id") String id,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("deleted_amount") Long deletedAmount) {

    public static DeletionResponse single(String id) {
        return new DeletionResponse(id, JobStatus.EXPIRED, null);
    }

    public static DeletionResponse amount(long deleted) {
        return new DeletionResponse(null, null, deleted);
    }
}
