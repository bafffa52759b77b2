package io.shepherd.api.job;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A unit of work travelling through a job queue.
 * Serialized as JSON; the serialized form is what the queue stores.
 */
public record JobPayload(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("type") String type,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("max_retries") int maxRetries
) {

    public JobPayload {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(type, "type");
        if (type.isBlank()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        if (retryCount < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("Retry counts must not be negative");
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static JobPayload of(String type, Map<String, Object> params, int maxRetries) {
        return new JobPayload(UUID.randomUUID().toString(), type, params, 0, maxRetries);
    }

    /**
     * @return true if a failed attempt may be retried
     */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    public JobPayload nextAttempt() {
        return new JobPayload(jobId, type, params, retryCount + 1, maxRetries);
    }
}
