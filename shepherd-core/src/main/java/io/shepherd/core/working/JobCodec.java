package io.shepherd.core.working;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shepherd.api.job.JobPayload;

import java.io.IOException;

/**
 * JSON form of job payloads as stored in a {@link io.shepherd.api.job.JobQueue}.
 */
public final class JobCodec {

    private final ObjectMapper objectMapper;

    public JobCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(JobPayload job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job " + job.jobId() + " cannot be serialized", e);
        }
    }

    public JobPayload decode(String payload) throws IOException {
        return objectMapper.readValue(payload, JobPayload.class);
    }
}
