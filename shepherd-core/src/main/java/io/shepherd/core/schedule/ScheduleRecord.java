package io.shepherd.core.schedule;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.shepherd.api.job.JobPayload;

import java.util.List;
import java.util.Map;

/**
 * One entry of a schedules file. {@code interval} uses the compact form {@code 24h},
 * {@code 1h30m}, {@code 1.5h}, {@code 500ms} and so on; see {@link DurationParser}.
 * <pre>{@code
 * [
 *   {
 *     "name": "DailyScheduler",
 *     "interval": "24h",
 *     "pool_name": "DailyPool",
 *     "jobs": [ { "type": "fetch-weather", "params": { "region": "north" }, "max_retries": 3 } ]
 *   }
 * ]
 * }</pre>
 */
public record ScheduleRecord(
        @JsonProperty("name") String name,
        @JsonProperty("interval") String interval,
        @JsonProperty("pool_name") String poolName,
        @JsonProperty("jobs") List<JobTemplate> jobs
) {

    public ScheduleRecord {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public record JobTemplate(
            @JsonProperty("type") String type,
            @JsonProperty("params") Map<String, Object> params,
            @JsonProperty("max_retries") int maxRetries
    ) {
        public JobPayload toPayload() {
            return JobPayload.of(type, params, maxRetries);
        }
    }
}
