package io.shepherd.api.job;

import java.util.Map;

/**
 * Handler registered for a job type. Any exception marks the attempt as failed.
 */
@FunctionalInterface
public interface JobHandler {

    void handle(Map<String, Object> params) throws Exception;
}
