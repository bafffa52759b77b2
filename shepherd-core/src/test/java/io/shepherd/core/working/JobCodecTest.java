package io.shepherd.core.working;

import io.shepherd.api.job.JobPayload;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobCodecTest {

    private final JobCodec codec = new JobCodec();

    @Test
    void shouldUseSnakeCaseFieldNames() {
        String json = codec.encode(new JobPayload("id-1", "fetch", null, 1, 3));

        assertThat(json)
                .contains("\"job_id\":\"id-1\"")
                .contains("\"retry_count\":1")
                .contains("\"max_retries\":3");
    }

    @Test
    void shouldIgnoreUnknownFieldsAndKeepNullParams() throws Exception {
        JobPayload job = codec.decode(
                "{\"job_id\":\"j\",\"type\":\"fetch\",\"params\":{\"farm\":null,\"n\":2},\"extra\":true}");

        assertThat(job.params()).containsEntry("farm", null).containsEntry("n", 2);
        assertThat(job.retryCount()).isZero();
    }

    @Test
    void shouldRejectPayloadWithoutType() {
        assertThatThrownBy(() -> codec.decode("{\"job_id\":\"j\"}"))
                .isInstanceOf(IOException.class);
    }
}
