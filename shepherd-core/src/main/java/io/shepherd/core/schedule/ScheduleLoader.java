package io.shepherd.core.schedule;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads schedule definitions from a JSON array (see {@link ScheduleRecord}).
 */
public class ScheduleLoader {

    private static final TypeReference<List<ScheduleRecord>> RECORDS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ScheduleLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public List<ScheduleRecord> load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public List<ScheduleRecord> load(InputStream in) throws IOException {
        List<ScheduleRecord> records = objectMapper.readValue(in, RECORDS);
        return records == null ? List.of() : records;
    }
}
