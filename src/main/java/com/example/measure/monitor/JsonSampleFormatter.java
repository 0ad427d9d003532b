package com.example.measure.monitor;

import com.example.measure.process.CommonProcessData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * One JSON object per sample, no header:
 * <pre>
 * {"sequence":1,"elapsedMs":1000,"memoryUsedKb":5849720,"memoryChangeKb":824,"cpuUsage":832,"cpuFrequencyKhz":839559}
 * </pre>
 */
public class JsonSampleFormatter implements SampleFormatter {

    private final ObjectMapper objectMapper;

    public JsonSampleFormatter() {
        this(new ObjectMapper());
    }

    public JsonSampleFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> header(Optional<CommonProcessData> process) {
        return List.of();
    }

    @Override
    public String format(MonitorSample sample) {
        try {
            return objectMapper.writeValueAsString(sample);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write sample " + sample.sequence(), e);
        }
    }
}
