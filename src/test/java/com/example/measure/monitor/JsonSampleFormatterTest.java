package com.example.measure.monitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSampleFormatterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonSampleFormatter formatter = new JsonSampleFormatter(objectMapper);

    @Test
    @DisplayName("One JSON object per sample, without a header")
    void oneObjectPerSample() throws Exception {
        // Given
        MonitorSample sample = new MonitorSample(3, 1000L, 5849720L, 824L, 832L, 839559L, null,
                new ProcessSample(25268, "eclipse", 14300L, 112180L, -4L, 6L));

        // When
        JsonNode json = objectMapper.readTree(formatter.format(sample));

        // Then
        assertThat(formatter.header(Optional.empty())).isEmpty();
        assertThat(json.get("sequence").asLong()).isEqualTo(3);
        assertThat(json.get("cpuUsage").asLong()).isEqualTo(832);
        assertThat(json.get("process").get("name").asText()).isEqualTo("eclipse");
        assertThat(json.get("process").get("memoryChangeKb").asLong()).isEqualTo(-4);
    }

    @Test
    @DisplayName("Unavailable values are left out")
    void nullsAreOmitted() throws Exception {
        MonitorSample sample = new MonitorSample(1, 1000L, null, null, 0L, null, null, null);

        JsonNode json = objectMapper.readTree(formatter.format(sample));

        assertThat(json.has("memoryUsedKb")).isFalse();
        assertThat(json.has("process")).isFalse();
        assertThat(json.get("cpuUsage").asLong()).isZero();
    }
}
