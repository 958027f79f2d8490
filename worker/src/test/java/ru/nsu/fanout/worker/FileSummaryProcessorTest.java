package ru.nsu.fanout.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.nsu.fanout.common.JacksonConfig;
import ru.nsu.fanout.model.FileBlob;
import ru.nsu.fanout.model.TaskType;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class FileSummaryProcessorTest {
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    @Test
    void summarizesFileAsJson() throws Exception {
        FileSummaryProcessor processor = new FileSummaryProcessor(TaskType.TEXT, objectMapper);
        FileBlob file = new FileBlob("doc.txt", "abc".getBytes(StandardCharsets.UTF_8), "text/plain");

        JsonNode summary = objectMapper.readTree(processor.process(file));

        assertThat(summary.path("filename").asText()).isEqualTo("doc.txt");
        assertThat(summary.path("task_type").asText()).isEqualTo("text");
        assertThat(summary.path("mime_type").asText()).isEqualTo("text/plain");
        assertThat(summary.path("size_bytes").asInt()).isEqualTo(3);
        assertThat(summary.path("sha256").asText())
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void passThroughReturnsInputUnchanged() throws Exception {
        byte[] content = {9, 8, 7};

        assertThat(new PassThroughProcessor().process(new FileBlob("a.png", content, "image/png")))
                .containsExactly(9, 8, 7);
    }
}
