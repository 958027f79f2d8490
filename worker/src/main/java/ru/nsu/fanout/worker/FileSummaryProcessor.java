package ru.nsu.fanout.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nsu.fanout.model.FileBlob;
import ru.nsu.fanout.model.TaskType;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Заглушка для анализирующих типов задач: JSON-сводка о файле
 * (имя, тип задачи, MIME-тип, размер, SHA-256).
 */
public class FileSummaryProcessor implements ContentProcessor {
    private final TaskType taskType;
    private final ObjectMapper objectMapper;

    public FileSummaryProcessor(TaskType taskType, ObjectMapper objectMapper) {
        this.taskType = taskType;
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] process(FileBlob file) throws IOException {
        ObjectNode summary = objectMapper.createObjectNode()
                .put("filename", file.getFilename())
                .put("task_type", taskType.getWireName())
                .put("mime_type", file.getMimeType())
                .put("size_bytes", file.size())
                .put("sha256", sha256(file.getContent()));
        return objectMapper.writeValueAsBytes(summary);
    }

    private static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
