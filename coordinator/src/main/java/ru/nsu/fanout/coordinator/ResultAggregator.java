package ru.nsu.fanout.coordinator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.model.DispatchResult;
import ru.nsu.fanout.model.PayloadKind;
import ru.nsu.fanout.model.ProcessedItem;
import ru.nsu.fanout.model.SliceResult;
import ru.nsu.fanout.model.TaskType;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

/**
 * Собирает результаты одного пакета: декодирует каждый элемент по виду нагрузки
 * типа задачи и сохраняет в выходной каталог.
 * Ошибка одного элемента не влияет на остальные.
 */
@Slf4j
public class ResultAggregator {
    private final TaskType taskType;
    private final Path outputDir;
    private final ObjectMapper objectMapper;
    private final List<ItemResult> itemResults = new ArrayList<>();
    private int failedSlices;

    public ResultAggregator(TaskType taskType, Path outputDir, ObjectMapper objectMapper) {
        this.taskType = taskType;
        this.outputDir = outputDir;
        this.objectMapper = objectMapper;
    }

    public void accept(SliceResult sliceResult) {
        if (!sliceResult.isSuccess()) {
            failedSlices++;
            return;
        }
        for (ProcessedItem item : sliceResult.getItems()) {
            ItemResult result = persist(item);
            if (!result.isSaved()) {
                log.warn("Error decoding or saving result for '{}': {}", result.getFilename(), result.getErrorMessage());
            }
            itemResults.add(result);
        }
    }

    ItemResult persist(ProcessedItem item) {
        String filename = item.getFilename();
        if (filename == null || filename.isBlank()) {
            return ItemResult.failed(filename, "result has no filename");
        }
        if (item.getPayload() == null || item.getPayload().isEmpty()) {
            return ItemResult.failed(filename, "result has no " + taskType.getDataKey());
        }

        Path target;
        try {
            target = resolveTarget(filename);
        } catch (InvalidPathException e) {
            return ItemResult.failed(filename, "invalid filename: " + e.getMessage());
        }
        if (target == null) {
            return ItemResult.failed(filename, "invalid filename");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(item.getPayload());
        } catch (IllegalArgumentException e) {
            return ItemResult.failed(filename, "malformed base64: " + e.getMessage());
        }

        try {
            if (taskType.getPayloadKind() == PayloadKind.BINARY) {
                Files.write(target, decoded);
            } else {
                String text = decodeJsonText(decoded);
                if (text == null) {
                    return ItemResult.failed(filename, "payload is an empty JSON document");
                }
                Files.writeString(target, text, StandardCharsets.UTF_8);
            }
        } catch (CharacterCodingException e) {
            return ItemResult.failed(filename, "payload is not valid UTF-8");
        } catch (JsonProcessingException e) {
            return ItemResult.failed(filename, "payload is not valid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            return ItemResult.failed(filename, "write failed: " + e);
        }
        return ItemResult.saved(filename, target.toString());
    }

    /**
     * Имя файла от worker-а сводится к последнему сегменту пути,
     * чтобы результат не мог оказаться вне выходного каталога.
     */
    private Path resolveTarget(String filename) {
        Path name = Path.of(filename).getFileName();
        if (name == null || name.toString().equals(".") || name.toString().equals("..")) {
            return null;
        }
        return outputDir.resolve(taskType.outputFileName(name.toString()));
    }

    private String decodeJsonText(byte[] decoded) throws CharacterCodingException, JsonProcessingException {
        String text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(decoded))
                .toString();
        JsonNode tree = objectMapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readTree(text);
        return tree == null || tree.isMissingNode() ? null : text;
    }

    public List<ItemResult> getItemResults() {
        return Collections.unmodifiableList(itemResults);
    }

    public int getFailedSlices() {
        return failedSlices;
    }

    public DispatchResult result() {
        List<String> savedFiles = new ArrayList<>();
        for (ItemResult itemResult : itemResults) {
            if (itemResult.isSaved()) {
                savedFiles.add(itemResult.getSavedPath());
            }
        }
        return new DispatchResult(
                taskType,
                taskType.displayName() + " processing complete",
                savedFiles.size(),
                List.copyOf(savedFiles));
    }
}
