package ru.nsu.fanout.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nsu.fanout.model.ProcessedItem;
import ru.nsu.fanout.model.TaskType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Кодирует и разбирает тело ответа worker-а:
 * {"results": [{"filename": ..., "<type>_data": "<base64>"}, ...]}.
 */
public class ResultsCodec {
    private final ObjectMapper objectMapper;

    public ResultsCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(TaskType taskType, List<ProcessedItem> items) throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode results = root.putArray(WorkerContract.RESULTS_FIELD);
        for (ProcessedItem item : items) {
            results.addObject()
                    .put(WorkerContract.FILENAME_FIELD, item.getFilename())
                    .put(taskType.getDataKey(), item.getPayload());
        }
        return objectMapper.writeValueAsBytes(root);
    }

    /**
     * Разбирает ответ worker-а. Отсутствующий массив results считается пустым,
     * тело, не являющееся JSON-объектом, - ошибкой всего ответа.
     * Отдельные элементы не проверяются: это делает агрегатор.
     */
    public List<ProcessedItem> decode(TaskType taskType, byte[] body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        if (root == null || !root.isObject()) {
            throw new IOException("Worker response is not a JSON object");
        }
        JsonNode results = root.path(WorkerContract.RESULTS_FIELD);
        if (results.isMissingNode() || results.isNull()) {
            return List.of();
        }
        if (!results.isArray()) {
            throw new IOException("Worker response field '" + WorkerContract.RESULTS_FIELD + "' is not an array");
        }

        List<ProcessedItem> items = new ArrayList<>(results.size());
        for (JsonNode node : results) {
            items.add(new ProcessedItem(
                    textOrNull(node, WorkerContract.FILENAME_FIELD),
                    textOrNull(node, taskType.getDataKey())));
        }
        return items;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
