package ru.nsu.fanout.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Результат отправки одной части пакета worker-у.
 * Неудача - обычное значение, а не исключение.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SliceResult {
    private final WorkerEndpoint endpoint;
    private final int fileCount;
    private final boolean success;
    private final List<ProcessedItem> items;
    private final String errorMessage;

    // true, если worker не ответил вовсе (соединение, таймаут)
    private final boolean transportFailure;

    public static SliceResult success(WorkerEndpoint endpoint, int fileCount, List<ProcessedItem> items) {
        return new SliceResult(endpoint, fileCount, true, List.copyOf(items), null, false);
    }

    public static SliceResult failure(WorkerEndpoint endpoint, int fileCount, String errorMessage) {
        return new SliceResult(endpoint, fileCount, false, List.of(), errorMessage, false);
    }

    public static SliceResult transportFailure(WorkerEndpoint endpoint, int fileCount, String errorMessage) {
        return new SliceResult(endpoint, fileCount, false, List.of(), errorMessage, true);
    }
}
