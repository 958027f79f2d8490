package ru.nsu.fanout.coordinator;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Итог декодирования и сохранения одного результата worker-а.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ItemResult {
    private final String filename;
    private final boolean saved;
    private final String savedPath;
    private final String errorMessage;

    public static ItemResult saved(String filename, String savedPath) {
        return new ItemResult(filename, true, savedPath, null);
    }

    public static ItemResult failed(String filename, String errorMessage) {
        return new ItemResult(filename, false, null, errorMessage);
    }
}
