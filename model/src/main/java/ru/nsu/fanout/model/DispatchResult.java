package ru.nsu.fanout.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;
import java.util.List;

/**
 * Итог обработки пакета, возвращаемый клиенту.
 */
@Getter
@AllArgsConstructor
public class DispatchResult implements Serializable {
    @JsonProperty("task_type")
    private final TaskType taskType;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("total_files_processed")
    private final int totalFilesProcessed;

    @JsonProperty("saved_files")
    private final List<String> savedFiles;
}
