package ru.nsu.fanout.model;

import lombok.Getter;

import java.util.List;

/**
 * Пакет файлов от клиента вместе с типом задачи. Живёт только в рамках запроса.
 */
@Getter
public class TaskBatch {
    private final TaskType taskType;
    private final List<FileBlob> files;

    public TaskBatch(TaskType taskType, List<FileBlob> files) {
        this.taskType = taskType;
        this.files = List.copyOf(files);
    }

    public int size() {
        return files.size();
    }
}
