package ru.nsu.fanout.model;

import lombok.Getter;

import java.util.List;

/**
 * Часть пакета, назначенная одному worker-у.
 */
@Getter
public class TaskSlice {
    private final WorkerEndpoint endpoint;
    private final List<FileBlob> files;

    public TaskSlice(WorkerEndpoint endpoint, List<FileBlob> files) {
        this.endpoint = endpoint;
        this.files = List.copyOf(files);
    }

    public int size() {
        return files.size();
    }

    @Override
    public String toString() {
        return endpoint + "[" + files.size() + " files]";
    }
}
