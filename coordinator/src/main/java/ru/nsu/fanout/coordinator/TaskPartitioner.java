package ru.nsu.fanout.coordinator;

import ru.nsu.fanout.model.FileBlob;
import ru.nsu.fanout.model.TaskSlice;
import ru.nsu.fanout.model.WorkerEndpoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Делит файлы пакета между worker-ами непрерывными отрезками.
 * Первые N % K worker-ов получают на один файл больше, пустые части не создаются.
 */
public class TaskPartitioner {

    public List<TaskSlice> partition(List<FileBlob> files, List<WorkerEndpoint> endpoints) {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No files to partition");
        }
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("No workers to partition over");
        }

        int base = files.size() / endpoints.size();
        int remainder = files.size() % endpoints.size();

        List<TaskSlice> slices = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < endpoints.size(); i++) {
            int end = start + base + (i < remainder ? 1 : 0);
            if (start < end) {
                slices.add(new TaskSlice(endpoints.get(i), files.subList(start, end)));
            }
            start = end;
        }
        return slices;
    }
}
