package ru.nsu.fanout.coordinator;

import ru.nsu.fanout.model.SliceResult;
import ru.nsu.fanout.model.TaskSlice;
import ru.nsu.fanout.model.TaskType;
import ru.nsu.fanout.model.WorkerEndpoint;

/**
 * Вызовы контракта worker-а со стороны координатора.
 * Реализации не бросают исключений: любая неудача выражается результатом.
 */
public interface WorkerClient {

    /**
     * @return true, если worker ответил на проверку статуса кодом 2xx
     */
    boolean checkStatus(WorkerEndpoint endpoint);

    /**
     * Отправляет файлы части пакета worker-у и возвращает его результаты.
     */
    SliceResult process(TaskSlice slice, TaskType taskType);
}
