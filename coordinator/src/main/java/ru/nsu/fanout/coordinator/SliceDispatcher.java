package ru.nsu.fanout.coordinator;

import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.model.SliceResult;
import ru.nsu.fanout.model.TaskSlice;
import ru.nsu.fanout.model.TaskType;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Параллельная отправка частей пакета worker-ам.
 * Результаты передаются потребителю в порядке завершения, а не отправки.
 * Неудачные части не повторяются и не переназначаются.
 */
@Slf4j
public class SliceDispatcher {
    private final WorkerClient workerClient;
    private final WorkerRegistry registry;
    private final ExecutorService executor;

    public SliceDispatcher(WorkerClient workerClient, WorkerRegistry registry, ExecutorService executor) {
        this.workerClient = workerClient;
        this.registry = registry;
        this.executor = executor;
    }

    /**
     * Отправляет все части и блокируется до получения результата каждой.
     * Потребитель вызывается в вызывающем потоке.
     */
    public void dispatch(List<TaskSlice> slices, TaskType taskType, Consumer<SliceResult> consumer) {
        CompletionService<SliceResult> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<SliceResult>, TaskSlice> pending = new HashMap<>();
        for (TaskSlice slice : slices) {
            pending.put(completionService.submit(() -> workerClient.process(slice, taskType)), slice);
        }

        while (!pending.isEmpty()) {
            Future<SliceResult> completed;
            try {
                completed = completionService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} slices", pending.size());
                for (TaskSlice slice : pending.values()) {
                    consumer.accept(handle(SliceResult.failure(
                            slice.getEndpoint(), slice.size(), "Interrupted before the slice completed")));
                }
                return;
            }
            TaskSlice slice = pending.remove(completed);
            consumer.accept(handle(resultOf(completed, slice)));
        }
    }

    private SliceResult resultOf(Future<SliceResult> completed, TaskSlice slice) {
        try {
            return completed.get();
        } catch (ExecutionException e) {
            return SliceResult.failure(slice.getEndpoint(), slice.size(), "Worker call crashed: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SliceResult.failure(slice.getEndpoint(), slice.size(), "Interrupted before the slice completed");
        }
    }

    private SliceResult handle(SliceResult result) {
        if (result.isSuccess()) {
            return result;
        }
        log.warn("Task failed for worker {} ({} files dropped): {}",
                result.getEndpoint(), result.getFileCount(), result.getErrorMessage());
        if (result.isTransportFailure() && registry.remove(result.getEndpoint())) {
            log.info("Worker {} evicted after transport failure", result.getEndpoint());
        }
        return result;
    }
}
