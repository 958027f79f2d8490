package ru.nsu.fanout.coordinator;

import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.model.WorkerEndpoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Проверка живости worker-ов перед каждым пакетом.
 * Вызывается синхронно, фонового цикла нет.
 */
@Slf4j
public class HealthProber {
    private final WorkerRegistry registry;
    private final WorkerClient workerClient;
    private final ExecutorService executor;

    public HealthProber(WorkerRegistry registry, WorkerClient workerClient, ExecutorService executor) {
        this.registry = registry;
        this.workerClient = workerClient;
        this.executor = executor;
    }

    /**
     * Опрашивает всех worker-ов из снимка реестра и удаляет не ответивших.
     * @return удалённые worker-ы
     */
    public List<WorkerEndpoint> probe() {
        Map<WorkerEndpoint, Future<Boolean>> checks = new LinkedHashMap<>();
        for (WorkerEndpoint endpoint : registry.snapshot()) {
            checks.put(endpoint, executor.submit(() -> workerClient.checkStatus(endpoint)));
        }

        List<WorkerEndpoint> evicted = new ArrayList<>();
        int visited = 0;
        for (Map.Entry<WorkerEndpoint, Future<Boolean>> check : checks.entrySet()) {
            WorkerEndpoint endpoint = check.getKey();
            boolean alive;
            try {
                alive = check.getValue().get();
            } catch (ExecutionException e) {
                log.warn("Status check of worker {} failed", endpoint, e.getCause());
                alive = false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Probing interrupted, {} workers left unchecked", checks.size() - visited);
                break;
            }
            visited++;

            if (!alive) {
                log.info("Worker {} is unresponsive, removing from registry", endpoint);
                registry.remove(endpoint);
                evicted.add(endpoint);
            }
        }
        log.debug("Probed {} workers, evicted {}", checks.size(), evicted.size());
        return evicted;
    }
}
