package ru.nsu.fanout.coordinator;

import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.model.WorkerEndpoint;

import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Реестр известных worker-ов. Общее изменяемое состояние координатора:
 * его меняют регистрация, проверка живости и неудачные отправки.
 * Все операции выполняются под одной блокировкой.
 */
@Slf4j
public class WorkerRegistry {
    private final Lock lock = new ReentrantLock();
    private final NavigableSet<WorkerEndpoint> endpoints = new TreeSet<>();

    /**
     * Добавляет worker-а. Повторная регистрация ничего не меняет.
     * @return true, если worker не был известен
     */
    public boolean register(WorkerEndpoint endpoint) {
        lock.lock();
        try {
            boolean added = endpoints.add(endpoint);
            if (added) {
                log.info("Worker registered: {} (total {})", endpoint, endpoints.size());
            } else {
                log.debug("Worker {} is already registered", endpoint);
            }
            return added;
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(WorkerEndpoint endpoint) {
        lock.lock();
        try {
            boolean removed = endpoints.remove(endpoint);
            if (removed) {
                log.info("Worker removed: {} (total {})", endpoint, endpoints.size());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Снимок реестра на текущий момент, упорядоченный по host:port.
     */
    public List<WorkerEndpoint> snapshot() {
        lock.lock();
        try {
            return List.copyOf(endpoints);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return endpoints.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
