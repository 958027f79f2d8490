package ru.nsu.fanout.coordinator;

/**
 * После проверки живости не осталось ни одного worker-а (HTTP 503).
 */
public class NoWorkersAvailableException extends RuntimeException {
    public NoWorkersAvailableException(String message) {
        super(message);
    }
}
