package ru.nsu.fanout.coordinator;

/**
 * Некорректный запрос клиента или worker-а (HTTP 400).
 */
public class ValidationException extends RuntimeException {
    public ValidationException(String message) {
        super(message);
    }
}
