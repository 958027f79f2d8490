package ru.nsu.fanout.model;

/**
 * Как интерпретировать декодированный из base64 результат.
 */
public enum PayloadKind {
    BINARY,    // Сохраняется побайтно
    JSON_TEXT  // UTF-8 JSON, сохраняется как текст
}
