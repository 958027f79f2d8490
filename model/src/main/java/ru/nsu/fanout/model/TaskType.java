package ru.nsu.fanout.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Тип задачи. Каждый тип сам хранит имя multipart-поля, ключ результата
 * в ответе worker-а, вид полезной нагрузки и суффикс выходного файла.
 */
@Getter
public enum TaskType {
    IMAGE("image", "images", "image_data", PayloadKind.BINARY, null),
    TEXT("text", "texts", "analysis_data", PayloadKind.JSON_TEXT, "_analysis.json"),
    EMBEDDING("embedding", "texts", "embedding_data", PayloadKind.JSON_TEXT, "_embedding.json"),
    OCR("ocr", "images", "ocr_data", PayloadKind.JSON_TEXT, "_ocr.json"),
    AUDIO("audio", "audio_files", "audio_data", PayloadKind.JSON_TEXT, "_audio_analysis.json"),
    DOCUMENT("document", "documents", "document_data", PayloadKind.JSON_TEXT, "_document_analysis.json");

    private static final String BINARY_PREFIX = "processed_";

    @JsonValue
    private final String wireName;
    private final String fieldName;
    private final String dataKey;
    private final PayloadKind payloadKind;
    private final String outputSuffix;

    TaskType(String wireName, String fieldName, String dataKey, PayloadKind payloadKind, String outputSuffix) {
        this.wireName = wireName;
        this.fieldName = fieldName;
        this.dataKey = dataKey;
        this.payloadKind = payloadKind;
        this.outputSuffix = outputSuffix;
    }

    public static Optional<TaskType> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(name))
                .findFirst();
    }

    /**
     * Имя файла, под которым сохраняется результат для исходного файла.
     * Бинарные результаты получают префикс, текстовые - суффикс вместо расширения.
     */
    public String outputFileName(String filename) {
        if (payloadKind == PayloadKind.BINARY) {
            return BINARY_PREFIX + filename;
        }
        int dot = filename.lastIndexOf('.');
        String baseName = dot >= 0 ? filename.substring(0, dot) : filename;
        return baseName + outputSuffix;
    }

    /**
     * Человекочитаемое имя: "image" -> "Image", "ocr" -> "Ocr".
     */
    public String displayName() {
        return wireName.substring(0, 1).toUpperCase(Locale.ROOT) + wireName.substring(1).toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
