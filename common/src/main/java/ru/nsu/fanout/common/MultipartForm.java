package ru.nsu.fanout.common;

import ru.nsu.fanout.model.FileBlob;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Разобранная multipart-форма: текстовые поля и файлы, сгруппированные по имени поля
 * в порядке появления.
 */
public class MultipartForm {
    private final Map<String, List<String>> fields = new LinkedHashMap<>();
    private final Map<String, List<FileBlob>> files = new LinkedHashMap<>();

    void addField(String name, String value) {
        fields.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
    }

    void addFile(String name, FileBlob file) {
        files.computeIfAbsent(name, k -> new ArrayList<>()).add(file);
    }

    public Optional<String> getField(String name) {
        List<String> values = fields.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public List<FileBlob> getFiles(String name) {
        return List.copyOf(files.getOrDefault(name, List.of()));
    }
}
