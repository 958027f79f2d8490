package ru.nsu.fanout.worker;

import ru.nsu.fanout.model.FileBlob;

import java.io.IOException;

/**
 * Обработчик содержимого одного файла. Возвращает готовый результат до base64:
 * байты для бинарных типов, UTF-8 JSON для остальных.
 */
public interface ContentProcessor {

    byte[] process(FileBlob file) throws IOException;
}
