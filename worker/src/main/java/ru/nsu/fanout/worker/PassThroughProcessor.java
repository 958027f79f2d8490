package ru.nsu.fanout.worker;

import ru.nsu.fanout.model.FileBlob;

/**
 * Возвращает содержимое файла без изменений.
 */
public class PassThroughProcessor implements ContentProcessor {

    @Override
    public byte[] process(FileBlob file) {
        return file.getContent();
    }
}
