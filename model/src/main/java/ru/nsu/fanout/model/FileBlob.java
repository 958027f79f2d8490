package ru.nsu.fanout.model;

import lombok.Getter;

import java.util.Arrays;

/**
 * Файл из пакета клиента: имя, содержимое и заявленный MIME-тип.
 */
@Getter
public class FileBlob {
    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private final String filename;
    private final byte[] content;
    private final String mimeType;

    public FileBlob(String filename, byte[] content, String mimeType) {
        this.filename = filename;
        this.content = content.clone();
        this.mimeType = mimeType == null || mimeType.isBlank() ? DEFAULT_MIME_TYPE : mimeType;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public String toString() {
        return "FileBlob{" + filename + ", " + content.length + " bytes, " + mimeType + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FileBlob)) {
            return false;
        }
        FileBlob other = (FileBlob) o;
        return filename.equals(other.filename)
                && mimeType.equals(other.mimeType)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * filename.hashCode() + Arrays.hashCode(content);
    }
}
