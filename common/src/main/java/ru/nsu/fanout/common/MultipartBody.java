package ru.nsu.fanout.common;

import ru.nsu.fanout.model.FileBlob;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Собирает тело multipart/form-data для java.net.http.HttpClient.
 */
public class MultipartBody {
    private static final String CRLF = "\r\n";

    private final String boundary;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    public MultipartBody() {
        this("fanout-" + UUID.randomUUID().toString().replace("-", ""));
    }

    public MultipartBody(String boundary) {
        this.boundary = boundary;
    }

    public MultipartBody addField(String name, String value) {
        writeAscii("--" + boundary + CRLF);
        writeUtf8("Content-Disposition: form-data; name=\"" + escape(name) + "\"" + CRLF + CRLF);
        writeUtf8(value);
        writeAscii(CRLF);
        return this;
    }

    public MultipartBody addFile(String name, FileBlob file) {
        writeAscii("--" + boundary + CRLF);
        writeUtf8("Content-Disposition: form-data; name=\"" + escape(name)
                + "\"; filename=\"" + escape(file.getFilename()) + "\"" + CRLF);
        writeUtf8("Content-Type: " + file.getMimeType() + CRLF + CRLF);
        buffer.writeBytes(file.getContent());
        writeAscii(CRLF);
        return this;
    }

    public String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public byte[] toByteArray() {
        ByteArrayOutputStream complete = new ByteArrayOutputStream(buffer.size() + boundary.length() + 8);
        complete.writeBytes(buffer.toByteArray());
        complete.writeBytes(("--" + boundary + "--" + CRLF).getBytes(StandardCharsets.US_ASCII));
        return complete.toByteArray();
    }

    public HttpRequest.BodyPublisher publisher() {
        return HttpRequest.BodyPublishers.ofByteArray(toByteArray());
    }

    private void writeAscii(String text) {
        buffer.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
    }

    private void writeUtf8(String text) {
        buffer.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String escape(String value) {
        return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }
}
