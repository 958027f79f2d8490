package ru.nsu.fanout.common;

import ru.nsu.fanout.model.FileBlob;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Разбор тела multipart/form-data (RFC 7578), целиком находящегося в памяти.
 */
public class MultipartParser {
    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};

    public static boolean isMultipart(String contentType) {
        return contentType != null
                && contentType.toLowerCase(Locale.ROOT).startsWith("multipart/form-data");
    }

    public static MultipartForm parse(String contentType, byte[] body) throws MultipartParseException {
        if (!isMultipart(contentType)) {
            throw new MultipartParseException("Expected multipart/form-data but got " + contentType);
        }
        String boundary = parseParameters(contentType).get("boundary");
        if (boundary == null || boundary.isEmpty()) {
            throw new MultipartParseException("Missing multipart boundary");
        }

        byte[] delimiter = ("--" + boundary).getBytes(StandardCharsets.US_ASCII);
        byte[] partDelimiter = ("\r\n--" + boundary).getBytes(StandardCharsets.US_ASCII);
        MultipartForm form = new MultipartForm();

        int position = indexOf(body, delimiter, 0);
        if (position < 0) {
            throw new MultipartParseException("Multipart boundary not found in body");
        }
        position += delimiter.length;

        while (true) {
            if (startsWith(body, position, new byte[]{'-', '-'})) {
                return form;
            }
            if (!startsWith(body, position, CRLF)) {
                throw new MultipartParseException("Malformed multipart delimiter line");
            }
            int headersStart = position + CRLF.length;
            int headersEnd = indexOf(body, HEADER_END, headersStart);
            if (headersEnd < 0) {
                throw new MultipartParseException("Unterminated part headers");
            }
            int contentStart = headersEnd + HEADER_END.length;
            int contentEnd = indexOf(body, partDelimiter, contentStart);
            if (contentEnd < 0) {
                throw new MultipartParseException("Unterminated multipart part");
            }

            String headers = new String(body, headersStart, headersEnd - headersStart, StandardCharsets.UTF_8);
            addPart(form, headers, Arrays.copyOfRange(body, contentStart, contentEnd));
            position = contentEnd + partDelimiter.length;
        }
    }

    private static void addPart(MultipartForm form, String headers, byte[] content) throws MultipartParseException {
        String disposition = null;
        String partType = null;
        for (String line : headers.split("\r\n")) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();
            if (name.equals("content-disposition")) {
                disposition = value;
            } else if (name.equals("content-type")) {
                partType = value;
            }
        }
        if (disposition == null) {
            throw new MultipartParseException("Part without Content-Disposition header");
        }

        Map<String, String> parameters = parseParameters(disposition);
        String fieldName = parameters.get("name");
        if (fieldName == null) {
            throw new MultipartParseException("Part without a field name");
        }
        String filename = parameters.get("filename");
        if (filename == null) {
            form.addField(fieldName, new String(content, StandardCharsets.UTF_8));
        } else if (!filename.isEmpty()) {
            form.addFile(fieldName, new FileBlob(filename, content, partType));
        }
    }

    /**
     * Параметры заголовка вида "value; a=1; b=\"x; y\"". Ключи приводятся к нижнему регистру.
     */
    static Map<String, String> parseParameters(String headerValue) {
        Map<String, String> parameters = new LinkedHashMap<>();
        int i = headerValue.indexOf(';');
        while (i >= 0 && i < headerValue.length()) {
            i++;
            int equals = headerValue.indexOf('=', i);
            if (equals < 0) {
                break;
            }
            String key = headerValue.substring(i, equals).trim().toLowerCase(Locale.ROOT);
            int valueStart = equals + 1;
            while (valueStart < headerValue.length() && headerValue.charAt(valueStart) == ' ') {
                valueStart++;
            }

            String value;
            int next;
            if (valueStart < headerValue.length() && headerValue.charAt(valueStart) == '"') {
                StringBuilder quoted = new StringBuilder();
                int j = valueStart + 1;
                while (j < headerValue.length() && headerValue.charAt(j) != '"') {
                    char c = headerValue.charAt(j);
                    if (c == '\\' && j + 1 < headerValue.length()) {
                        c = headerValue.charAt(++j);
                    }
                    quoted.append(c);
                    j++;
                }
                value = quoted.toString();
                next = headerValue.indexOf(';', j);
            } else {
                next = headerValue.indexOf(';', valueStart);
                value = (next < 0 ? headerValue.substring(valueStart) : headerValue.substring(valueStart, next)).trim();
            }
            parameters.put(key, value);
            i = next;
        }
        return parameters;
    }

    private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (offset + prefix.length > data.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(byte[] data, byte[] pattern, int from) {
        outer:
        for (int i = from; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
