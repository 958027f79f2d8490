package ru.nsu.fanout.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Отправка ответов из обработчиков com.sun.net.httpserver.
 */
public class HttpResponses {
    private final ObjectMapper objectMapper;

    public HttpResponses(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Проверяет HTTP-метод; при несовпадении отвечает 405.
     */
    public boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equals(exchange.getRequestMethod())) {
            return true;
        }
        sendError(exchange, 405, "Method not allowed");
        return false;
    }

    public void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        send(exchange, statusCode, "application/json", objectMapper.writeValueAsBytes(body));
    }

    public void sendText(HttpExchange exchange, int statusCode, String body) throws IOException {
        send(exchange, statusCode, "text/plain; charset=utf-8", body.getBytes(StandardCharsets.UTF_8));
    }

    public void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message));
    }

    public void send(HttpExchange exchange, int statusCode, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length == 0 ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
