package ru.nsu.fanout.coordinator;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import ru.nsu.fanout.common.JacksonConfig;
import ru.nsu.fanout.common.MultipartForm;
import ru.nsu.fanout.common.MultipartParser;
import ru.nsu.fanout.common.ResultsCodec;
import ru.nsu.fanout.common.WorkerContract;
import ru.nsu.fanout.model.FileBlob;
import ru.nsu.fanout.model.ProcessedItem;
import ru.nsu.fanout.model.TaskType;
import ru.nsu.fanout.model.WorkerEndpoint;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;

/**
 * Worker на localhost для тестов: отвечает на проверку статуса заданным кодом,
 * а на задачу - base64 от исходных байтов каждого файла.
 */
class StubWorker implements AutoCloseable {
    private final HttpServer server;
    private final List<String> receivedFilenames = new CopyOnWriteArrayList<>();
    private final List<String> receivedTaskTypes = new CopyOnWriteArrayList<>();
    private volatile int statusCode = 200;
    private volatile int taskStatusCode = 200;
    private volatile long taskDelayMs = 0;
    private volatile long bodyStallMs = 0;

    StubWorker() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext(WorkerContract.STATUS_PATH, this::handleStatus);
        server.createContext(WorkerContract.TASK_PATH, this::handleTask);
        server.setExecutor(Executors.newCachedThreadPool());
        server.start();
    }

    static WorkerEndpoint unusedEndpoint() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return new WorkerEndpoint("localhost", socket.getLocalPort());
        }
    }

    WorkerEndpoint endpoint() {
        return new WorkerEndpoint("localhost", server.getAddress().getPort());
    }

    StubWorker statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    StubWorker taskStatusCode(int taskStatusCode) {
        this.taskStatusCode = taskStatusCode;
        return this;
    }

    StubWorker taskDelayMs(long taskDelayMs) {
        this.taskDelayMs = taskDelayMs;
        return this;
    }

    /**
     * Отвечает 200 и началом тела, после чего замолкает на заданное время.
     */
    StubWorker bodyStallMs(long bodyStallMs) {
        this.bodyStallMs = bodyStallMs;
        return this;
    }

    List<String> receivedFilenames() {
        return receivedFilenames;
    }

    List<String> receivedTaskTypes() {
        return receivedTaskTypes;
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        exchange.getRequestBody().readAllBytes();
        if (bodyStallMs > 0) {
            stallMidBody(exchange, "{\"status\":");
            return;
        }
        respond(exchange, statusCode, "{\"status\":\"alive\"}".getBytes());
    }

    private void handleTask(HttpExchange exchange) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        if (bodyStallMs > 0) {
            stallMidBody(exchange, "{\"results\":[");
            return;
        }
        if (taskDelayMs > 0) {
            try {
                Thread.sleep(taskDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (taskStatusCode != 200) {
            respond(exchange, taskStatusCode, "{\"error\":\"boom\"}".getBytes());
            return;
        }

        MultipartForm form = MultipartParser.parse(exchange.getRequestHeaders().getFirst("Content-Type"), body);
        TaskType taskType = TaskType.fromWireName(form.getField(WorkerContract.TASK_TYPE_FIELD).orElse("")).orElseThrow();
        receivedTaskTypes.add(taskType.getWireName());

        List<ProcessedItem> items = new ArrayList<>();
        for (FileBlob file : form.getFiles(taskType.getFieldName())) {
            receivedFilenames.add(file.getFilename());
            items.add(new ProcessedItem(file.getFilename(), Base64.getEncoder().encodeToString(file.getContent())));
        }
        respond(exchange, 200, new ResultsCodec(JacksonConfig.createObjectMapper()).encode(taskType, items));
    }

    private void stallMidBody(HttpExchange exchange, String prefix) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, 0);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(prefix.getBytes());
            os.flush();
            Thread.sleep(bodyStallMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
