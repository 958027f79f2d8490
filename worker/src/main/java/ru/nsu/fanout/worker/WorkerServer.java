package ru.nsu.fanout.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.common.HttpResponses;
import ru.nsu.fanout.common.JacksonConfig;
import ru.nsu.fanout.common.MultipartForm;
import ru.nsu.fanout.common.MultipartParseException;
import ru.nsu.fanout.common.MultipartParser;
import ru.nsu.fanout.common.ResultsCodec;
import ru.nsu.fanout.common.WorkerContract;
import ru.nsu.fanout.model.FileBlob;
import ru.nsu.fanout.model.PayloadKind;
import ru.nsu.fanout.model.ProcessedItem;
import ru.nsu.fanout.model.TaskType;
import ru.nsu.fanout.model.WorkerEndpoint;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Основной сервер worker-узла.
 * Отвечает на проверку статуса, обрабатывает части пакетов и
 * периодически подтверждает регистрацию у координатора.
 */
@Slf4j
public class WorkerServer {
    private final String advertisedHost;
    private final int workerPort;
    private final Duration reRegistrationPeriod;
    private final CoordinatorClient coordinatorClient;
    private final Map<TaskType, ContentProcessor> processors;
    private final FileTaskExecutor taskExecutor;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService requestExecutor;
    private final ObjectMapper objectMapper;
    private final HttpResponses responses;
    private final ResultsCodec resultsCodec;
    private HttpServer httpServer;
    private WorkerEndpoint endpoint;
    private volatile boolean running = false;

    public WorkerServer(String advertisedHost, int workerPort, URI coordinatorUrl, Duration reRegistrationPeriod) {
        this(advertisedHost, workerPort, new CoordinatorClient(coordinatorUrl), reRegistrationPeriod,
                defaultProcessors(JacksonConfig.createObjectMapper()));
    }

    public WorkerServer(String advertisedHost, int workerPort, CoordinatorClient coordinatorClient,
                        Duration reRegistrationPeriod, Map<TaskType, ContentProcessor> processors) {
        this.advertisedHost = advertisedHost;
        this.workerPort = workerPort;
        this.reRegistrationPeriod = reRegistrationPeriod;
        this.coordinatorClient = coordinatorClient;
        this.processors = new EnumMap<>(processors);
        this.taskExecutor = new FileTaskExecutor(Runtime.getRuntime().availableProcessors());
        this.scheduler = Executors.newScheduledThreadPool(1);
        this.requestExecutor = Executors.newCachedThreadPool();
        this.objectMapper = JacksonConfig.createObjectMapper();
        this.responses = new HttpResponses(objectMapper);
        this.resultsCodec = new ResultsCodec(objectMapper);
    }

    /**
     * Заглушки: бинарные типы возвращают файл как есть, остальные - JSON-сводку.
     */
    public static Map<TaskType, ContentProcessor> defaultProcessors(ObjectMapper objectMapper) {
        Map<TaskType, ContentProcessor> processors = new EnumMap<>(TaskType.class);
        for (TaskType type : TaskType.values()) {
            processors.put(type, type.getPayloadKind() == PayloadKind.BINARY
                    ? new PassThroughProcessor()
                    : new FileSummaryProcessor(type, objectMapper));
        }
        return processors;
    }

    /**
     * Запускает HTTP-сервер и регистрируется у координатора.
     * @return false, если первичная регистрация не удалась и worker остановлен
     */
    public boolean start() throws IOException {
        if (running) {
            log.warn("Worker server is already running");
            return true;
        }

        running = true;
        httpServer = HttpServer.create(new InetSocketAddress(workerPort), 0);
        httpServer.createContext("/", this::handleHome);
        httpServer.createContext(WorkerContract.STATUS_PATH, this::handleCheckStatus);
        httpServer.createContext(WorkerContract.TASK_PATH, this::handleGetTask);
        httpServer.setExecutor(requestExecutor);
        httpServer.start();

        endpoint = new WorkerEndpoint(advertisedHost, httpServer.getAddress().getPort());
        log.info("Worker HTTP server started on port {}, advertised as {}", endpoint.getPort(), endpoint);

        if (!coordinatorClient.registerWorker(endpoint)) {
            log.error("Failed to register worker, stopping");
            stop();
            return false;
        }

        long periodMs = reRegistrationPeriod.toMillis();
        scheduler.scheduleAtFixedRate(this::reRegister, periodMs, periodMs, TimeUnit.MILLISECONDS);

        log.info("Worker server started successfully");
        return true;
    }

    public void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping worker server");
        running = false;

        if (httpServer != null) {
            httpServer.stop(0);
        }

        scheduler.shutdown();
        requestExecutor.shutdown();
        taskExecutor.shutdown();
        log.info("Worker server stopped");
    }

    public WorkerEndpoint getEndpoint() {
        return endpoint;
    }

    private void reRegister() {
        if (!running) {
            return;
        }

        if (!coordinatorClient.registerWorker(endpoint)) {
            log.warn("Failed to confirm registration ({} files in progress)", taskExecutor.getActiveFiles());
        }
    }

    private void handleHome(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            responses.sendError(exchange, 404, "Not found");
            return;
        }
        responses.sendText(exchange, 200, "Worker is working");
    }

    private void handleCheckStatus(HttpExchange exchange) throws IOException {
        if (!responses.requireMethod(exchange, "GET")) {
            return;
        }
        responses.sendJson(exchange, 200, Map.of("status", "alive"));
    }

    private void handleGetTask(HttpExchange exchange) throws IOException {
        if (!responses.requireMethod(exchange, "POST")) {
            return;
        }

        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        MultipartForm form;
        try {
            form = MultipartParser.parse(contentType, exchange.getRequestBody().readAllBytes());
        } catch (MultipartParseException e) {
            responses.sendError(exchange, 400, e.getMessage());
            return;
        }

        String taskTypeName = form.getField(WorkerContract.TASK_TYPE_FIELD).orElse(WorkerContract.DEFAULT_TASK_TYPE);
        Optional<TaskType> taskType = TaskType.fromWireName(taskTypeName);
        if (taskType.isEmpty() || !processors.containsKey(taskType.get())) {
            responses.sendError(exchange, 400, "Unknown task type: " + taskTypeName);
            return;
        }

        List<FileBlob> files = form.getFiles(taskType.get().getFieldName());
        if (files.isEmpty()) {
            responses.sendError(exchange, 400, "No " + taskType.get().getFieldName() + " provided");
            return;
        }

        log.info("Received {} {} files for processing", files.size(), taskType.get());
        try {
            List<ProcessedItem> results = taskExecutor.processAll(files, processors.get(taskType.get()));
            responses.send(exchange, 200, "application/json", resultsCodec.encode(taskType.get(), results));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            responses.sendError(exchange, 503, "Worker is shutting down");
        }
    }
}
