package ru.nsu.fanout.coordinator;

import com.fasterxml.jackson.core.JsonProcessingException;
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
import ru.nsu.fanout.model.DispatchResult;
import ru.nsu.fanout.model.TaskBatch;
import ru.nsu.fanout.model.TaskType;
import ru.nsu.fanout.model.WorkerEndpoint;
import ru.nsu.fanout.model.WorkerRegistrationRequest;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP-фронт координатора: регистрация worker-ов и приём пакетов файлов.
 */
@Slf4j
public class CoordinatorServer {
    private final CoordinatorConfig config;
    private final ObjectMapper objectMapper;
    private final HttpResponses responses;
    private final WorkerRegistry registry;
    private final BatchCoordinator batchCoordinator;
    private final ExecutorService probeExecutor;
    private final ExecutorService dispatchExecutor;
    private final ExecutorService requestExecutor;
    private HttpServer httpServer;

    public CoordinatorServer(CoordinatorConfig config) {
        this.config = config;
        this.objectMapper = JacksonConfig.createObjectMapper();
        this.responses = new HttpResponses(objectMapper);
        this.registry = new WorkerRegistry();
        this.probeExecutor = Executors.newFixedThreadPool(config.getMaxConcurrentCalls());
        this.dispatchExecutor = Executors.newFixedThreadPool(config.getMaxConcurrentCalls());
        this.requestExecutor = Executors.newCachedThreadPool();

        WorkerClient workerClient = new HttpWorkerClient(
                new ResultsCodec(objectMapper), config.getProbeTimeout(), config.getDispatchTimeout());
        this.batchCoordinator = new BatchCoordinator(
                registry,
                new HealthProber(registry, workerClient, probeExecutor),
                new TaskPartitioner(),
                new SliceDispatcher(workerClient, registry, dispatchExecutor),
                config.getOutputRoot(),
                objectMapper);
    }

    /**
     * Запускает сервер.
     */
    public void start() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(config.getPort()), 0);

        httpServer.createContext("/", this::handleHome);

        // Регистрация worker-а
        httpServer.createContext(WorkerContract.REGISTER_PATH, this::handleWorkerRegistration);

        // Снимок реестра
        httpServer.createContext(WorkerContract.WORKERS_PATH, this::handleGetWorkers);

        // Приём пакета файлов от клиента
        httpServer.createContext(WorkerContract.SUBMIT_PATH, this::handleAssignTask);

        httpServer.setExecutor(requestExecutor);
        httpServer.start();
        log.info("Coordinator server started on port {}, results go to {}", getPort(), config.getOutputRoot());
    }

    /**
     * Останавливает сервер.
     */
    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
            log.info("Coordinator server stopped");
        }
        requestExecutor.shutdownNow();
        dispatchExecutor.shutdownNow();
        probeExecutor.shutdownNow();
    }

    /**
     * Фактический порт; отличается от настроенного, если настроен 0.
     */
    public int getPort() {
        return httpServer.getAddress().getPort();
    }

    public WorkerRegistry getRegistry() {
        return registry;
    }

    private void handleHome(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            responses.sendError(exchange, 404, "Not found");
            return;
        }
        if (!responses.requireMethod(exchange, "GET")) {
            return;
        }
        responses.sendText(exchange, 200, "Coordinator is working");
    }

    private void handleWorkerRegistration(HttpExchange exchange) throws IOException {
        if (!responses.requireMethod(exchange, "POST")) {
            return;
        }

        try {
            WorkerRegistrationRequest request = objectMapper.readValue(
                    exchange.getRequestBody(), WorkerRegistrationRequest.class);
            WorkerEndpoint endpoint = toEndpoint(request);
            registry.register(endpoint);
            responses.sendJson(exchange, 200, Map.of("status", "success"));
        } catch (ValidationException e) {
            responses.sendError(exchange, 400, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Malformed registration request: {}", e.getOriginalMessage());
            responses.sendError(exchange, 400, "Invalid request: " + e.getOriginalMessage());
        }
    }

    static WorkerEndpoint toEndpoint(WorkerRegistrationRequest request) {
        if (request == null || request.getHost() == null || request.getHost().isBlank()
                || request.getPort() == null) {
            throw new ValidationException("host and port are required");
        }
        if (request.getPort() < 1 || request.getPort() > 65535) {
            throw new ValidationException("port must be between 1 and 65535");
        }
        return new WorkerEndpoint(request.getHost().trim(), request.getPort());
    }

    private void handleGetWorkers(HttpExchange exchange) throws IOException {
        if (!responses.requireMethod(exchange, "GET")) {
            return;
        }
        responses.sendJson(exchange, 200, registry.snapshot());
    }

    private void handleAssignTask(HttpExchange exchange) throws IOException {
        if (!responses.requireMethod(exchange, "POST")) {
            return;
        }

        try {
            TaskBatch batch = readBatch(exchange);
            DispatchResult result = batchCoordinator.submit(batch);
            responses.sendJson(exchange, 200, result);
        } catch (ValidationException | MultipartParseException e) {
            responses.sendError(exchange, 400, e.getMessage());
        } catch (NoWorkersAvailableException e) {
            responses.sendError(exchange, 503, e.getMessage());
        } catch (Exception e) {
            log.error("Error processing batch", e);
            responses.sendError(exchange, 500, "Internal error: " + e.getMessage());
        }
    }

    private TaskBatch readBatch(HttpExchange exchange) throws IOException {
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        if (!MultipartParser.isMultipart(contentType)) {
            throw new ValidationException("Expected a multipart/form-data request");
        }
        MultipartForm form = MultipartParser.parse(contentType, exchange.getRequestBody().readAllBytes());

        String taskTypeName = form.getField(WorkerContract.TASK_TYPE_FIELD)
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .orElse(WorkerContract.DEFAULT_TASK_TYPE);
        TaskType taskType = TaskType.fromWireName(taskTypeName)
                .orElseThrow(() -> new ValidationException("Unknown task type: " + taskTypeName));
        return new TaskBatch(taskType, form.getFiles(taskType.getFieldName()));
    }
}
