package ru.nsu.fanout.coordinator;

import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.common.MultipartBody;
import ru.nsu.fanout.common.ResultsCodec;
import ru.nsu.fanout.common.WorkerContract;
import ru.nsu.fanout.model.FileBlob;
import ru.nsu.fanout.model.ProcessedItem;
import ru.nsu.fanout.model.SliceResult;
import ru.nsu.fanout.model.TaskSlice;
import ru.nsu.fanout.model.TaskType;
import ru.nsu.fanout.model.WorkerEndpoint;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP-реализация контракта worker-а поверх java.net.http.HttpClient.
 */
@Slf4j
public class HttpWorkerClient implements WorkerClient {
    private final HttpClient httpClient;
    private final ResultsCodec resultsCodec;
    private final Duration probeTimeout;
    private final Duration dispatchTimeout;

    public HttpWorkerClient(ResultsCodec resultsCodec, Duration probeTimeout, Duration dispatchTimeout) {
        this.resultsCodec = resultsCodec;
        this.probeTimeout = probeTimeout;
        this.dispatchTimeout = dispatchTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(probeTimeout)
                .build();
    }

    @Override
    public boolean checkStatus(WorkerEndpoint endpoint) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint.baseUri().resolve(WorkerContract.STATUS_PATH))
                .timeout(probeTimeout)
                .GET()
                .build();
        try {
            HttpResponse<Void> response = sendWithin(request, HttpResponse.BodyHandlers.discarding(), probeTimeout);
            if (isSuccess(response.statusCode())) {
                return true;
            }
            log.warn("Worker {} answered status check with {}", endpoint, response.statusCode());
            return false;
        } catch (IOException e) {
            log.warn("Worker {} is unresponsive: {}", endpoint, e.toString());
            return false;
        } catch (TimeoutException e) {
            log.warn("Worker {} did not answer status check within {} ms", endpoint, probeTimeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Status check of worker {} interrupted", endpoint);
            return false;
        }
    }

    @Override
    public SliceResult process(TaskSlice slice, TaskType taskType) {
        WorkerEndpoint endpoint = slice.getEndpoint();
        MultipartBody body = new MultipartBody()
                .addField(WorkerContract.TASK_TYPE_FIELD, taskType.getWireName());
        for (FileBlob file : slice.getFiles()) {
            body.addFile(taskType.getFieldName(), file);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint.baseUri().resolve(WorkerContract.TASK_PATH))
                .header("Content-Type", body.contentType())
                .timeout(dispatchTimeout)
                .POST(body.publisher())
                .build();

        log.debug("Sending {} {} files to worker {}", slice.size(), taskType, endpoint);
        HttpResponse<byte[]> response;
        try {
            response = sendWithin(request, HttpResponse.BodyHandlers.ofByteArray(), dispatchTimeout);
        } catch (IOException e) {
            return SliceResult.transportFailure(endpoint, slice.size(), "Failed to contact worker: " + e);
        } catch (TimeoutException e) {
            return SliceResult.transportFailure(endpoint, slice.size(),
                    "Worker did not respond within " + dispatchTimeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SliceResult.transportFailure(endpoint, slice.size(), "Interrupted while waiting for worker");
        }

        if (!isSuccess(response.statusCode())) {
            return SliceResult.failure(endpoint, slice.size(), "Worker returned status " + response.statusCode());
        }
        try {
            List<ProcessedItem> items = resultsCodec.decode(taskType, response.body());
            log.debug("Worker {} returned {} results for {} files", endpoint, items.size(), slice.size());
            return SliceResult.success(endpoint, slice.size(), items);
        } catch (IOException e) {
            return SliceResult.failure(endpoint, slice.size(), "Unreadable worker response: " + e.getMessage());
        }
    }

    /**
     * Таймаут HttpRequest ограничивает только ожидание заголовков,
     * поэтому весь обмен вместе с чтением тела ограничивается здесь.
     */
    private <T> HttpResponse<T> sendWithin(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler,
                                           Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        CompletableFuture<HttpResponse<T>> future = httpClient.sendAsync(request, bodyHandler);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(cause);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
