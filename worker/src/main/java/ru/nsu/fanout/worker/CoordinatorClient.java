package ru.nsu.fanout.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.common.JacksonConfig;
import ru.nsu.fanout.common.WorkerContract;
import ru.nsu.fanout.model.WorkerEndpoint;
import ru.nsu.fanout.model.WorkerRegistrationRequest;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

@Slf4j
public class CoordinatorClient {
    private final URI coordinatorBaseUrl;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public CoordinatorClient(URI coordinatorBaseUrl) {
        this.coordinatorBaseUrl = coordinatorBaseUrl;
        this.objectMapper = JacksonConfig.createObjectMapper();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    /**
     * Регистрирует worker-а у координатора. Повторный вызов безопасен.
     */
    public boolean registerWorker(WorkerEndpoint endpoint) {
        try {
            WorkerRegistrationRequest request = WorkerRegistrationRequest.of(endpoint.getHost(), endpoint.getPort());
            String requestBody = objectMapper.writeValueAsString(request);

            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(coordinatorBaseUrl.resolve(WorkerContract.REGISTER_PATH))
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(5))
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() == 200) {
                log.debug("Registered as {} at {}", endpoint, coordinatorBaseUrl);
                return true;
            } else {
                log.error("Failed to register worker: {}", response.body());
                return false;
            }
        } catch (IOException e) {
            log.error("Error registering worker at {}: {}", coordinatorBaseUrl, e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Registration at {} interrupted", coordinatorBaseUrl);
            return false;
        }
    }
}
