package ru.nsu.fanout;

import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.worker.WorkerServer;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

@Slf4j
public class Main {
    private static final int DEFAULT_WORKER_PORT = 3000;
    private static final String DEFAULT_COORDINATOR_URL = "http://localhost:8080";
    private static final String DEFAULT_WORKER_HOST = "localhost";
    private static final Duration RE_REGISTRATION_PERIOD = Duration.ofSeconds(10);

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        String workerPort = env.getOrDefault("WORKER_PORT", String.valueOf(DEFAULT_WORKER_PORT));
        String coordinatorUrl = env.getOrDefault("COORDINATOR_URL", DEFAULT_COORDINATOR_URL);
        String workerHost = env.getOrDefault("WORKER_HOST", DEFAULT_WORKER_HOST);

        if (args.length > 0) {
            workerPort = args[0];
        }
        if (args.length > 1) {
            coordinatorUrl = args[1];
        }
        if (args.length > 2) {
            workerHost = args[2];
        }

        int port = DEFAULT_WORKER_PORT;
        try {
            port = Integer.parseInt(workerPort);
        } catch (NumberFormatException e) {
            log.error("Invalid worker port number, using default: {}", DEFAULT_WORKER_PORT);
        }

        WorkerServer server = new WorkerServer(workerHost, port, URI.create(coordinatorUrl), RE_REGISTRATION_PERIOD);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
        }));

        try {
            if (!server.start()) {
                System.exit(1);
            }
            Thread.currentThread().join();
        } catch (IOException e) {
            log.error("Failed to start worker server", e);
        } catch (InterruptedException e) {
            log.error("Worker interrupted", e);
        }
    }
}
