package ru.nsu.fanout;

import lombok.extern.slf4j.Slf4j;
import ru.nsu.fanout.coordinator.CoordinatorConfig;
import ru.nsu.fanout.coordinator.CoordinatorServer;

import java.io.IOException;
import java.nio.file.Path;

@Slf4j
public class Main {

    public static void main(String[] args) {
        CoordinatorConfig config = CoordinatorConfig.fromEnvironment(System.getenv());
        if (args.length > 0) {
            try {
                config = config.withPort(Integer.parseInt(args[0]));
            } catch (NumberFormatException e) {
                log.error("Invalid port number, using: " + config.getPort(), e);
            }
        }
        if (args.length > 1) {
            config = config.withOutputRoot(Path.of(args[1]));
        }

        CoordinatorServer server = new CoordinatorServer(config);
        try {
            server.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down...");
                server.stop();
            }));

            Thread.currentThread().join();
        } catch (IOException e) {
            log.error("Failed to start server", e);
        } catch (InterruptedException e) {
            log.error("Server interrupted", e);
        }
    }
}
