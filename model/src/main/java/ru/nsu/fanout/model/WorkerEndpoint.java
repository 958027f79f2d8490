package ru.nsu.fanout.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.net.URI;
import java.util.Comparator;

/**
 * Адрес worker-узла. Идентичность определяется парой host:port.
 * Естественный порядок (host, затем port) задаёт порядок снимка реестра.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor
public class WorkerEndpoint implements Comparable<WorkerEndpoint>, Serializable {
    private static final Comparator<WorkerEndpoint> ORDER = Comparator
            .comparing(WorkerEndpoint::getHost)
            .thenComparingInt(WorkerEndpoint::getPort);

    @JsonProperty("host")
    private final String host;

    @JsonProperty("port")
    private final int port;

    /**
     * Базовый адрес worker-а, к которому разрешаются пути контракта.
     */
    public URI baseUri() {
        return URI.create("http://" + host + ":" + port);
    }

    @Override
    public int compareTo(WorkerEndpoint other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
