package ru.nsu.fanout.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Запрос на регистрацию worker-а.
 * Поля nullable: отсутствие любого из них проверяет координатор.
 * Понимает и старые имена полей slave_ip / slave_port.
 */
@Getter
@NoArgsConstructor
public class WorkerRegistrationRequest implements Serializable {
    @JsonProperty("host")
    @JsonAlias("slave_ip")
    private String host;

    @JsonProperty("port")
    @JsonAlias("slave_port")
    private Integer port;

    public static WorkerRegistrationRequest of(String host, int port) {
        WorkerRegistrationRequest request = new WorkerRegistrationRequest();
        request.host = host;
        request.port = port;
        return request;
    }
}
