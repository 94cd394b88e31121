package io.workline.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerConfig(String host, int port) {
    public ServerConfig {
        host = host == null || host.isBlank() ? "0.0.0.0" : host.trim();
        port = port < 0 ? 9464 : port;
    }

    public static ServerConfig defaults() {
        return new ServerConfig("0.0.0.0", 9464);
    }
}
