package org.hpcbench.deploy;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;

/**
 * Network location of a running job. The port is absent for jobs that expose nothing.
 */
public final class Endpoint {
    private final String host;
    private final Integer port;

    public Endpoint(String host, Integer port) {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port != null && (port < 1 || port > 65535)) {
            throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
        }
        this.host = host.trim();
        this.port = port;
    }

    public String host() {
        return host;
    }

    public Optional<Integer> port() {
        return Optional.ofNullable(port);
    }

    /**
     * {@code http://host:port}, or empty when no port is known.
     */
    public String url() {
        return port == null ? "" : "http://" + host + ":" + port;
    }

    Document toDocument() {
        Document document = new Document("host", host);
        document.put("port", port);
        document.put("url", url());
        return document;
    }

    static Optional<Endpoint> fromDocument(Object value) {
        if (!(value instanceof Map<?, ?> map) || map.get("host") == null) {
            return Optional.empty();
        }
        Object port = map.get("port");
        return Optional.of(new Endpoint(String.valueOf(map.get("host")), port instanceof Number n ? n.intValue() : null));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Endpoint)) {
            return false;
        }
        Endpoint that = (Endpoint) other;
        return host.equals(that.host) && Objects.equals(port, that.port);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return port == null ? host : host + ":" + port;
    }
}
