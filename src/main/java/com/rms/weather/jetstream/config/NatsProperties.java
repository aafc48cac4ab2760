package com.rms.weather.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * NATS connection settings and node identity.
 *
 * <p>Configuration prefix: {@code weather.nats}</p>
 *
 * <p>{@code nodeId} is part of every durable consumer name, so two service
 * instances with the same node id share (and split) each partition's
 * deliveries.</p>
 */
@ConfigurationProperties(prefix = "weather.nats")
public class NatsProperties {

    // ---------------------------------------------------------------------
    // Node identity
    // ---------------------------------------------------------------------

    private String nodeId = "node01";

    // ---------------------------------------------------------------------
    // Connectivity
    // ---------------------------------------------------------------------

    private boolean enabled = true;

    private String url = "nats://localhost:4222";

    // ---------------------------------------------------------------------
    // Optional authentication / TLS
    // ---------------------------------------------------------------------

    private String user;

    private String password;

    private String token;

    /** Path to a NATS credentials (JWT + NKey) file. */
    private String creds;

    private boolean tls = false;

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getCreds() { return creds; }
    public void setCreds(String creds) { this.creds = creds; }

    public boolean isTls() { return tls; }
    public void setTls(boolean tls) { this.tls = tls; }
}
