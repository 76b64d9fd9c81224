package com.aiwriter.schedule.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration that captures:
 * <ul>
 *   <li><b>Node identity</b> used to derive durable consumer names and to tag log lines.</li>
 *   <li><b>NATS connection settings</b> (URL + optional auth/TLS) used to establish the client connection.</li>
 * </ul>
 *
 * <h2>Binding</h2>
 * Properties are bound from Spring Boot config using the prefix {@code contentsched}, e.g.:
 * <pre>
 * contentsched:
 *   service: content-scheduler
 *   nodeId: node01
 *   natsUrl: nats://localhost:4222
 *   natsUser: ...
 *   natsPassword: ...
 *   natsToken: ...
 *   natsCreds: /path/to/user.creds
 *   natsTls: false
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>Secrets (password/token) should come from environment variables or a secrets manager,
 *       never from committed config files.</li>
 *   <li>Durable consumer names are derived from {@code service} and {@code nodeId}; changing either
 *       creates new consumers that replay their streams from the start.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "contentsched")
public class ContentSchedulerProperties {

    // ---------------------------------------------------------------------
    // Identity
    // ---------------------------------------------------------------------

    /**
     * Logical service name, first segment of every durable consumer name.
     *
     * <p><b>Default</b>: {@code content-scheduler}</p>
     */
    private String service = "content-scheduler";

    /**
     * Deployment identifier of this instance.
     *
     * <p>Instances sharing a node id share durable consumers and therefore split the work
     * (competing consumers). Give instances distinct ids only when each must see every message.</p>
     *
     * <p><b>Default</b>: {@code node01}</p>
     */
    private String nodeId = "node01";

    // ---------------------------------------------------------------------
    // NATS connectivity
    // ---------------------------------------------------------------------

    /**
     * NATS server URL to connect to.
     *
     * <p><b>Default</b>: {@code nats://localhost:4222}</p>
     */
    private String natsUrl = "nats://localhost:4222";

    /** Optional username for user/password authentication. */
    private String natsUser;

    /**
     * Optional password for user/password authentication.
     *
     * <p><b>Security</b>: treat as a secret; do not log it.</p>
     */
    private String natsPassword;

    /** Optional token for token-based authentication. */
    private String natsToken;

    /** Optional path to a {@code .creds} file used for NKey/JWT authentication. */
    private String natsCreds;

    /** Enables TLS at the client level. */
    private boolean natsTls = false;

    public String getService() { return service; }
    public void setService(String service) { this.service = service; }

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public String getNatsUrl() { return natsUrl; }
    public void setNatsUrl(String natsUrl) { this.natsUrl = natsUrl; }

    public String getNatsUser() { return natsUser; }
    public void setNatsUser(String natsUser) { this.natsUser = natsUser; }

    public String getNatsPassword() { return natsPassword; }
    public void setNatsPassword(String natsPassword) { this.natsPassword = natsPassword; }

    public String getNatsToken() { return natsToken; }
    public void setNatsToken(String natsToken) { this.natsToken = natsToken; }

    public String getNatsCreds() { return natsCreds; }
    public void setNatsCreds(String natsCreds) { this.natsCreds = natsCreds; }

    public boolean isNatsTls() { return natsTls; }
    public void setNatsTls(boolean natsTls) { this.natsTls = natsTls; }
}
