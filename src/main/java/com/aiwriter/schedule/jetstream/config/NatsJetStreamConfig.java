package com.aiwriter.schedule.jetstream.config;

import com.aiwriter.schedule.config.ScheduleTargetProperties;
import com.aiwriter.schedule.config.SchedulingProperties;
import com.aiwriter.schedule.jetstream.bootstrap.JetStreamBootstrapper;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.KeyValue;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that wires up:
 * - NATS {@link Connection}
 * - JetStream client APIs ({@link JetStream} and {@link JetStreamManagement})
 * - the job bucket ({@link KeyValue}) used by the scheduler adapter
 * - Property binding for all pipeline configuration classes
 *
 * <h2>Connection strategy</h2>
 * <ul>
 *   <li>If no auth/TLS fields are configured, it uses {@code Nats.connect(url)}.</li>
 *   <li>Otherwise it builds {@link Options} with the configured user/password, token, creds file and TLS.</li>
 * </ul>
 * Secrets are never logged; the username is masked.
 */
@Configuration
@EnableConfigurationProperties({
        ContentSchedulerProperties.class,   // Identity + connection settings
        JetStreamBootstrapProperties.class, // Bootstrap strictness
        JetStreamStreamsProperties.class,   // Stream specs
        SchedulingProperties.class,         // Zone, job bucket, firing, registration retry
        ScheduleTargetProperties.class      // Target of every scheduled job
})
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    /**
     * Creates the shared NATS {@link Connection}; closed on application shutdown.
     */
    @Bean(destroyMethod = "close")
    public Connection natsConnection(ContentSchedulerProperties props) throws Exception {
        String url = props.getNatsUrl();

        boolean wantsOptions =
                hasText(props.getNatsUser()) ||
                hasText(props.getNatsPassword()) ||
                hasText(props.getNatsToken()) ||
                hasText(props.getNatsCreds()) ||
                props.isNatsTls();

        if (!wantsOptions) {
            return Nats.connect(url);
        }

        Options.Builder builder = Options.builder()
                .server(url)
                .connectionName(props.getService() + "-" + props.getNodeId());

        if (props.isNatsTls()) {
            builder.secure();
        }
        if (hasText(props.getNatsToken())) {
            builder.token(props.getNatsToken().toCharArray());
        }
        if (hasText(props.getNatsUser())) {
            String pass = props.getNatsPassword() == null ? "" : props.getNatsPassword();
            builder.userInfo(props.getNatsUser(), pass);
        }
        if (hasText(props.getNatsCreds())) {
            // NKey/JWT via credentials file
            builder.authHandler(Nats.credentials(props.getNatsCreds()));
        }

        Connection c = Nats.connect(builder.build());
        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                url,
                props.isNatsTls(),
                props.getNatsUser() == null ? "" : mask(props.getNatsUser()),
                props.getNatsCreds() == null ? "" : props.getNatsCreds());
        return c;
    }

    @Bean
    public JetStream jetStream(Connection connection) throws Exception {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws Exception {
        return connection.jetStreamManagement();
    }

    /**
     * Key-value context of the job bucket.
     *
     * <p>The bucket must exist before the context is bound, so it is provisioned here
     * unless {@code contentsched.bootstrap.create-job-bucket} is off.</p>
     */
    @Bean
    public KeyValue jobBucket(
            Connection connection,
            SchedulingProperties scheduling,
            JetStreamBootstrapProperties bootstrap
    ) throws Exception {
        if (bootstrap.isCreateJobBucket()) {
            JetStreamBootstrapper.ensureJobBucket(connection.keyValueManagement(),
                    scheduling.getJobBucket(), scheduling.getJobBucketStorage());
        }
        return connection.keyValue(scheduling.getJobBucket());
    }

    private static boolean hasText(String v) {
        return v != null && !v.isBlank();
    }

    /**
     * Masks an identifier for logging. Example: "admin" -> "a***n".
     */
    private static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
