package com.rms.weather.jetstream.config;

import com.rms.weather.jetstream.bootstrap.JetStreamBootstrapper;
import com.rms.weather.jetstream.deadletter.JetStreamDeadLetterPublisher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Configuration;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * Spring configuration that wires up:
 * - NATS {@link Connection}
 * - JetStream client APIs ({@link JetStream} and {@link JetStreamManagement})
 * - the stream bootstrapper and the JetStream dead-letter publisher
 * - Property binding for all NATS/JetStream-related configuration classes
 *
 * <h2>Auth modes</h2>
 * No-auth, user/password, token or credentials file, each optionally over TLS.
 * With none of them configured the plain {@code Nats.connect(url)} path is used.
 *
 * <p>Disabled entirely with {@code weather.nats.enabled=false}; the stream
 * consumer and the admin endpoints need it.</p>
 */
@Configuration
@ConditionalOnProperty(prefix = "weather.nats", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({
        NatsProperties.class,
        JetStreamBootstrapProperties.class,
        JetStreamStreamsProperties.class
})
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(NatsProperties props) throws Exception {
        String url = props.getUrl();

        if (!wantsOptions(props)) {
            Connection c = Nats.connect(url);
            log.info("Connected to NATS (url={})", url);
            return c;
        }

        Options.Builder builder = new Options.Builder()
                .server(url)
                .connectionName("weather-ingest-" + props.getNodeId());

        if (props.isTls()) {
            builder.secure();
        }
        if (notBlank(props.getToken())) {
            builder.token(props.getToken().toCharArray());
        }
        if (notBlank(props.getUser())) {
            String pass = props.getPassword() == null ? "" : props.getPassword();
            builder.userInfo(props.getUser(), pass);
        }
        if (notBlank(props.getCreds())) {
            builder.authHandler(Nats.credentials(props.getCreds()));
        }

        Connection c = Nats.connect(builder.build());

        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                url,
                props.isTls(),
                props.getUser() == null ? "" : mask(props.getUser()),
                props.getCreds() == null ? "" : props.getCreds());

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

    @Bean
    @ConditionalOnProperty(prefix = "weather.jetstream.bootstrap", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public JetStreamBootstrapper jetStreamBootstrapper(JetStreamManagement jsm,
                                                       JetStreamStreamsProperties streamsProps,
                                                       JetStreamBootstrapProperties bootstrapProps,
                                                       ApplicationEventPublisher publisher) {
        return new JetStreamBootstrapper(jsm, streamsProps, bootstrapProps, publisher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "weather.dead-letter", name = "publish", havingValue = "true", matchIfMissing = true)
    public JetStreamDeadLetterPublisher jetStreamDeadLetterPublisher(JetStream js, NatsProperties props) {
        return new JetStreamDeadLetterPublisher(js, props.getNodeId());
    }

    static boolean wantsOptions(NatsProperties props) {
        return notBlank(props.getUser())
                || notBlank(props.getPassword())
                || notBlank(props.getToken())
                || notBlank(props.getCreds())
                || props.isTls();
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static String mask(String s) {
        if (s.length() <= 2) {
            return "**";
        }
        return s.charAt(0) + "***" + s.charAt(s.length() - 1);
    }
}
