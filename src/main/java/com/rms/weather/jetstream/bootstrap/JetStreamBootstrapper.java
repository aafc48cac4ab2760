package com.rms.weather.jetstream.bootstrap;

import com.rms.weather.config.ConfigurationException;
import com.rms.weather.jetstream.config.JetStreamBootstrapProperties;
import com.rms.weather.jetstream.config.JetStreamStreamsProperties;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * =====================================================================
 * JetStreamBootstrapper
 * =====================================================================
 *
 * Creates the observation and dead-letter streams when they do not exist and
 * validates them when they do.
 *
 * Only a "stream not found" answer (API error 10059) leads to creation;
 * permission or connectivity failures propagate and fail startup.
 *
 * On completion a {@link JetStreamBootstrapCompleteEvent} is published so the
 * stream consumer can subscribe right away.
 *
 * MISMATCH HANDLING
 * -----------------
 * weather.jetstream.bootstrap.fail-on-mismatch=true  -> startup fails
 * weather.jetstream.bootstrap.fail-on-mismatch=false -> warning only
 */
public class JetStreamBootstrapper implements ApplicationRunner {

    private static final Logger log =
            LoggerFactory.getLogger(JetStreamBootstrapper.class);

    public static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStreamManagement jsm;

    private final JetStreamStreamsProperties streamsProps;

    private final JetStreamBootstrapProperties bootstrapProps;

    private final ApplicationEventPublisher publisher;

    public JetStreamBootstrapper(
            JetStreamManagement jsm,
            JetStreamStreamsProperties streamsProps,
            JetStreamBootstrapProperties bootstrapProps,
            ApplicationEventPublisher publisher
    ) {
        this.jsm = jsm;
        this.streamsProps = streamsProps;
        this.bootstrapProps = bootstrapProps;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<JetStreamStreamsProperties.StreamSpec> selected =
                streamsProps.selectByKeys(bootstrapProps.getStreamKeys());
        log.info("JetStream bootstrap: streamKeys={} (bootstrapping {} streams)",
                bootstrapProps.getStreamKeys().isEmpty() ? "all" : bootstrapProps.getStreamKeys(), selected.size());

        for (JetStreamStreamsProperties.StreamSpec spec : selected) {
            ensureStream(spec);
        }

        publisher.publishEvent(new JetStreamBootstrapCompleteEvent(selected.size()));

        log.info("JetStream bootstrap complete");
    }

    void ensureStream(JetStreamStreamsProperties.StreamSpec spec) throws Exception {
        StreamConfiguration desired = toStreamConfig(spec);

        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(desired, existing);
            return;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        jsm.addStream(desired);

        log.info("Created JetStream stream: {} (subjects={}, maxAge={}, retention={}, storage={}, replicas={})",
                desired.getName(),
                desired.getSubjects(),
                desired.getMaxAge(),
                desired.getRetentionPolicy(),
                desired.getStorageType(),
                desired.getReplicas());
    }

    private void validateExisting(StreamConfiguration desired, StreamInfo existing) {
        StreamConfiguration actual = existing.getConfiguration();
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy()
                    + " expected=" + desired.getRetentionPolicy());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType()
                    + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getMaxAge(), desired.getMaxAge())) {
            diffs.add("maxAge actual=" + actual.getMaxAge()
                    + " expected=" + desired.getMaxAge());
        }
        if (actual.getReplicas() != desired.getReplicas()) {
            diffs.add("replicas actual=" + actual.getReplicas()
                    + " expected=" + desired.getReplicas());
        }
        if (!new HashSet<>(actual.getSubjects()).equals(new HashSet<>(desired.getSubjects()))) {
            diffs.add("subjects actual=" + actual.getSubjects()
                    + " expected=" + desired.getSubjects());
        }

        if (diffs.isEmpty()) {
            log.info("JetStream stream exists and matches config: {} (subjects={})",
                    desired.getName(), actual.getSubjects());
            return;
        }

        String msg = "JetStream stream exists but differs from expected: "
                + desired.getName() + " :: " + String.join("; ", diffs);

        if (bootstrapProps.isFailOnMismatch()) {
            throw new ConfigurationException(msg);
        }
        log.warn(msg);
    }

    static StreamConfiguration toStreamConfig(JetStreamStreamsProperties.StreamSpec spec) {
        String name = spec.getName();
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("stream name is required");
        }

        List<String> subjects = spec.getSubjects();
        if (subjects == null || subjects.isEmpty()) {
            throw new ConfigurationException("subjects is required for stream " + name);
        }

        Duration maxAge = spec.getMaxAge();
        if (maxAge == null) {
            throw new ConfigurationException("maxAge is required for stream " + name);
        }

        return StreamConfiguration.builder()
                .name(name)
                .subjects(subjects.toArray(String[]::new))
                .retentionPolicy(parseRetentionPolicy(spec.getRetentionPolicy()))
                .storageType(parseStorageType(spec.getStorageType()))
                .maxAge(maxAge)
                .replicas(spec.getReplicas())
                .build();
    }

    static RetentionPolicy parseRetentionPolicy(String value) {
        if (value == null || value.isBlank()) {
            return RetentionPolicy.Limits;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "workqueue", "work_queue", "work-queue" -> RetentionPolicy.WorkQueue;
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            default -> throw new ConfigurationException("Unsupported retentionPolicy: " + value);
        };
    }

    static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new ConfigurationException("Unsupported storageType: " + value);
        };
    }
}
