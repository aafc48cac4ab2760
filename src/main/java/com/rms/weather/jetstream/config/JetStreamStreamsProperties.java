package com.rms.weather.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JetStream stream definitions used by the service.
 *
 * <p>Configuration prefix: {@code weather.jetstream}</p>
 *
 * <ul>
 *   <li>{@code observations}: the stream producers publish station observations to,
 *       one subject token per partition ({@code weather.observations.<partition>}).</li>
 *   <li>{@code dead-letter}: messages the consumer skipped, one subject token per
 *       reason ({@code weather.deadletter.<reason>}).</li>
 * </ul>
 *
 * <p>Both use Limits retention: the observation stream is replayable by new
 * durable consumers, which is what makes redelivery and catch-up possible.</p>
 */
@ConfigurationProperties(prefix = "weather.jetstream")
public class JetStreamStreamsProperties {

    public static final String KEY_OBSERVATIONS = "observations";
    public static final String KEY_DEAD_LETTER = "dead-letter";

    private Streams streams = new Streams();

    public Streams getStreams() {
        return streams;
    }

    public void setStreams(Streams streams) {
        this.streams = streams;
    }

    public List<StreamSpec> all() {
        List<StreamSpec> out = new ArrayList<>();
        for (StreamSpec spec : byKey().values()) {
            if (spec != null && spec.isEnabled()) {
                out.add(spec);
            }
        }
        return out;
    }

    public Map<String, StreamSpec> byKey() {
        Map<String, StreamSpec> out = new LinkedHashMap<>();
        if (streams == null) {
            return out;
        }
        out.put(KEY_OBSERVATIONS, streams.getObservations());
        out.put(KEY_DEAD_LETTER, streams.getDeadLetter());
        return out;
    }

    public List<StreamSpec> selectByKeys(List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return all();
        }
        Map<String, StreamSpec> map = byKey();
        List<StreamSpec> out = new ArrayList<>();
        for (String rawKey : keys) {
            if (rawKey == null || rawKey.isBlank()) {
                continue;
            }
            String key = rawKey.trim().toLowerCase(Locale.ROOT);
            StreamSpec spec = map.get(key);
            if (spec == null) {
                throw new IllegalArgumentException("Unknown stream key: " + rawKey + ". Valid keys=" + map.keySet());
            }
            if (!spec.isEnabled()) {
                throw new IllegalStateException("Stream key '" + key + "' is configured but disabled (enabled=false)");
            }
            out.add(spec);
        }
        return out;
    }

    public static class Streams {
        private StreamSpec observations = StreamSpec.defaultsObservations();
        private StreamSpec deadLetter = StreamSpec.defaultsDeadLetter();

        public StreamSpec getObservations() { return observations; }
        public void setObservations(StreamSpec observations) { this.observations = observations; }

        public StreamSpec getDeadLetter() { return deadLetter; }
        public void setDeadLetter(StreamSpec deadLetter) { this.deadLetter = deadLetter; }
    }

    public static class StreamSpec {

        private String name;

        private boolean enabled = true;

        private List<String> subjects = new ArrayList<>();

        private Duration maxAge;

        private String retentionPolicy = "Limits";

        private String storageType = "File";

        private int replicas = 1;

        public static StreamSpec defaultsObservations() {
            StreamSpec s = new StreamSpec();
            s.name = "WEATHER_OBSERVATIONS";
            s.subjects = List.of("weather.observations.>");
            s.maxAge = Duration.ofDays(30);
            return s;
        }

        public static StreamSpec defaultsDeadLetter() {
            StreamSpec s = new StreamSpec();
            s.name = "WEATHER_DEAD_LETTER";
            s.subjects = List.of("weather.deadletter.>");
            s.maxAge = Duration.ofDays(14);
            return s;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public List<String> getSubjects() { return subjects; }
        public void setSubjects(List<String> subjects) { this.subjects = subjects; }

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public String getRetentionPolicy() { return retentionPolicy; }
        public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

        public String getStorageType() { return storageType; }
        public void setStorageType(String storageType) { this.storageType = storageType; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }
    }
}
