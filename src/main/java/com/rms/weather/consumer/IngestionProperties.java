package com.rms.weather.consumer;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Stream consumer settings.
 *
 * <p>Configuration prefix: {@code weather.consumer}</p>
 */
@ConfigurationProperties(prefix = "weather.consumer")
public class IngestionProperties {

    private boolean enabled = true;

    /** Stream the partitions are read from. */
    private String stream = "WEATHER_OBSERVATIONS";

    /**
     * One filter subject per partition. Each gets its own durable consumer and
     * its own single-threaded loop; messages of one partition are applied in
     * stream order.
     */
    private List<String> partitions = new ArrayList<>(List.of("weather.observations.>"));

    /** Messages requested per pull. */
    private int batchSize = 50;

    private Duration pollInterval = Duration.ofMillis(500);

    /** Total write attempts per message, the first included. */
    private int maxAttempts = 5;

    private Duration initialBackoff = Duration.ofMillis(100);

    private Duration maxBackoff = Duration.ofSeconds(2);

    /** Backoff jitter factor, 0..1. */
    private double jitter = 0.5d;

    /**
     * Deliveries per message, the first included. A message that still has no
     * final outcome on its last delivery is dead-lettered and acked.
     */
    private int maxDeliver = 10;

    /** Redelivery delay for an unacked message. Must outlast all write attempts. */
    private Duration ackWait = Duration.ofSeconds(60);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getStream() { return stream; }
    public void setStream(String stream) { this.stream = stream; }

    public List<String> getPartitions() { return partitions; }
    public void setPartitions(List<String> partitions) {
        this.partitions = partitions == null ? new ArrayList<>() : partitions;
    }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

    public Duration getMaxBackoff() { return maxBackoff; }
    public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

    public double getJitter() { return jitter; }
    public void setJitter(double jitter) { this.jitter = jitter; }

    public int getMaxDeliver() { return maxDeliver; }
    public void setMaxDeliver(int maxDeliver) { this.maxDeliver = maxDeliver; }

    public Duration getAckWait() { return ackWait; }
    public void setAckWait(Duration ackWait) { this.ackWait = ackWait; }
}
