package com.rms.weather.consumer;

/**
 * A message delivered by the observation stream, reduced to what ingestion
 * needs. Acknowledging it is the consumer's checkpoint: an unacknowledged
 * message is redelivered.
 */
public interface InboundMessage {

    String subject();

    byte[] data();

    /** 1 on first delivery. */
    long deliveryCount();

    /** Stable identity of the message in its stream, the same across redeliveries. */
    String sourceId();

    void ack();
}
