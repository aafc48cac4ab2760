package com.rms.weather.consumer;

import io.nats.client.Message;
import io.nats.client.impl.NatsJetStreamMetaData;

/**
 * {@link InboundMessage} over a JetStream {@link Message}.
 *
 * <p>{@code sourceId} is {@code <stream>:<stream sequence>}.</p>
 */
public class NatsInboundMessage implements InboundMessage {

    private static final byte[] EMPTY = new byte[0];

    private final Message message;

    public NatsInboundMessage(Message message) {
        this.message = message;
    }

    @Override
    public String subject() {
        return message.getSubject();
    }

    @Override
    public byte[] data() {
        byte[] d = message.getData();
        return d == null ? EMPTY : d;
    }

    @Override
    public long deliveryCount() {
        return message.isJetStream() ? message.metaData().deliveredCount() : 1L;
    }

    @Override
    public String sourceId() {
        if (!message.isJetStream()) {
            return message.getSubject() + ":" + message.getSID();
        }
        NatsJetStreamMetaData meta = message.metaData();
        return meta.getStream() + ":" + meta.streamSequence();
    }

    @Override
    public void ack() {
        message.ack();
    }

    @Override
    public String toString() {
        return "NatsInboundMessage[subject=" + subject() + ", id=" + sourceId() + "]";
    }
}
