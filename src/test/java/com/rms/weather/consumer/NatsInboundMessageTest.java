package com.rms.weather.consumer;

import io.nats.client.Message;
import io.nats.client.impl.NatsJetStreamMetaData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NatsInboundMessageTest {

    @Test
    void exposesJetStreamIdentityAndDeliveryCount() {
        Message msg = mock(Message.class);
        NatsJetStreamMetaData meta = mock(NatsJetStreamMetaData.class);
        when(msg.isJetStream()).thenReturn(true);
        when(msg.metaData()).thenReturn(meta);
        when(msg.getSubject()).thenReturn("weather.observations.p0");
        when(msg.getData()).thenReturn(new byte[] {1, 2});
        when(meta.getStream()).thenReturn("WEATHER_OBSERVATIONS");
        when(meta.streamSequence()).thenReturn(42L);
        when(meta.deliveredCount()).thenReturn(3L);

        NatsInboundMessage in = new NatsInboundMessage(msg);

        assertThat(in.subject()).isEqualTo("weather.observations.p0");
        assertThat(in.data()).containsExactly(1, 2);
        assertThat(in.sourceId()).isEqualTo("WEATHER_OBSERVATIONS:42");
        assertThat(in.deliveryCount()).isEqualTo(3L);

        in.ack();
        verify(msg).ack();
    }

    @Test
    void nullBodyReadsAsEmpty() {
        Message msg = mock(Message.class);
        when(msg.getData()).thenReturn(null);

        assertThat(new NatsInboundMessage(msg).data()).isEmpty();
    }
}
