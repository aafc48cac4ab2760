package com.rms.weather.consumer;

import com.rms.weather.jetstream.config.NatsProperties;
import io.nats.client.JetStream;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ObservationStreamConsumerTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withBean(JetStream.class, () -> mock(JetStream.class))
            .withBean(ObservationIngestor.class, () -> mock(ObservationIngestor.class))
            .withBean(IngestionProperties.class, IngestionProperties::new)
            .withBean(NatsProperties.class, NatsProperties::new)
            .withUserConfiguration(ObservationStreamConsumer.class);

    @Test
    void durableConsumerCapsRedelivery() {
        IngestionProperties props = new IngestionProperties();
        props.setMaxDeliver(7);
        props.setAckWait(Duration.ofSeconds(45));
        ObservationStreamConsumer consumer = new ObservationStreamConsumer(mock(JetStream.class),
                mock(ObservationIngestor.class), props, new NatsProperties());

        ConsumerConfiguration cc = consumer.consumerConfiguration("weather_node01_p0", "weather.observations.p0");

        assertThat(cc.getDurable()).isEqualTo("weather_node01_p0");
        assertThat(cc.getFilterSubject()).isEqualTo("weather.observations.p0");
        assertThat(cc.getAckPolicy()).isEqualTo(AckPolicy.Explicit);
        assertThat(cc.getDeliverPolicy()).isEqualTo(DeliverPolicy.All);
        assertThat(cc.getMaxDeliver()).isEqualTo(7);
        assertThat(cc.getAckWait()).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void createdByDefault() {
        runner.run(ctx -> assertThat(ctx).hasSingleBean(ObservationStreamConsumer.class));
    }

    @Test
    void absentWhenNatsIsDisabled() {
        runner.withPropertyValues("weather.nats.enabled=false")
                .run(ctx -> assertThat(ctx).hasNotFailed().doesNotHaveBean(ObservationStreamConsumer.class));
    }

    @Test
    void absentWhenConsumerIsDisabled() {
        runner.withPropertyValues("weather.consumer.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(ObservationStreamConsumer.class));
    }
}
