package com.rms.weather.admin;

import com.rms.weather.consumer.IngestionProperties;
import com.rms.weather.consumer.IngestionStats;
import com.rms.weather.jetstream.config.NatsProperties;
import io.nats.client.JetStreamManagement;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class IngestionAdminControllerTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withBean(JetStreamManagement.class, () -> mock(JetStreamManagement.class))
            .withBean(IngestionStats.class, IngestionStats::new)
            .withBean(IngestionProperties.class, IngestionProperties::new)
            .withBean(NatsProperties.class, NatsProperties::new)
            .withUserConfiguration(IngestionAdminController.class);

    @Test
    void offByDefault() {
        runner.run(ctx -> assertThat(ctx).doesNotHaveBean(IngestionAdminController.class));
    }

    @Test
    void onWhenEnabled() {
        runner.withPropertyValues("weather.admin.enabled=true")
                .run(ctx -> assertThat(ctx).hasSingleBean(IngestionAdminController.class));
    }

    @Test
    void offWhenNatsIsDisabledEvenIfEnabled() {
        runner.withPropertyValues("weather.admin.enabled=true", "weather.nats.enabled=false")
                .run(ctx -> assertThat(ctx).hasNotFailed().doesNotHaveBean(IngestionAdminController.class));
    }
}
