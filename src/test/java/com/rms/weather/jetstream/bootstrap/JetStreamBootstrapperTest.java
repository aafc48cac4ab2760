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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JetStreamBootstrapperTest {

    private final JetStreamManagement jsm = mock(JetStreamManagement.class);
    private final ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);
    private final JetStreamStreamsProperties streams = new JetStreamStreamsProperties();
    private final JetStreamBootstrapProperties bootstrap = new JetStreamBootstrapProperties();
    private JetStreamBootstrapper bootstrapper;

    @BeforeEach
    void setUp() {
        bootstrapper = new JetStreamBootstrapper(jsm, streams, bootstrap, events);
    }

    private static JetStreamApiException apiError(int code) {
        JetStreamApiException e = mock(JetStreamApiException.class);
        when(e.getApiErrorCode()).thenReturn(code);
        return e;
    }

    private static StreamInfo existing(StreamConfiguration cfg) {
        StreamInfo info = mock(StreamInfo.class);
        when(info.getConfiguration()).thenReturn(cfg);
        return info;
    }

    @Test
    void missingStreamsAreCreatedAndCompletionIsAnnounced() throws Exception {
        JetStreamApiException notFound = apiError(JetStreamBootstrapper.JS_STREAM_NOT_FOUND_ERR);
        when(jsm.getStreamInfo(anyString())).thenThrow(notFound);

        bootstrapper.run(new DefaultApplicationArguments());

        ArgumentCaptor<StreamConfiguration> created = ArgumentCaptor.forClass(StreamConfiguration.class);
        verify(jsm, times(2)).addStream(created.capture());
        assertThat(created.getAllValues()).extracting(StreamConfiguration::getName)
                .containsExactly("WEATHER_OBSERVATIONS", "WEATHER_DEAD_LETTER");
        StreamConfiguration obs = created.getAllValues().get(0);
        assertThat(obs.getSubjects()).containsExactly("weather.observations.>");
        assertThat(obs.getRetentionPolicy()).isEqualTo(RetentionPolicy.Limits);
        assertThat(obs.getStorageType()).isEqualTo(StorageType.File);
        assertThat(obs.getMaxAge()).isEqualTo(Duration.ofDays(30));

        verify(events).publishEvent(new JetStreamBootstrapCompleteEvent(2));
    }

    @Test
    void otherApiErrorsPropagate() throws Exception {
        JetStreamApiException denied = apiError(10003);
        when(jsm.getStreamInfo(anyString())).thenThrow(denied);

        assertThatThrownBy(() -> bootstrapper.run(new DefaultApplicationArguments())).isSameAs(denied);
        verify(jsm, never()).addStream(any());
        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    void matchingStreamIsLeftAlone() throws Exception {
        JetStreamStreamsProperties.StreamSpec spec = streams.getStreams().getObservations();
        StreamInfo info = existing(JetStreamBootstrapper.toStreamConfig(spec));
        when(jsm.getStreamInfo("WEATHER_OBSERVATIONS")).thenReturn(info);

        bootstrapper.ensureStream(spec);

        verify(jsm, never()).addStream(any());
    }

    @Test
    void mismatchFailsWhenConfiguredTo() throws Exception {
        bootstrap.setFailOnMismatch(true);
        JetStreamStreamsProperties.StreamSpec spec = streams.getStreams().getObservations();
        StreamConfiguration drifted = StreamConfiguration.builder()
                .name("WEATHER_OBSERVATIONS")
                .subjects("weather.obs.>")
                .retentionPolicy(RetentionPolicy.WorkQueue)
                .storageType(StorageType.File)
                .maxAge(Duration.ofDays(30))
                .replicas(1)
                .build();
        StreamInfo info = existing(drifted);
        when(jsm.getStreamInfo("WEATHER_OBSERVATIONS")).thenReturn(info);

        assertThatThrownBy(() -> bootstrapper.ensureStream(spec))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("retentionPolicy")
                .hasMessageContaining("subjects");
    }

    @Test
    void mismatchOnlyWarnsByDefault() throws Exception {
        JetStreamStreamsProperties.StreamSpec spec = streams.getStreams().getDeadLetter();
        StreamConfiguration drifted = StreamConfiguration.builder()
                .name("WEATHER_DEAD_LETTER")
                .subjects("weather.deadletter.>")
                .storageType(StorageType.Memory)
                .maxAge(Duration.ofDays(1))
                .build();
        StreamInfo info = existing(drifted);
        when(jsm.getStreamInfo("WEATHER_DEAD_LETTER")).thenReturn(info);

        bootstrapper.ensureStream(spec);

        verify(jsm, never()).addStream(any());
    }

    @Test
    void streamKeysLimitWhatIsBootstrapped() throws Exception {
        bootstrap.setStreamKeys(List.of("Dead-Letter"));
        JetStreamApiException notFound = apiError(JetStreamBootstrapper.JS_STREAM_NOT_FOUND_ERR);
        when(jsm.getStreamInfo(anyString())).thenThrow(notFound);

        bootstrapper.run(new DefaultApplicationArguments());

        ArgumentCaptor<StreamConfiguration> created = ArgumentCaptor.forClass(StreamConfiguration.class);
        verify(jsm).addStream(created.capture());
        assertThat(created.getValue().getName()).isEqualTo("WEATHER_DEAD_LETTER");
        verify(events).publishEvent(new JetStreamBootstrapCompleteEvent(1));
    }

    @Test
    void unknownStreamKeyIsRejected() {
        bootstrap.setStreamKeys(List.of("audit"));

        assertThatThrownBy(() -> bootstrapper.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("audit");
    }

    @Test
    void policyNamesAreParsedLeniently() {
        assertThat(JetStreamBootstrapper.parseRetentionPolicy(null)).isEqualTo(RetentionPolicy.Limits);
        assertThat(JetStreamBootstrapper.parseRetentionPolicy(" work-queue ")).isEqualTo(RetentionPolicy.WorkQueue);
        assertThat(JetStreamBootstrapper.parseStorageType("MEMORY")).isEqualTo(StorageType.Memory);
        assertThatThrownBy(() -> JetStreamBootstrapper.parseStorageType("tape"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void streamWithoutMaxAgeIsAConfigurationError() {
        JetStreamStreamsProperties.StreamSpec spec = new JetStreamStreamsProperties.StreamSpec();
        spec.setName("X");
        spec.setSubjects(List.of("x.>"));

        assertThatThrownBy(() -> JetStreamBootstrapper.toStreamConfig(spec))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("maxAge");
    }
}
