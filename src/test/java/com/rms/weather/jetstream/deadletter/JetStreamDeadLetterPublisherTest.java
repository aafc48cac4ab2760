package com.rms.weather.jetstream.deadletter;

import com.rms.weather.core.deadletter.DeadLetter;
import com.rms.weather.core.deadletter.DeadLetterReason;
import io.nats.client.JetStream;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JetStreamDeadLetterPublisherTest {

    private static final Instant AT = Instant.parse("2024-05-01T10:15:30Z");

    private final JetStream js = mock(JetStream.class);
    private final JetStreamDeadLetterPublisher publisher = new JetStreamDeadLetterPublisher(js, "node01");

    private static DeadLetter decodeFailure() {
        return new DeadLetter(DeadLetterReason.DECODE_FAILED, "weather.observations.p0", "WEATHER_OBSERVATIONS:42",
                "{\"tmax\":\"hot\"}".getBytes(StandardCharsets.UTF_8), "tmax", "not an integer", 0, AT);
    }

    @Test
    void publishesPayloadUnderReasonSubjectWithDedupId() throws Exception {
        PublishAck ack = mock(PublishAck.class);
        when(js.publish(anyString(), any(Headers.class), any(byte[].class), any(PublishOptions.class))).thenReturn(ack);
        DeadLetter dl = decodeFailure();

        StepVerifier.create(publisher.record(dl)).verifyComplete();

        ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
        ArgumentCaptor<PublishOptions> opts = ArgumentCaptor.forClass(PublishOptions.class);
        verify(js).publish(eq("weather.deadletter.decode-failed"), headers.capture(),
                eq(dl.payload()), opts.capture());
        assertThat(opts.getValue().getMessageId()).isEqualTo("dl-WEATHER_OBSERVATIONS:42");
        Headers h = headers.getValue();
        assertThat(h.getFirst(JetStreamDeadLetterPublisher.H_REASON)).isEqualTo("DECODE_FAILED");
        assertThat(h.getFirst(JetStreamDeadLetterPublisher.H_FIELD)).isEqualTo("tmax");
        assertThat(h.getFirst(JetStreamDeadLetterPublisher.H_NODE)).isEqualTo("node01");
        assertThat(h.getFirst(JetStreamDeadLetterPublisher.H_OCCURRED_AT)).isEqualTo("2024-05-01T10:15:30Z");
    }

    @Test
    void subjectTokenFollowsReason() {
        DeadLetter dl = new DeadLetter(DeadLetterReason.WRITE_EXHAUSTED, "s", "id", new byte[0], null, null, 5, AT);

        assertThat(JetStreamDeadLetterPublisher.subjectFor(dl)).isEqualTo("weather.deadletter.write-exhausted");
    }

    @Test
    void detailIsFlattenedAndCapped() {
        String detail = "line one\r\nline two" + "x".repeat(2000);
        DeadLetter dl = new DeadLetter(DeadLetterReason.WRITE_REJECTED, "s", "id", null, null, detail, 1, AT);

        Headers h = publisher.headersFor(dl);

        String value = h.getFirst(JetStreamDeadLetterPublisher.H_DETAIL);
        assertThat(value).doesNotContain("\r", "\n").hasSize(1024).startsWith("line one  line two");
        assertThat(h.get(JetStreamDeadLetterPublisher.H_FIELD)).isNull();
        assertThat(h.getFirst(JetStreamDeadLetterPublisher.H_ATTEMPTS)).isEqualTo("1");
    }

    @Test
    void publishFailureSurfacesAsError() throws Exception {
        when(js.publish(anyString(), any(Headers.class), any(byte[].class), any(PublishOptions.class)))
                .thenThrow(new IOException("timeout"));

        StepVerifier.create(publisher.record(decodeFailure()))
                .expectError(IOException.class)
                .verify();
    }
}
