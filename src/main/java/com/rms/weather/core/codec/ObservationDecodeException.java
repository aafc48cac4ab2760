package com.rms.weather.core.codec;

/**
 * A stream payload that is not a well-formed observation.
 *
 * <p>Carries the violated field and a bounded preview of the raw payload so the
 * consumer can log and dead-letter the message without holding on to it.</p>
 */
public class ObservationDecodeException extends Exception {

    /** Field name used when the payload as a whole is unusable. */
    public static final String PAYLOAD = "<payload>";

    private final String field;
    private final String reason;
    private final String payloadPreview;

    public ObservationDecodeException(String field, String reason, String payloadPreview, Throwable cause) {
        super(field + ": " + reason, cause);
        this.field = field;
        this.reason = reason;
        this.payloadPreview = payloadPreview;
    }

    public ObservationDecodeException(String field, String reason, String payloadPreview) {
        this(field, reason, payloadPreview, null);
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }

    public String getPayloadPreview() {
        return payloadPreview;
    }
}
