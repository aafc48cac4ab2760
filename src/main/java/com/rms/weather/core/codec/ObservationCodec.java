package com.rms.weather.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.weather.core.model.Observation;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * =====================================================================
 * ObservationCodec
 * =====================================================================
 *
 * Turns a raw stream message into a validated {@link Observation}.
 *
 * MESSAGE FORMAT
 * --------------
 * A UTF-8 JSON object:
 * <pre>
 * {"station_id": "USR0000WDDG", "date": "2021-07-04", "name": "...", "tmax": 344, "tmin": 120}
 * </pre>
 *
 *  - station_id : required, non-blank string (trimmed)
 *  - date       : required, ISO calendar date (yyyy-MM-dd)
 *  - tmax       : required, integral number or a string holding one
 *  - tmin       : optional, same rules as tmax, null allowed
 *  - name       : optional string, blank treated as absent
 *
 * Unknown fields are ignored.
 *
 * FAILURE
 * -------
 * Anything else fails with {@link ObservationDecodeException} naming the
 * violated field. Decoding is pure: no I/O, no logging.
 */
@Component
public class ObservationCodec {

    public static final String FIELD_STATION_ID = "station_id";
    public static final String FIELD_DATE = "date";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_TMAX = "tmax";
    public static final String FIELD_TMIN = "tmin";

    private static final int PREVIEW_LIMIT = 256;

    private final ObjectMapper mapper;

    public ObservationCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Observation decode(byte[] payload) throws ObservationDecodeException {
        if (payload == null || payload.length == 0) {
            throw new ObservationDecodeException(ObservationDecodeException.PAYLOAD, "empty payload", "");
        }
        String preview = preview(payload);

        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new ObservationDecodeException(ObservationDecodeException.PAYLOAD, "not valid JSON", preview, e);
        }
        if (root == null || !root.isObject()) {
            throw new ObservationDecodeException(ObservationDecodeException.PAYLOAD, "expected a JSON object", preview);
        }

        String stationId = requiredText(root, FIELD_STATION_ID, preview);
        LocalDate date = requiredDate(root, preview);
        int tmax = requiredInt(root, FIELD_TMAX, preview);
        Integer tmin = optionalInt(root, FIELD_TMIN, preview);
        String name = optionalText(root, FIELD_NAME, preview);

        return new Observation(stationId, date, name, tmin, tmax);
    }

    private static String requiredText(JsonNode root, String field, String preview) throws ObservationDecodeException {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) {
            throw new ObservationDecodeException(field, "missing", preview);
        }
        if (!n.isTextual()) {
            throw new ObservationDecodeException(field, "must be a string", preview);
        }
        String v = n.asText().trim();
        if (v.isEmpty()) {
            throw new ObservationDecodeException(field, "must not be blank", preview);
        }
        return v;
    }

    private static String optionalText(JsonNode root, String field, String preview) throws ObservationDecodeException {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) {
            return null;
        }
        if (!n.isTextual()) {
            throw new ObservationDecodeException(field, "must be a string", preview);
        }
        String v = n.asText().trim();
        return v.isEmpty() ? null : v;
    }

    private static LocalDate requiredDate(JsonNode root, String preview) throws ObservationDecodeException {
        String raw = requiredText(root, FIELD_DATE, preview);
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ObservationDecodeException(FIELD_DATE, "not an ISO calendar date: " + raw, preview, e);
        }
    }

    private static int requiredInt(JsonNode root, String field, String preview) throws ObservationDecodeException {
        Integer v = optionalInt(root, field, preview);
        if (v == null) {
            throw new ObservationDecodeException(field, "missing", preview);
        }
        return v;
    }

    private static Integer optionalInt(JsonNode root, String field, String preview) throws ObservationDecodeException {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) {
            return null;
        }
        if (n.isNumber()) {
            return exactInt(n.decimalValue(), field, preview);
        }
        if (n.isTextual()) {
            String raw = n.asText().trim();
            try {
                return exactInt(new BigDecimal(raw), field, preview);
            } catch (NumberFormatException e) {
                throw new ObservationDecodeException(field, "not numeric: " + raw, preview, e);
            }
        }
        throw new ObservationDecodeException(field, "must be numeric", preview);
    }

    private static int exactInt(BigDecimal value, String field, String preview) throws ObservationDecodeException {
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new ObservationDecodeException(field, "must be a whole number in int range: " + value, preview, e);
        }
    }

    private static String preview(byte[] payload) {
        int len = Math.min(payload.length, PREVIEW_LIMIT);
        String s = new String(payload, 0, len, StandardCharsets.UTF_8);
        return payload.length > PREVIEW_LIMIT ? s + "..." : s;
    }
}
