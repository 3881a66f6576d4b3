package io.notebookhive.bus.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.notebookhive.topology.DiagramKind;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Wire representation of one diagram block sent to a converter worker.
 *
 * <p>{@code payload} travels as base64 in JSON; {@code encoding} names the charset of the diagram
 * source inside it. A missing {@code outputFormat} leaves the choice to the worker's configured
 * default. {@code attempt} starts at 1 and grows with every re-publish of the same
 * correlation id.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversionRequest(String correlationId,
                                String jobId,
                                DiagramKind kind,
                                byte[] payload,
                                String encoding,
                                String outputFormat,
                                String replyTo,
                                int attempt) {

    public static final String DEFAULT_ENCODING = StandardCharsets.UTF_8.name();

    public ConversionRequest {
        correlationId = MessageSupport.requireText(correlationId, "correlationId");
        kind = Objects.requireNonNull(kind, "kind");
        payload = payload == null ? new byte[0] : payload;
        encoding = MessageSupport.textOrDefault(encoding, DEFAULT_ENCODING);
        outputFormat = MessageSupport.textOrNull(outputFormat);
        replyTo = MessageSupport.textOrNull(replyTo);
        attempt = Math.max(attempt, 1);
    }

    public static ConversionRequest forSource(String correlationId,
                                              String jobId,
                                              DiagramKind kind,
                                              String source,
                                              String outputFormat,
                                              String replyTo) {
        Objects.requireNonNull(source, "source");
        return new ConversionRequest(correlationId, jobId, kind, source.getBytes(StandardCharsets.UTF_8),
            DEFAULT_ENCODING, outputFormat, replyTo, 1);
    }

    /**
     * Decodes the payload with the declared charset.
     *
     * @throws java.nio.charset.IllegalCharsetNameException if the charset name is malformed
     * @throws java.nio.charset.UnsupportedCharsetException if the charset is not available
     */
    @JsonIgnore
    public String payloadText() {
        return new String(payload, Charset.forName(encoding));
    }

    public ConversionRequest withAttempt(int nextAttempt) {
        return new ConversionRequest(correlationId, jobId, kind, payload, encoding, outputFormat, replyTo,
            nextAttempt);
    }
}
