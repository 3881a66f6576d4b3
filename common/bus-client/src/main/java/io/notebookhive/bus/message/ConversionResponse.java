package io.notebookhive.bus.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

/**
 * Correlated answer of a converter worker. A success always carries artifact bytes and a mime type;
 * a failure always carries a reason.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversionResponse(String correlationId,
                                 String jobId,
                                 int attempt,
                                 ConversionStatus status,
                                 byte[] artifact,
                                 String mimeType,
                                 String error) {

    public ConversionResponse {
        correlationId = MessageSupport.requireText(correlationId, "correlationId");
        status = Objects.requireNonNull(status, "status");
        attempt = Math.max(attempt, 1);
        if (status == ConversionStatus.SUCCESS) {
            if (artifact == null || artifact.length == 0) {
                throw new IllegalArgumentException("successful response must carry an artifact");
            }
            mimeType = MessageSupport.requireText(mimeType, "mimeType");
            error = null;
        } else {
            artifact = null;
            mimeType = null;
            error = MessageSupport.textOrDefault(error, "conversion failed without a reason");
        }
    }

    public static ConversionResponse success(ConversionRequest request, byte[] artifact, String mimeType) {
        Objects.requireNonNull(request, "request");
        return new ConversionResponse(request.correlationId(), request.jobId(), request.attempt(),
            ConversionStatus.SUCCESS, artifact, mimeType, null);
    }

    public static ConversionResponse failure(ConversionRequest request, String reason) {
        Objects.requireNonNull(request, "request");
        return new ConversionResponse(request.correlationId(), request.jobId(), request.attempt(),
            ConversionStatus.FAILURE, null, null, reason);
    }

    @JsonIgnore
    public boolean succeeded() {
        return status == ConversionStatus.SUCCESS;
    }
}
