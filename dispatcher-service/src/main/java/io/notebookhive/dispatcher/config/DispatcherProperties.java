package io.notebookhive.dispatcher.config;

import io.notebookhive.topology.DiagramKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Dispatcher tuning. {@code sweepIntervalMs} is also read directly by the deadline sweeper's
 * {@code @Scheduled} expression.
 */
@Validated
@ConfigurationProperties(prefix = "notebookhive.dispatcher")
public record DispatcherProperties(@DefaultValue("3") @Min(1) int retryLimit,
                                   @DefaultValue("2m") @NotNull Duration deadline,
                                   @DefaultValue("1000") @Min(10) long sweepIntervalMs,
                                   @DefaultValue("1024") @Min(0) int finalizedJobMemory,
                                   Map<DiagramKind, String> outputFormats,
                                   @Valid @DefaultValue Kernel kernel) {

    public static final String DEFAULT_OUTPUT_FORMAT = "png";

    public DispatcherProperties {
        Map<DiagramKind, String> formats = new EnumMap<>(DiagramKind.class);
        if (outputFormats != null) {
            outputFormats.forEach((kind, format) -> {
                if (kind != null && format != null && !format.isBlank()) {
                    formats.put(kind, format.trim());
                }
            });
        }
        outputFormats = Map.copyOf(formats);
    }

    public String outputFormat(DiagramKind kind) {
        return outputFormats.getOrDefault(kind, DEFAULT_OUTPUT_FORMAT);
    }

    /**
     * Optional kernel collaborator that executes code cells. Disabled while {@code baseUrl} is unset.
     */
    public record Kernel(URI baseUrl,
                         @DefaultValue("60s") @NotNull Duration timeout) {

        public boolean enabled() {
            return baseUrl != null;
        }
    }
}
