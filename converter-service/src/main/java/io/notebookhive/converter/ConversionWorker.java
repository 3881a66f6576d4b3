package io.notebookhive.converter;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.notebookhive.bus.BusClient;
import io.notebookhive.bus.message.ConversionRequest;
import io.notebookhive.bus.message.ConversionResponse;
import io.notebookhive.converter.render.DiagramRenderer;
import io.notebookhive.converter.render.RenderException;
import io.notebookhive.converter.render.RenderedArtifact;
import io.notebookhive.topology.BusTopology;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders one request at a time and answers with a correlated response. Every problem with the
 * request or the engine becomes a failure response; only the publish itself can throw.
 */
public class ConversionWorker {

  private static final Logger log = LoggerFactory.getLogger(ConversionWorker.class);

  static final String RENDER_TIMER = "notebookhive.converter.renders";

  private final DiagramRenderer renderer;
  private final BusClient busClient;
  private final BusTopology topology;
  private final MeterRegistry meterRegistry;
  private final String defaultOutputFormat;
  private final ReentrantLock renderLock = new ReentrantLock();

  public ConversionWorker(DiagramRenderer renderer,
                          BusClient busClient,
                          BusTopology topology,
                          MeterRegistry meterRegistry,
                          String defaultOutputFormat) {
    this.renderer = Objects.requireNonNull(renderer, "renderer");
    this.busClient = Objects.requireNonNull(busClient, "busClient");
    this.topology = Objects.requireNonNull(topology, "topology");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.defaultOutputFormat = Objects.requireNonNull(defaultOutputFormat, "defaultOutputFormat");
  }

  /**
   * Converts the request and publishes the response to its reply subject.
   *
   * @throws io.notebookhive.bus.BusPublishException when the response cannot be published
   */
  public ConversionResponse process(ConversionRequest request) {
    ConversionResponse response = convert(request);
    String subject = request.replyTo() != null ? request.replyTo() : topology.responseSubject(request.kind());
    busClient.publish(subject, response, response.correlationId());
    log.debug("answered {} on {} with {}", request.correlationId(), subject, response.status());
    return response;
  }

  ConversionResponse convert(ConversionRequest request) {
    Timer.Sample sample = Timer.start(meterRegistry);
    ConversionResponse response = null;
    try {
      response = render(request);
      return response;
    } finally {
      String outcome = response != null && response.succeeded() ? "success" : "failure";
      sample.stop(Timer.builder(RENDER_TIMER)
          .description("Diagram renders by kind and outcome")
          .tag("kind", request.kind().wireName())
          .tag("outcome", outcome)
          .register(meterRegistry));
    }
  }

  private ConversionResponse render(ConversionRequest request) {
    if (request.kind() != renderer.kind()) {
      return fail(request, "this worker renders %s diagrams, not %s"
          .formatted(renderer.kind().wireName(), request.kind().wireName()));
    }
    String source;
    try {
      source = request.payloadText();
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      return fail(request, "unsupported payload encoding '" + request.encoding() + "'");
    }
    if (source.isBlank()) {
      return fail(request, "diagram source is empty");
    }
    String format = request.outputFormat() != null ? request.outputFormat() : defaultOutputFormat;

    renderLock.lock();
    try {
      RenderedArtifact artifact = renderer.render(source, format);
      log.info("rendered {} block {} as {} ({} bytes, attempt {})", request.kind().wireName(),
          request.correlationId(), artifact.format(), artifact.bytes().length, request.attempt());
      return ConversionResponse.success(request, artifact.bytes(), artifact.mimeType());
    } catch (RenderException ex) {
      return fail(request, ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("unexpected render error for {}", request.correlationId(), ex);
      return fail(request, "unexpected render error: " + ex.getMessage());
    } finally {
      renderLock.unlock();
    }
  }

  private static ConversionResponse fail(ConversionRequest request, String reason) {
    log.warn("conversion of {} failed (attempt {}): {}", request.correlationId(), request.attempt(), reason);
    return ConversionResponse.failure(request, reason);
  }
}
