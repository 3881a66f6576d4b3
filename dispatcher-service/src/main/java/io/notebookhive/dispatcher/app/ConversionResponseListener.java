package io.notebookhive.dispatcher.app;

import io.notebookhive.bus.BusMessageCodec;
import io.notebookhive.bus.MalformedMessageException;
import io.notebookhive.bus.message.ConversionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Consumes the response subjects of every diagram kind.
 */
@Component
public class ConversionResponseListener {
    private static final Logger log = LoggerFactory.getLogger(ConversionResponseListener.class);

    private final NotebookDispatcher dispatcher;
    private final BusMessageCodec codec;
    private final DispatcherMetrics metrics;

    public ConversionResponseListener(NotebookDispatcher dispatcher, BusMessageCodec codec, DispatcherMetrics metrics) {
        this.dispatcher = dispatcher;
        this.codec = codec;
        this.metrics = metrics;
    }

    @RabbitListener(queues = "#{dispatcherResponseQueues}")
    public void onResponse(Message message) {
        ConversionResponse response;
        try {
            response = codec.decode(message, ConversionResponse.class);
        } catch (MalformedMessageException ex) {
            log.warn("Discarding undecodable conversion response (correlationId={}): {}",
                message.getMessageProperties().getCorrelationId(), ex.getMessage());
            metrics.responseDiscarded();
            return;
        }
        try {
            MDC.put("correlation_id", response.correlationId());
            if (response.jobId() != null) {
                MDC.put("job_id", response.jobId());
            }
            dispatcher.onResponse(response);
        } finally {
            MDC.clear();
        }
    }
}
