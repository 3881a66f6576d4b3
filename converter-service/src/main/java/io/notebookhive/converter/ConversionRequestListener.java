package io.notebookhive.converter;

import io.notebookhive.bus.BusMessageCodec;
import io.notebookhive.bus.MalformedMessageException;
import io.notebookhive.bus.message.ConversionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

@Component
class ConversionRequestListener {

  private static final Logger log = LoggerFactory.getLogger(ConversionRequestListener.class);

  private final ConversionWorker worker;
  private final BusMessageCodec codec;

  ConversionRequestListener(ConversionWorker worker, BusMessageCodec codec) {
    this.worker = worker;
    this.codec = codec;
  }

  @RabbitListener(queues = "#{converterRequestQueue}", concurrency = "1")
  public void onRequest(Message message) {
    ConversionRequest request;
    try {
      request = codec.decode(message, ConversionRequest.class);
    } catch (MalformedMessageException ex) {
      log.warn("Discarding undecodable conversion request (messageId={}): {}",
          message.getMessageProperties().getMessageId(), ex.getMessage());
      return;
    }
    try {
      MDC.put("correlation_id", request.correlationId());
      if (request.jobId() != null) {
        MDC.put("job_id", request.jobId());
      }
      worker.process(request);
    } finally {
      MDC.clear();
    }
  }
}
