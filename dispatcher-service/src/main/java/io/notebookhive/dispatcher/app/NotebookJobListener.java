package io.notebookhive.dispatcher.app;

import io.notebookhive.bus.BusMessageCodec;
import io.notebookhive.bus.MalformedMessageException;
import io.notebookhive.bus.message.ProcessNotebookRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

@Component
public class NotebookJobListener {
    private static final Logger log = LoggerFactory.getLogger(NotebookJobListener.class);

    private final NotebookDispatcher dispatcher;
    private final BusMessageCodec codec;

    public NotebookJobListener(NotebookDispatcher dispatcher, BusMessageCodec codec) {
        this.dispatcher = dispatcher;
        this.codec = codec;
    }

    @RabbitListener(queues = "#{dispatcherRequestQueue}")
    public void onRequest(Message message) {
        ProcessNotebookRequest request;
        try {
            request = codec.decode(message, ProcessNotebookRequest.class);
        } catch (MalformedMessageException ex) {
            log.warn("Discarding undecodable notebook request (messageId={}): {}",
                message.getMessageProperties().getMessageId(), ex.getMessage());
            return;
        }
        try {
            if (request.jobId() != null) {
                MDC.put("job_id", request.jobId());
            }
            dispatcher.submit(request);
        } finally {
            MDC.clear();
        }
    }
}
