package io.notebookhive.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notebookhive.bus.BusMessageCodec;
import io.notebookhive.bus.message.ConversionRequest;
import io.notebookhive.topology.DiagramKind;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

@ExtendWith(MockitoExtension.class)
class ConversionRequestListenerTest {

  private final BusMessageCodec codec = new BusMessageCodec(new ObjectMapper());

  @Mock
  private ConversionWorker worker;

  @Test
  void decodesAndHandsRequestToWorker() {
    ConversionRequestListener listener = new ConversionRequestListener(worker, codec);
    ConversionRequest request = ConversionRequest.forSource("cid-1", "job-1", DiagramKind.DRAWIO,
        "<mxfile/>", "png", null);

    listener.onRequest(new Message(codec.encode(request), new MessageProperties()));

    ArgumentCaptor<ConversionRequest> captor = ArgumentCaptor.forClass(ConversionRequest.class);
    verify(worker).process(captor.capture());
    assertThat(captor.getValue().correlationId()).isEqualTo("cid-1");
    assertThat(captor.getValue().payloadText()).isEqualTo("<mxfile/>");
  }

  @Test
  void discardsMessagesWithoutCorrelationId() {
    ConversionRequestListener listener = new ConversionRequestListener(worker, codec);
    byte[] body = "{\"kind\":\"drawio\",\"payload\":\"\"}".getBytes(StandardCharsets.UTF_8);

    listener.onRequest(new Message(body, new MessageProperties()));
    listener.onRequest(new Message("not json".getBytes(StandardCharsets.UTF_8), new MessageProperties()));

    verify(worker, never()).process(any());
  }
}
