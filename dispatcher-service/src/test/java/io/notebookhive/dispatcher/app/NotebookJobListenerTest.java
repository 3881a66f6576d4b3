package io.notebookhive.dispatcher.app;

import static io.notebookhive.dispatcher.Notebooks.markdownCell;
import static io.notebookhive.dispatcher.Notebooks.notebook;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notebookhive.bus.BusMessageCodec;
import io.notebookhive.bus.message.ProcessNotebookRequest;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

@ExtendWith(MockitoExtension.class)
class NotebookJobListenerTest {

    private final BusMessageCodec codec = new BusMessageCodec(new ObjectMapper());

    @Mock
    private NotebookDispatcher dispatcher;

    @Test
    void submitsDecodedRequestsWithJobContext() {
        AtomicReference<String> jobInMdc = new AtomicReference<>();
        when(dispatcher.submit(any())).thenAnswer(invocation -> {
            jobInMdc.set(MDC.get("job_id"));
            return "job-9";
        });
        NotebookJobListener listener = new NotebookJobListener(dispatcher, codec);
        ProcessNotebookRequest request = new ProcessNotebookRequest("job-9", notebook(markdownCell("hi")),
            "notebooks/intro.ipynb", null, true);

        listener.onRequest(new Message(codec.encode(request), new MessageProperties()));

        ArgumentCaptor<ProcessNotebookRequest> captor = ArgumentCaptor.forClass(ProcessNotebookRequest.class);
        verify(dispatcher).submit(captor.capture());
        assertThat(captor.getValue().notebookPath()).isEqualTo("notebooks/intro.ipynb");
        assertThat(captor.getValue().execute()).isTrue();
        assertThat(captor.getValue().notebook().at("/cells/0/source").asText()).isEqualTo("hi");
        assertThat(jobInMdc).hasValue("job-9");
        assertThat(MDC.get("job_id")).isNull();
    }

    @Test
    void discardsUndecodableRequests() {
        NotebookJobListener listener = new NotebookJobListener(dispatcher, codec);

        listener.onRequest(new Message("{".getBytes(StandardCharsets.UTF_8), new MessageProperties()));

        verify(dispatcher, never()).submit(any());
    }
}
