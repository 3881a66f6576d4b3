package io.notebookhive.bus.spring;

import io.notebookhive.bus.PublishRetryPolicy;
import io.notebookhive.topology.BusTopology;
import io.notebookhive.topology.DiagramKind;
import io.notebookhive.topology.TopologyDefaults;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "notebookhive.bus")
public class BusClientProperties {

    @NotBlank
    private String exchange = TopologyDefaults.EXCHANGE;

    private boolean verifyQueues = true;

    @Valid
    private final Subjects subjects = new Subjects();

    @Valid
    private final Publish publish = new Publish();

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public boolean isVerifyQueues() {
        return verifyQueues;
    }

    public void setVerifyQueues(boolean verifyQueues) {
        this.verifyQueues = verifyQueues;
    }

    public Subjects getSubjects() {
        return subjects;
    }

    public Publish getPublish() {
        return publish;
    }

    public BusTopology toTopology() {
        return new BusTopology(
            exchange,
            Map.of(DiagramKind.DRAWIO, subjects.getDrawioRequest(),
                DiagramKind.PLANTUML, subjects.getPlantumlRequest()),
            Map.of(DiagramKind.DRAWIO, subjects.getDrawioResponse(),
                DiagramKind.PLANTUML, subjects.getPlantumlResponse()),
            subjects.getNotebookRequest(),
            subjects.getNotebookResult());
    }

    public static class Subjects {

        @NotBlank
        private String drawioRequest = TopologyDefaults.DRAWIO_REQUEST;
        @NotBlank
        private String drawioResponse = TopologyDefaults.DRAWIO_RESPONSE;
        @NotBlank
        private String plantumlRequest = TopologyDefaults.PLANTUML_REQUEST;
        @NotBlank
        private String plantumlResponse = TopologyDefaults.PLANTUML_RESPONSE;
        @NotBlank
        private String notebookRequest = TopologyDefaults.NOTEBOOK_REQUEST;
        @NotBlank
        private String notebookResult = TopologyDefaults.NOTEBOOK_RESULT;

        public String getDrawioRequest() {
            return drawioRequest;
        }

        public void setDrawioRequest(String drawioRequest) {
            this.drawioRequest = drawioRequest;
        }

        public String getDrawioResponse() {
            return drawioResponse;
        }

        public void setDrawioResponse(String drawioResponse) {
            this.drawioResponse = drawioResponse;
        }

        public String getPlantumlRequest() {
            return plantumlRequest;
        }

        public void setPlantumlRequest(String plantumlRequest) {
            this.plantumlRequest = plantumlRequest;
        }

        public String getPlantumlResponse() {
            return plantumlResponse;
        }

        public void setPlantumlResponse(String plantumlResponse) {
            this.plantumlResponse = plantumlResponse;
        }

        public String getNotebookRequest() {
            return notebookRequest;
        }

        public void setNotebookRequest(String notebookRequest) {
            this.notebookRequest = notebookRequest;
        }

        public String getNotebookResult() {
            return notebookResult;
        }

        public void setNotebookResult(String notebookResult) {
            this.notebookResult = notebookResult;
        }
    }

    public static class Publish {

        @Min(1)
        private int maxAttempts = 5;
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(200);
        @DecimalMin("1.0")
        private double multiplier = 2.0;
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(5);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public PublishRetryPolicy toPolicy() {
            return new PublishRetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff);
        }
    }
}
