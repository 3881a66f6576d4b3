package io.notebookhive.dispatcher.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DeadlineSweeper {
    private static final Logger log = LoggerFactory.getLogger(DeadlineSweeper.class);

    private final NotebookDispatcher dispatcher;

    public DeadlineSweeper(NotebookDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Scheduled(fixedDelayString = "${notebookhive.dispatcher.sweep-interval-ms:1000}")
    public void sweep() {
        int expired = dispatcher.sweepDeadlines();
        if (expired > 0) {
            log.debug("deadline sweep finalized {} job(s)", expired);
        }
    }
}
