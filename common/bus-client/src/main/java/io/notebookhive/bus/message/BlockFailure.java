package io.notebookhive.bus.message;

import io.notebookhive.topology.DiagramKind;

public record BlockFailure(int blockIndex,
                           String correlationId,
                           DiagramKind kind,
                           int attempts,
                           String reason) {
}
