package io.notebookhive.dispatcher.domain;

import java.util.Objects;

/**
 * What a converter answered for a block.
 */
public record BlockResult(boolean succeeded, byte[] artifact, String mimeType, String reason) {

    public static BlockResult success(byte[] artifact, String mimeType) {
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(mimeType, "mimeType");
        return new BlockResult(true, artifact, mimeType, null);
    }

    public static BlockResult failure(String reason) {
        return new BlockResult(false, null, null, reason == null ? "conversion failed" : reason);
    }
}
