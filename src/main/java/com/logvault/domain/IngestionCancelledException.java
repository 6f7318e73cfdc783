package com.logvault.domain;

/**
 * Raised when a run is aborted through its {@link CancellationSignal}.
 * Not a failure of the remote API or the sink: the run stopped cleanly at a checkpoint.
 */
public class IngestionCancelledException extends IngestionException {

    private final String checkpoint;

    public IngestionCancelledException(String checkpoint, String reason) {
        super("Run cancelled at " + checkpoint + (reason != null ? ": " + reason : ""));
        this.checkpoint = checkpoint;
    }

    public IngestionCancelledException(String checkpoint, Throwable cause) {
        super("Run interrupted at " + checkpoint, cause);
        this.checkpoint = checkpoint;
    }

    public String getCheckpoint() {
        return checkpoint;
    }
}
