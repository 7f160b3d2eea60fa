package org.leafline.client;

import org.leafline.model.dto.request.ReadingProgressRequest;

/**
 * Destination for reading-position saves issued by {@link ReadingPositionTracker}.
 */
public interface ProgressSink {

    /** Blocking save. Failures are thrown to the caller. */
    void save(ReadingProgressRequest request);

    /**
     * Best-effort save that returns immediately. Used as the last-chance flush when the
     * reader is hidden or closed; failures are only logged.
     */
    void saveAsync(ReadingProgressRequest request);
}
