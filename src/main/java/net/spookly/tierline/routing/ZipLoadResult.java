package net.spookly.tierline.routing;

import java.time.Instant;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Outcome of a ZIP directory load; failures leave the previous snapshot in place.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ZipLoadResult {
    private final boolean ok;
    private final Instant attemptedAt;
    private final int zipCount;
    private final int skippedRows;
    private final int conflicts;
    private final String error;

    static ZipLoadResult success(Instant attemptedAt, ZipIndex index) {
        return new ZipLoadResult(true, attemptedAt, index.size(), index.skippedRows(), index.conflicts(), null);
    }

    static ZipLoadResult failure(Instant attemptedAt, int retainedZipCount, String error) {
        return new ZipLoadResult(false, attemptedAt, retainedZipCount, 0, 0, error);
    }
}
