package org.logkeeper.ingest.api.storage;

import java.util.List;

/**
 * Outcome of a batch upsert.
 *
 * @param upserted The number of rows written or confirmed (a no-op overwrite still counts).
 * @param rejected Rows refused individually; the batch as a whole succeeded.
 */
public record UpsertResult(int upserted, List<RejectedRow> rejected) {

    public UpsertResult {
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }

    public static UpsertResult of(int upserted) {
        return new UpsertResult(upserted, List.of());
    }
}
