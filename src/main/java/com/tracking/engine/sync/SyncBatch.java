package com.tracking.engine.sync;

import java.util.List;

/**
 * Records selected for one upload, with the request body already rendered.
 * The same batch is resent on every retry.
 */
public record SyncBatch(List<Long> recordIds, String body) {

    public SyncBatch {
        recordIds = List.copyOf(recordIds);
    }

    public int size() {
        return recordIds.size();
    }
}
