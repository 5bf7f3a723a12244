package com.herzen.progress.sync;

import java.time.Instant;

public class SyncModels {
    /** Durable record for one (learner, subject) pair. */
    public record ProgressSnapshot(String learnerId,
                                   String subjectId,
                                   String completionBitmapBase64,
                                   String bestScoresJson,
                                   Instant lastSyncedAt) {}

    public record SyncSummary(boolean leaseAcquired, int synced, int failed, long remaining) {
        public static SyncSummary skipped(long remaining) {
            return new SyncSummary(false, 0, 0, remaining);
        }
    }
}
