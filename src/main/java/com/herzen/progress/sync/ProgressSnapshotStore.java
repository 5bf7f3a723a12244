package com.herzen.progress.sync;

import com.herzen.progress.sync.SyncModels.ProgressSnapshot;

import java.util.Optional;

/**
 * Durable, authoritative backup of cached progress. Upserts overwrite with the current state,
 * so repeating one is harmless.
 */
public interface ProgressSnapshotStore {

    Optional<ProgressSnapshot> find(String learnerId, String subjectId);

    void upsert(ProgressSnapshot snapshot);
}
