package com.herzen.progress.sync;

import com.herzen.progress.bitmap.CompletionBitmap;
import com.herzen.progress.bitmap.ProgressCacheClient;
import com.herzen.progress.domain.DomainModels.ProgressKey;
import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.sync.SyncModels.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

@Component
public class CacheWarmer {
    private static final Logger log = LoggerFactory.getLogger(CacheWarmer.class);

    private final ProgressCacheClient cache;
    private final ProgressSnapshotStore snapshots;
    private final SnapshotCodec codec;

    public CacheWarmer(ProgressCacheClient cache, ProgressSnapshotStore snapshots, SnapshotCodec codec) {
        this.cache = cache;
        this.snapshots = snapshots;
        this.codec = codec;
    }

    public byte[] warmBitmap(ProgressKey key) {
        byte[] durable = snapshots.find(key.learnerId(), key.subjectId())
                .map(codec::bitmap)
                .orElseGet(CompletionBitmap::empty);
        byte[] cached = cache.putBitmapIfAbsent(key, durable);
        log.info("Warmed bitmap for {} ({} lessons passed)", key, CompletionBitmap.cardinality(cached));
        return cached;
    }

    public Map<String, Integer> warmBestScores(ProgressKey key) {
        Map<String, Integer> durable = snapshots.find(key.learnerId(), key.subjectId())
                .map(codec::bestScores)
                .orElse(Map.of());
        Map<String, Integer> cached = cache.putBestScoresIfAbsent(key, durable);
        log.info("Warmed best scores for {} ({} lessons)", key, cached.size());
        return cached;
    }

    /** Reads the durable bitmap without touching the cache; used while the cache is unreachable. */
    public byte[] readThroughBitmap(ProgressKey key) {
        return readSnapshot(key).map(codec::bitmap).orElseGet(CompletionBitmap::empty);
    }

    public Map<String, Integer> readThroughBestScores(ProgressKey key) {
        return readSnapshot(key).map(codec::bestScores).orElse(Map.of());
    }

    private Optional<ProgressSnapshot> readSnapshot(ProgressKey key) {
        try {
            return snapshots.find(key.learnerId(), key.subjectId());
        } catch (DataAccessException e) {
            throw ProgressEngineException.cacheUnavailable("Progress cache and snapshot store are both unavailable for " + key, e);
        }
    }
}
