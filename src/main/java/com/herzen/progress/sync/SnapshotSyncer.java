package com.herzen.progress.sync;

import com.herzen.progress.bitmap.ProgressCacheClient;
import com.herzen.progress.domain.DomainModels.ProgressKey;
import com.herzen.progress.repository.SyncLeaseJdbcRepository;
import com.herzen.progress.sync.SyncModels.ProgressSnapshot;
import com.herzen.progress.sync.SyncModels.SyncSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class SnapshotSyncer {
    private static final Logger log = LoggerFactory.getLogger(SnapshotSyncer.class);
    static final String LEASE_NAME = "progress-snapshot-sync";

    private final ProgressCacheClient cache;
    private final ProgressSnapshotStore snapshots;
    private final SnapshotCodec codec;
    private final SyncLeaseJdbcRepository leases;
    private final boolean enabled;
    private final int batchSize;
    private final long leaseTtlMs;
    private final String owner = "syncer-" + UUID.randomUUID();

    public SnapshotSyncer(ProgressCacheClient cache,
                          ProgressSnapshotStore snapshots,
                          SnapshotCodec codec,
                          SyncLeaseJdbcRepository leases,
                          @Value("${progress.sync.enabled:true}") boolean enabled,
                          @Value("${progress.sync.batch-size:100}") int batchSize,
                          @Value("${progress.sync.lease-ttl-ms:25000}") long leaseTtlMs) {
        this.cache = cache;
        this.snapshots = snapshots;
        this.codec = codec;
        this.leases = leases;
        this.enabled = enabled;
        this.batchSize = Math.max(1, batchSize);
        this.leaseTtlMs = leaseTtlMs;
    }

    @Scheduled(fixedDelayString = "${progress.sync.interval-ms:30000}",
            initialDelayString = "${progress.sync.initial-delay-ms:30000}")
    public void scheduledSync() {
        if (!enabled) return;
        SyncSummary summary = syncPending();
        if (summary.synced() > 0 || summary.failed() > 0) {
            log.info("Snapshot sync: synced={}, failed={}, remaining={}", summary.synced(), summary.failed(), summary.remaining());
        }
    }

    public SyncSummary syncPending() {
        Instant now = Instant.now();
        if (!leases.tryClaim(LEASE_NAME, owner, now, now.plusMillis(leaseTtlMs))) {
            log.debug("Snapshot sync lease held by another worker, skipping this cycle");
            return SyncSummary.skipped(cache.dirtyCount());
        }

        int synced = 0;
        int failed = 0;
        try {
            List<ProgressKey> batch = cache.popDirty(batchSize);
            for (int i = 0; i < batch.size(); i++) {
                if (Thread.currentThread().isInterrupted()) {
                    batch.subList(i, batch.size()).forEach(cache::markDirty);
                    log.info("Snapshot sync interrupted, {} keys left dirty", batch.size() - i);
                    break;
                }
                ProgressKey key = batch.get(i);
                try {
                    syncKey(key);
                    synced++;
                } catch (RuntimeException e) {
                    failed++;
                    cache.markDirty(key);
                    log.warn("Failed to sync progress snapshot for {}: {}", key, e.getMessage());
                }
            }
        } finally {
            leases.release(LEASE_NAME, owner, Instant.now());
        }
        return new SyncSummary(true, synced, failed, cache.dirtyCount());
    }

    private void syncKey(ProgressKey key) {
        Optional<byte[]> bitmap = cache.getBitmap(key);
        Optional<Map<String, Integer>> scores = cache.getBestScores(key);
        if (bitmap.isEmpty() && scores.isEmpty()) {
            log.debug("Nothing cached for dirty key {}, skipping", key);
            return;
        }

        Optional<ProgressSnapshot> existing = bitmap.isPresent() && scores.isPresent()
                ? Optional.empty()
                : snapshots.find(key.learnerId(), key.subjectId());
        byte[] bits = bitmap.orElseGet(() -> existing.map(codec::bitmap).orElse(null));
        Map<String, Integer> best = scores.orElseGet(() -> existing.map(codec::bestScores).orElse(Map.of()));

        snapshots.upsert(codec.toSnapshot(key, bits, best, Instant.now()));
    }
}
