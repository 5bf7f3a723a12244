package com.herzen.progress.bitmap;

import com.herzen.progress.domain.DomainModels.ProgressKey;
import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.domain.ProgressEngineException.ErrorKind;
import com.herzen.progress.sync.CacheWarmer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

@Service
public class BitmapStore {
    private static final Logger log = LoggerFactory.getLogger(BitmapStore.class);

    private final ProgressCacheClient cache;
    private final CacheWarmer warmer;

    public BitmapStore(ProgressCacheClient cache, CacheWarmer warmer) {
        this.cache = cache;
        this.warmer = warmer;
    }

    public boolean checkBit(ProgressKey key, int position) {
        return CompletionBitmap.isSet(getBitmap(key), position);
    }

    public byte[] getBitmap(ProgressKey key) {
        try {
            Optional<byte[]> cached = cache.getBitmap(key);
            if (cached.isPresent()) {
                log.debug("Cache hit for bitmap {}", key);
                return cached.get();
            }
            log.debug("Cache miss for bitmap {}, warming from snapshot", key);
            return warmer.warmBitmap(key);
        } catch (ProgressEngineException e) {
            if (e.kind() != ErrorKind.CACHE_UNAVAILABLE) throw e;
            log.warn("Progress cache unavailable for {}, reading snapshot directly", key);
            return warmer.readThroughBitmap(key);
        }
    }

    /** Sets the lesson bit; returns {@code true} when it was already set (a replay). */
    public boolean setBit(ProgressKey key, int position) {
        if (cache.getBitmap(key).isEmpty()) {
            warmer.warmBitmap(key);
        }
        boolean wasAlreadySet = cache.setBit(key, position);
        markDirty(key);
        return wasAlreadySet;
    }

    public void markDirty(ProgressKey key) {
        cache.markDirty(key);
    }

    public Map<String, Integer> bestScores(ProgressKey key) {
        try {
            Optional<Map<String, Integer>> cached = cache.getBestScores(key);
            return cached.isPresent() ? cached.get() : warmer.warmBestScores(key);
        } catch (ProgressEngineException e) {
            if (e.kind() != ErrorKind.CACHE_UNAVAILABLE) throw e;
            log.warn("Progress cache unavailable for {}, reading best scores from snapshot", key);
            return warmer.readThroughBestScores(key);
        }
    }

    public OptionalInt bestScore(ProgressKey key, String lessonId) {
        Integer score = bestScores(key).get(lessonId);
        return score == null ? OptionalInt.empty() : OptionalInt.of(score);
    }

    /**
     * Records {@code score} if it beats the stored best and returns the best score held before
     * this call. The compare-and-store is a single atomic cache operation.
     */
    public OptionalInt raiseBestScore(ProgressKey key, String lessonId, int score) {
        if (cache.getBestScores(key).isEmpty()) {
            warmer.warmBestScores(key);
        }
        OptionalInt previous = cache.raiseBestScore(key, lessonId, score);
        markDirty(key);
        return previous;
    }

    /** Undoes a {@link #raiseBestScore} whose reward could not be paid, unless a later attempt moved it. */
    public void restoreBestScore(ProgressKey key, String lessonId, int raisedTo, OptionalInt previous) {
        if (cache.restoreBestScore(key, lessonId, raisedTo, previous)) {
            markDirty(key);
            log.info("Restored best score of lesson {} for {} after a failed reward", lessonId, key);
        }
    }
}
