package com.herzen.progress.bitmap;

import com.herzen.progress.domain.DomainModels.ProgressKey;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Fast shared key-value store holding per-learner progress. Every operation touches a single
 * key and is atomic for that key; there are no multi-key transactions.
 * <p>
 * Implementations signal an unreachable store with a {@code CACHE_UNAVAILABLE}
 * {@link com.herzen.progress.domain.ProgressEngineException}; an absent key is reported as an
 * empty {@link Optional}, never as an error.
 */
public interface ProgressCacheClient {

    Optional<byte[]> getBitmap(ProgressKey key);

    /** Stores {@code bitmap} unless the key already has one; returns the bitmap now cached. */
    byte[] putBitmapIfAbsent(ProgressKey key, byte[] bitmap);

    /** Sets the bit and returns whether it was already set before this call. */
    boolean setBit(ProgressKey key, int position);

    Optional<Map<String, Integer>> getBestScores(ProgressKey key);

    Map<String, Integer> putBestScoresIfAbsent(ProgressKey key, Map<String, Integer> bestScores);

    /**
     * Stores {@code max(previous, score)} for the lesson and returns the previous value, or an
     * empty result when the lesson had no record.
     */
    OptionalInt raiseBestScore(ProgressKey key, String lessonId, int score);

    /**
     * Puts back {@code previous} (or removes the record when empty) only if the lesson still holds
     * {@code expected}; returns whether anything changed.
     */
    boolean restoreBestScore(ProgressKey key, String lessonId, int expected, OptionalInt previous);

    void markDirty(ProgressKey key);

    /** Removes and returns up to {@code limit} dirty keys. */
    List<ProgressKey> popDirty(int limit);

    long dirtyCount();
}
