package com.herzen.progress.bitmap;

import com.herzen.progress.domain.DomainModels.ProgressKey;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class InMemoryProgressCacheClient implements ProgressCacheClient {
    private final Map<ProgressKey, byte[]> bitmaps = new ConcurrentHashMap<>();
    private final Map<ProgressKey, Map<String, Integer>> bestScores = new ConcurrentHashMap<>();
    private final Set<ProgressKey> dirty = ConcurrentHashMap.newKeySet();

    @Override
    public Optional<byte[]> getBitmap(ProgressKey key) {
        byte[] bitmap = bitmaps.get(key);
        return bitmap == null ? Optional.empty() : Optional.of(bitmap.clone());
    }

    @Override
    public byte[] putBitmapIfAbsent(ProgressKey key, byte[] bitmap) {
        byte[] stored = bitmaps.computeIfAbsent(key, k -> bitmap == null ? CompletionBitmap.empty() : bitmap.clone());
        return stored.clone();
    }

    @Override
    public boolean setBit(ProgressKey key, int position) {
        AtomicBoolean wasSet = new AtomicBoolean();
        bitmaps.compute(key, (k, current) -> {
            if (CompletionBitmap.isSet(current, position)) {
                wasSet.set(true);
                return current;
            }
            return CompletionBitmap.withBit(current, position);
        });
        return wasSet.get();
    }

    @Override
    public Optional<Map<String, Integer>> getBestScores(ProgressKey key) {
        Map<String, Integer> scores = bestScores.get(key);
        return scores == null ? Optional.empty() : Optional.of(Map.copyOf(scores));
    }

    @Override
    public Map<String, Integer> putBestScoresIfAbsent(ProgressKey key, Map<String, Integer> scores) {
        Map<String, Integer> stored = bestScores.computeIfAbsent(key,
                k -> scores == null ? Map.of() : Map.copyOf(scores));
        return Map.copyOf(stored);
    }

    @Override
    public OptionalInt raiseBestScore(ProgressKey key, String lessonId, int score) {
        AtomicReference<Integer> previous = new AtomicReference<>();
        bestScores.compute(key, (k, current) -> {
            Map<String, Integer> next = current == null ? new HashMap<>() : new HashMap<>(current);
            Integer old = next.get(lessonId);
            previous.set(old);
            if (old == null || score > old) {
                next.put(lessonId, score);
            }
            return Map.copyOf(next);
        });
        Integer old = previous.get();
        return old == null ? OptionalInt.empty() : OptionalInt.of(old);
    }

    @Override
    public boolean restoreBestScore(ProgressKey key, String lessonId, int expected, OptionalInt previous) {
        AtomicBoolean restored = new AtomicBoolean();
        bestScores.computeIfPresent(key, (k, current) -> {
            Integer now = current.get(lessonId);
            if (now == null || now != expected) {
                return current;
            }
            Map<String, Integer> next = new HashMap<>(current);
            if (previous.isPresent()) {
                next.put(lessonId, previous.getAsInt());
            } else {
                next.remove(lessonId);
            }
            restored.set(true);
            return Map.copyOf(next);
        });
        return restored.get();
    }

    @Override
    public void markDirty(ProgressKey key) {
        dirty.add(key);
    }

    @Override
    public List<ProgressKey> popDirty(int limit) {
        List<ProgressKey> popped = new ArrayList<>();
        Iterator<ProgressKey> it = dirty.iterator();
        while (popped.size() < limit && it.hasNext()) {
            ProgressKey key = it.next();
            if (dirty.remove(key)) {
                popped.add(key);
            }
        }
        return popped;
    }

    @Override
    public long dirtyCount() {
        return dirty.size();
    }
}
