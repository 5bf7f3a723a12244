package com.herzen.progress;

import com.herzen.progress.bitmap.BitmapStore;
import com.herzen.progress.bitmap.ProgressCacheClient;
import com.herzen.progress.domain.DomainModels.ProgressKey;
import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.sync.CacheWarmer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BitmapStoreTest {
    private static final ProgressKey KEY = new ProgressKey("learner-1", "math");

    @Mock
    private ProgressCacheClient cache;

    @Mock
    private CacheWarmer warmer;

    @Test
    void missWarmsFromSnapshot() {
        when(cache.getBitmap(KEY)).thenReturn(Optional.empty());
        when(warmer.warmBitmap(KEY)).thenReturn(new byte[]{(byte) 0x80});

        BitmapStore store = new BitmapStore(cache, warmer);
        assertTrue(store.checkBit(KEY, 0));
        assertFalse(store.checkBit(KEY, 1));
    }

    @Test
    void readsFallBackToSnapshotWhenCacheIsDown() {
        when(cache.getBitmap(KEY)).thenThrow(ProgressEngineException.cacheUnavailable("down", null));
        when(cache.getBestScores(KEY)).thenThrow(ProgressEngineException.cacheUnavailable("down", null));
        when(warmer.readThroughBitmap(KEY)).thenReturn(new byte[]{(byte) 0x40});
        when(warmer.readThroughBestScores(KEY)).thenReturn(Map.of("l2", 3));

        BitmapStore store = new BitmapStore(cache, warmer);
        assertTrue(store.checkBit(KEY, 1));
        assertEquals(OptionalInt.of(3), store.bestScore(KEY, "l2"));
        verify(warmer, never()).warmBitmap(any());
    }

    @Test
    void writesSurfaceCacheOutages() {
        when(cache.getBitmap(KEY)).thenThrow(ProgressEngineException.cacheUnavailable("down", null));

        BitmapStore store = new BitmapStore(cache, warmer);
        ProgressEngineException e = assertThrows(ProgressEngineException.class, () -> store.setBit(KEY, 3));
        assertEquals(ProgressEngineException.ErrorKind.CACHE_UNAVAILABLE, e.kind());
        assertTrue(e.retryable());
        verify(cache, never()).markDirty(any());
    }

    @Test
    void coldWriteWarmsBeforeSettingTheBit() {
        when(cache.getBitmap(KEY)).thenReturn(Optional.empty());
        when(cache.setBit(KEY, 4)).thenReturn(false);

        BitmapStore store = new BitmapStore(cache, warmer);
        assertFalse(store.setBit(KEY, 4));

        InOrder order = inOrder(warmer, cache);
        order.verify(warmer).warmBitmap(KEY);
        order.verify(cache).setBit(KEY, 4);
        order.verify(cache).markDirty(KEY);
    }

    @Test
    void raisingBestScoreMarksTheKeyDirty() {
        when(cache.getBestScores(KEY)).thenReturn(Optional.of(Map.of("l1", 2)));
        when(cache.raiseBestScore(KEY, "l1", 4)).thenReturn(OptionalInt.of(2));

        BitmapStore store = new BitmapStore(cache, warmer);
        assertEquals(OptionalInt.of(2), store.raiseBestScore(KEY, "l1", 4));
        verify(cache).markDirty(KEY);
        verify(warmer, never()).warmBestScores(any());
    }

    @Test
    void restoringABestScoreMarksDirtyOnlyWhenSomethingChanged() {
        when(cache.restoreBestScore(KEY, "l1", 4, OptionalInt.empty())).thenReturn(true);
        when(cache.restoreBestScore(KEY, "l2", 4, OptionalInt.empty())).thenReturn(false);

        BitmapStore store = new BitmapStore(cache, warmer);
        store.restoreBestScore(KEY, "l1", 4, OptionalInt.empty());
        store.restoreBestScore(KEY, "l2", 4, OptionalInt.empty());
        verify(cache, times(1)).markDirty(KEY);
    }
}
