package com.herzen.progress.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.progress.bitmap.CompletionBitmap;
import com.herzen.progress.domain.DomainModels.ProgressKey;
import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.sync.SyncModels.ProgressSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

@Component
public class SnapshotCodec {
    private static final TypeReference<Map<String, Integer>> SCORES_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public SnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProgressSnapshot toSnapshot(ProgressKey key, byte[] bitmap, Map<String, Integer> bestScores, Instant syncedAt) {
        try {
            String scoresJson = objectMapper.writeValueAsString(new TreeMap<>(bestScores == null ? Map.of() : bestScores));
            return new ProgressSnapshot(key.learnerId(), key.subjectId(), CompletionBitmap.encode(bitmap), scoresJson, syncedAt);
        } catch (JsonProcessingException e) {
            throw ProgressEngineException.syncFailure("Cannot encode best scores for " + key, e);
        }
    }

    public byte[] bitmap(ProgressSnapshot snapshot) {
        return CompletionBitmap.decode(snapshot.completionBitmapBase64());
    }

    public Map<String, Integer> bestScores(ProgressSnapshot snapshot) {
        String json = snapshot.bestScoresJson();
        if (json == null || json.isBlank()) return Map.of();
        try {
            Map<String, Integer> scores = objectMapper.readValue(json, SCORES_TYPE);
            return scores == null ? Map.of() : Map.copyOf(scores);
        } catch (JsonProcessingException e) {
            throw ProgressEngineException.syncFailure("Corrupt best scores for "
                    + snapshot.learnerId() + "/" + snapshot.subjectId(), e);
        }
    }
}
