package com.herzen.progress.repository;

import com.herzen.progress.sync.ProgressSnapshotStore;
import com.herzen.progress.sync.SyncModels.ProgressSnapshot;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class SnapshotJdbcRepository implements ProgressSnapshotStore {
    private final JdbcTemplate jdbcTemplate;

    public SnapshotJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ProgressSnapshot> find(String learnerId, String subjectId) {
        List<ProgressSnapshot> rows = jdbcTemplate.query(
                "SELECT learner_id, subject_id, passed_lessons_bitset, best_scores_json, last_synced_at FROM progress_snapshot WHERE learner_id=? AND subject_id=?",
                (rs, n) -> {
                    Timestamp synced = rs.getTimestamp(5);
                    return new ProgressSnapshot(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                            synced == null ? null : synced.toInstant());
                },
                learnerId, subjectId);
        return rows.stream().findFirst();
    }

    @Override
    public void upsert(ProgressSnapshot snapshot) {
        Instant synced = snapshot.lastSyncedAt() == null ? Instant.now() : snapshot.lastSyncedAt();
        jdbcTemplate.update(
                "MERGE INTO progress_snapshot(learner_id, subject_id, passed_lessons_bitset, best_scores_json, last_synced_at) KEY(learner_id, subject_id) VALUES (?,?,?,?,?)",
                snapshot.learnerId(), snapshot.subjectId(), snapshot.completionBitmapBase64(), snapshot.bestScoresJson(),
                Timestamp.from(synced));
    }
}
