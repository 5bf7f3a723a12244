package com.herzen.progress.repository;

import com.herzen.progress.reward.XpWallet;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public class WalletJdbcRepository implements XpWallet {
    private final JdbcTemplate jdbcTemplate;

    public WalletJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public long credit(String learnerId, String subjectId, int xp) {
        jdbcTemplate.update("MERGE INTO learner_wallet(learner_id) KEY(learner_id) VALUES (?)", learnerId);
        jdbcTemplate.update("UPDATE learner_wallet SET total_xp = total_xp + ? WHERE learner_id=?", xp, learnerId);
        jdbcTemplate.update(
                "MERGE INTO learner_subject_xp(learner_id, subject_id) KEY(learner_id, subject_id) VALUES (?,?)",
                learnerId, subjectId);
        jdbcTemplate.update(
                "UPDATE learner_subject_xp SET xp = xp + ? WHERE learner_id=? AND subject_id=?",
                xp, learnerId, subjectId);
        return totalXp(learnerId);
    }

    @Override
    public long totalXp(String learnerId) {
        List<Long> rows = jdbcTemplate.query(
                "SELECT total_xp FROM learner_wallet WHERE learner_id=?",
                (rs, n) -> rs.getLong(1),
                learnerId);
        return rows.isEmpty() ? 0 : rows.get(0);
    }

    @Override
    public long subjectXp(String learnerId, String subjectId) {
        List<Long> rows = jdbcTemplate.query(
                "SELECT xp FROM learner_subject_xp WHERE learner_id=? AND subject_id=?",
                (rs, n) -> rs.getLong(1),
                learnerId, subjectId);
        return rows.isEmpty() ? 0 : rows.get(0);
    }
}
