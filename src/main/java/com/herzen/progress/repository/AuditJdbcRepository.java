package com.herzen.progress.repository;

import com.herzen.progress.audit.CompletionEvent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public class AuditJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public AuditJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void saveEvent(CompletionEvent e) {
        jdbcTemplate.update(
                "INSERT INTO learning_events(learner_id, subject_id, lesson_id, event_type, performance_score, xp_awarded, ts) VALUES (?,?,?,?,?,?,?)",
                e.learnerId(), e.subjectId(), e.lessonId(), e.eventType(),
                e.performanceScore(), e.xpAwarded(),
                (e.ts() == null ? Instant.now() : e.ts()).toString());
    }
}
