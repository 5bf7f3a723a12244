package com.herzen.progress.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class LessonPositionJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public LessonPositionJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Map<String, Integer> positionsForSubject(String subjectId) {
        List<LessonPositionRow> rows = jdbcTemplate.query(
                "SELECT subject_id, lesson_id, bit_position FROM lesson_position WHERE subject_id=?",
                (rs, n) -> new LessonPositionRow(rs.getString(1), rs.getString(2), rs.getInt(3)),
                subjectId);
        Map<String, Integer> positions = new HashMap<>();
        rows.forEach(r -> positions.put(r.lessonId(), r.bitPosition()));
        return positions;
    }

    public Optional<Integer> findPosition(String subjectId, String lessonId) {
        List<Integer> rows = jdbcTemplate.query(
                "SELECT bit_position FROM lesson_position WHERE subject_id=? AND lesson_id=?",
                (rs, n) -> rs.getInt(1),
                subjectId, lessonId);
        return rows.stream().findFirst();
    }

    /** Subject the lesson was most recently registered in; a moved lesson keeps its old rows. */
    public Optional<String> findLatestSubjectOfLesson(String lessonId) {
        List<String> rows = jdbcTemplate.query(
                "SELECT subject_id FROM lesson_position WHERE lesson_id=? ORDER BY registered_at DESC, bit_position DESC LIMIT 1",
                (rs, n) -> rs.getString(1),
                lessonId);
        return rows.stream().findFirst();
    }

    public void register(String subjectId, String lessonId, int position) {
        jdbcTemplate.update(
                "INSERT INTO lesson_position(subject_id, lesson_id, bit_position, registered_at) VALUES (?,?,?,?)",
                subjectId, lessonId, position, Timestamp.from(Instant.now()));
    }

    /** Reads and increments the subject counter; callers must hold a transaction. */
    public int takeNextPosition(String subjectId) {
        ensureCounter(subjectId);
        Integer next = jdbcTemplate.queryForObject(
                "SELECT next_position FROM subject_position_counter WHERE subject_id=? FOR UPDATE",
                Integer.class,
                subjectId);
        int position = next == null ? 0 : next;
        jdbcTemplate.update("UPDATE subject_position_counter SET next_position=? WHERE subject_id=?", position + 1, subjectId);
        return position;
    }

    public void advanceCounter(String subjectId, int atLeast) {
        ensureCounter(subjectId);
        jdbcTemplate.update(
                "UPDATE subject_position_counter SET next_position=GREATEST(next_position, ?) WHERE subject_id=?",
                atLeast, subjectId);
    }

    private void ensureCounter(String subjectId) {
        jdbcTemplate.update("MERGE INTO subject_position_counter(subject_id) KEY(subject_id) VALUES (?)", subjectId);
    }

    public record LessonPositionRow(String subjectId, String lessonId, int bitPosition) {}
}
