package com.herzen.progress.repository;

import com.herzen.progress.structure.StructureModels.SourceDocument;
import com.herzen.progress.structure.StructureSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class StructureJdbcRepository implements StructureSource {
    private final JdbcTemplate jdbcTemplate;

    public StructureJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void save(String subjectId, String version, String content) {
        jdbcTemplate.update(
                "MERGE INTO subject_structure(subject_id, version, content, published_at) KEY(subject_id) VALUES (?,?,?,?)",
                subjectId, version, content, Timestamp.from(Instant.now()));
    }

    @Override
    public Optional<SourceDocument> fetch(String subjectId) {
        List<SourceDocument> rows = jdbcTemplate.query(
                "SELECT subject_id, version, content FROM subject_structure WHERE subject_id=?",
                (rs, n) -> new SourceDocument(rs.getString(1), rs.getString(2), rs.getString(3)),
                subjectId);
        return rows.stream().findFirst();
    }

    @Override
    public Optional<String> currentVersion(String subjectId) {
        List<String> rows = jdbcTemplate.query(
                "SELECT version FROM subject_structure WHERE subject_id=?",
                (rs, n) -> rs.getString(1),
                subjectId);
        return rows.stream().findFirst();
    }
}
