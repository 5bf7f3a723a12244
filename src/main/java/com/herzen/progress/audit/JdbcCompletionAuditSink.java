package com.herzen.progress.audit;

import com.herzen.progress.repository.AuditJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Service
public class JdbcCompletionAuditSink implements CompletionAuditSink {
    private static final Logger log = LoggerFactory.getLogger(JdbcCompletionAuditSink.class);

    private final AuditJdbcRepository repository;

    public JdbcCompletionAuditSink(AuditJdbcRepository repository) {
        this.repository = repository;
    }

    @Async
    @Override
    public void record(CompletionEvent event) {
        try {
            repository.saveEvent(event);
        } catch (DataAccessException e) {
            log.warn("Dropped {} event for learner {} lesson {}: {}",
                    event.eventType(), event.learnerId(), event.lessonId(), e.getMessage());
        }
    }
}
