package com.herzen.progress.structure;

import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.repository.LessonPositionJdbcRepository;
import com.herzen.progress.structure.StructureModels.LessonNode;
import com.herzen.progress.structure.StructureModels.StructureTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.Optional;

@Service
public class BitPositionAllocator {
    private static final Logger log = LoggerFactory.getLogger(BitPositionAllocator.class);

    private final LessonPositionJdbcRepository repository;

    public BitPositionAllocator(LessonPositionJdbcRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public int allocate(String subjectId, String lessonId) {
        if (subjectId == null || subjectId.isBlank() || lessonId == null || lessonId.isBlank()) {
            throw ProgressEngineException.invalidRequest("subjectId and lessonId are required");
        }
        Optional<Integer> existing = repository.findPosition(subjectId, lessonId);
        if (existing.isPresent()) {
            return existing.get();
        }
        int position = repository.takeNextPosition(subjectId);
        repository.register(subjectId, lessonId, position);
        log.info("Allocated bit {} to lesson {} in subject {}", position, lessonId, subjectId);
        return position;
    }

    public Optional<String> subjectOfLesson(String lessonId) {
        return repository.findLatestSubjectOfLesson(lessonId);
    }

    /** Records positions declared by a published tree and moves the counter past the highest one. */
    @Transactional
    public void registerPublished(StructureTree tree) {
        Map<String, Integer> known = repository.positionsForSubject(tree.subjectId());
        int highest = -1;
        for (LessonNode lesson : tree.lessons().values()) {
            highest = Math.max(highest, lesson.bitPosition());
            if (!known.containsKey(lesson.id())) {
                repository.register(tree.subjectId(), lesson.id(), lesson.bitPosition());
            }
        }
        if (highest >= 0) {
            repository.advanceCounter(tree.subjectId(), highest + 1);
        }
    }
}
