package com.herzen.progress.structure;

import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.repository.LessonPositionJdbcRepository;
import com.herzen.progress.repository.StructureJdbcRepository;
import com.herzen.progress.structure.StructureModels.StructureIssue;
import com.herzen.progress.structure.StructureModels.StructureTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Service
public class StructureImportService {
    private static final Logger log = LoggerFactory.getLogger(StructureImportService.class);

    private final StructureParser parser;
    private final StructureValidator validator;
    private final StructureJdbcRepository structures;
    private final LessonPositionJdbcRepository positions;
    private final BitPositionAllocator allocator;
    private final StructureLoader loader;

    public StructureImportService(StructureParser parser,
                                  StructureValidator validator,
                                  StructureJdbcRepository structures,
                                  LessonPositionJdbcRepository positions,
                                  BitPositionAllocator allocator,
                                  StructureLoader loader) {
        this.parser = parser;
        this.validator = validator;
        this.structures = structures;
        this.positions = positions;
        this.allocator = allocator;
        this.loader = loader;
    }

    @Transactional
    public ImportResult publish(String subjectId, String content, boolean dryRun) {
        if (subjectId == null || subjectId.isBlank()) {
            throw ProgressEngineException.invalidRequest("subjectId is required");
        }
        String version = DigestUtils.md5DigestAsHex((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
        StructureParser.ParseResult parsed = parser.parse(subjectId, version, content);
        List<StructureIssue> issues = new ArrayList<>(parsed.issues());

        StructureTree tree = parsed.tree();
        if (tree != null) {
            issues.addAll(validator.validate(tree));
            issues.addAll(validator.validateAgainstRegistry(tree, positions.positionsForSubject(subjectId)));
        }
        boolean valid = tree != null && issues.stream().noneMatch(StructureIssue::fatal);

        if (valid && !dryRun) {
            structures.save(subjectId, version, content);
            allocator.registerPublished(tree);
            loader.invalidate(subjectId);
            log.info("Published structure for subject {} version {} ({} lessons, {} warnings)",
                    subjectId, version, tree.lessonCount(), issues.size());
        }
        return new ImportResult(subjectId, version, dryRun, valid, tree == null ? 0 : tree.lessonCount(), issues);
    }

    public record ImportResult(String subjectId,
                               String version,
                               boolean dryRun,
                               boolean valid,
                               int lessonCount,
                               List<StructureIssue> issues) {}
}
