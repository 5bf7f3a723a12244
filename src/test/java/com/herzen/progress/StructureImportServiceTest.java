package com.herzen.progress;

import com.herzen.progress.domain.DomainModels.NodeType;
import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.repository.StructureJdbcRepository;
import com.herzen.progress.structure.BitPositionAllocator;
import com.herzen.progress.structure.StructureImportService;
import com.herzen.progress.structure.StructureLoader;
import com.herzen.progress.structure.StructureModels.ContainerNode;
import com.herzen.progress.structure.StructureModels.StructureIssue;
import com.herzen.progress.structure.StructureModels.StructureTree;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class StructureImportServiceTest {
    @Autowired
    private StructureImportService importService;

    @Autowired
    private StructureLoader loader;

    @Autowired
    private StructureJdbcRepository structures;

    @Autowired
    private BitPositionAllocator allocator;

    @Test
    void publishesAndServesTheNewStructure() {
        String subject = "hist-" + UUID.randomUUID();
        String content = "{\"children\": [{\"id\": \"rome\", \"bitPosition\": 0}, {\"id\": \"greece\", \"bitPosition\": 1}]}";

        StructureImportService.ImportResult result = importService.publish(subject, content, false);
        assertTrue(result.valid());
        assertFalse(result.dryRun());
        assertEquals(2, result.lessonCount());
        assertEquals(32, result.version().length());

        StructureTree tree = loader.load(subject);
        assertEquals(result.version(), tree.version());
        assertEquals(2, tree.lessonCount());

        StructureImportService.ImportResult again = importService.publish(subject, content, false);
        assertEquals(result.version(), again.version());
    }

    @Test
    void dryRunOnlyReports() {
        String subject = "lit-" + UUID.randomUUID();
        StructureImportService.ImportResult result = importService.publish(subject,
                "{\"children\": [{\"id\": \"poems\", \"bitPosition\": 0}]}", true);

        assertTrue(result.valid());
        assertTrue(result.dryRun());
        assertTrue(structures.fetch(subject).isEmpty());
        assertEquals(0, allocator.allocate(subject, "novels"));
    }

    @Test
    void acceptsExportFormat() {
        String subject = "cs-" + UUID.randomUUID();
        String content = """
                {
                  "id": "%s",
                  "tracks": [{
                    "id": "basics", "is_linear": false,
                    "units": [{
                      "id": "loops",
                      "topics": [{
                        "id": "for-loops",
                        "lessons": [
                          {"id": "nested", "bit_index": 0, "sort_order": 2},
                          {"id": "simple", "bit_index": 1, "sort_order": 1}
                        ]
                      }]
                    }]
                  }]
                }
                """.formatted(subject);

        assertTrue(importService.publish(subject, content, false).valid());
        StructureTree tree = loader.load(subject);

        ContainerNode track = (ContainerNode) tree.root().children().get(0);
        assertEquals(NodeType.TRACK, track.type());
        assertFalse(track.sequential());
        ContainerNode unit = (ContainerNode) track.children().get(0);
        assertEquals(NodeType.UNIT, unit.type());
        assertTrue(unit.sequential());
        assertEquals(NodeType.TOPIC, unit.children().get(0).type());
        assertEquals(List.of("simple", "nested"), List.copyOf(tree.lessons().keySet()));
    }

    @Test
    void reportsDuplicatesAndExcludedNodes() {
        String subject = "chem-" + UUID.randomUUID();
        StructureImportService.ImportResult result = importService.publish(subject, """
                {"children": [
                  {"id": "a", "bitPosition": 0},
                  {"id": "b", "bitPosition": 0},
                  {"id": "c", "type": "lesson"}
                ]}
                """, false);

        assertFalse(result.valid());
        assertTrue(codes(result).contains("DUPLICATE_BIT_POSITION"));
        assertTrue(codes(result).contains("MISSING_BIT_POSITION"));
        assertTrue(structures.fetch(subject).isEmpty());
    }

    @Test
    void lessonsWithoutPositionAreReportedAndLeftOut() {
        String subject = "eco-" + UUID.randomUUID();
        StructureImportService.ImportResult result = importService.publish(subject,
                "{\"topics\": [{\"id\": \"T\", \"lessons\": [{\"id\": \"bad\"}, {\"id\": \"good\", \"bit_index\": 0}]}]}", true);

        assertTrue(result.valid());
        assertEquals(1, result.lessonCount());
        StructureIssue issue = result.issues().stream()
                .filter(i -> i.code().equals("MISSING_BIT_POSITION"))
                .findFirst().orElseThrow();
        assertEquals("bad", issue.nodeId());
        assertFalse(issue.fatal());
    }

    @Test
    void neverMovesOrReusesRegisteredPositions() {
        String subject = "music-" + UUID.randomUUID();
        assertTrue(importService.publish(subject,
                "{\"children\": [{\"id\": \"scales\", \"bitPosition\": 0}, {\"id\": \"chords\", \"bitPosition\": 1}]}", false).valid());

        StructureImportService.ImportResult moved = importService.publish(subject,
                "{\"children\": [{\"id\": \"scales\", \"bitPosition\": 2}, {\"id\": \"chords\", \"bitPosition\": 1}]}", false);
        assertFalse(moved.valid());
        assertTrue(codes(moved).contains("POSITION_REASSIGNED"));

        StructureImportService.ImportResult reused = importService.publish(subject,
                "{\"children\": [{\"id\": \"rhythm\", \"bitPosition\": 0}, {\"id\": \"chords\", \"bitPosition\": 1}]}", false);
        assertFalse(reused.valid());
        assertTrue(codes(reused).contains("POSITION_REUSED"));

        assertEquals(2, loader.load(subject).lessonCount());
    }

    @Test
    void allocatesAfterTheHighestPublishedPosition() {
        String subject = "art-" + UUID.randomUUID();
        assertTrue(importService.publish(subject,
                "{\"children\": [{\"id\": \"color\", \"bitPosition\": 0}, {\"id\": \"shape\", \"bitPosition\": 4}]}", false).valid());

        assertEquals(5, allocator.allocate(subject, "light"));
        assertEquals(6, allocator.allocate(subject, "shadow"));
        assertEquals(5, allocator.allocate(subject, "light"));
        assertEquals(4, allocator.allocate(subject, "shape"));
        assertEquals(Optional.of(subject), allocator.subjectOfLesson("shadow"));
    }

    @Test
    void rejectsMissingSubject() {
        assertThrows(ProgressEngineException.class, () -> importService.publish(" ", "{}", false));
        assertThrows(ProgressEngineException.class, () -> allocator.allocate("x", ""));
    }

    private List<String> codes(StructureImportService.ImportResult result) {
        return result.issues().stream().map(StructureIssue::code).toList();
    }
}
