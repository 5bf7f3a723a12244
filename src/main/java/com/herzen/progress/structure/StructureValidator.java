package com.herzen.progress.structure;

import com.herzen.progress.structure.StructureModels.*;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class StructureValidator {

    public List<StructureIssue> validate(StructureTree tree) {
        List<StructureIssue> issues = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Map<Integer, String> seenPositions = new HashMap<>();
        walk(tree.root(), seenIds, seenPositions, issues);
        return issues;
    }

    /**
     * Checks the tree against positions already handed out for the subject: a lesson keeps its
     * position for life and a position is never given to another lesson.
     */
    public List<StructureIssue> validateAgainstRegistry(StructureTree tree, Map<String, Integer> registered) {
        List<StructureIssue> issues = new ArrayList<>();
        Map<Integer, String> ownerByPosition = new HashMap<>();
        registered.forEach((lessonId, position) -> ownerByPosition.put(position, lessonId));

        for (LessonNode lesson : tree.lessons().values()) {
            Integer known = registered.get(lesson.id());
            if (known != null && known != lesson.bitPosition()) {
                issues.add(new StructureIssue("POSITION_REASSIGNED",
                        "Lesson " + lesson.id() + " is registered at bit " + known + " but declares " + lesson.bitPosition(),
                        "$", lesson.id(), true));
                continue;
            }
            String owner = ownerByPosition.get(lesson.bitPosition());
            if (owner != null && !owner.equals(lesson.id())) {
                issues.add(new StructureIssue("POSITION_REUSED",
                        "Bit " + lesson.bitPosition() + " already belongs to lesson " + owner,
                        "$", lesson.id(), true));
            }
        }
        return issues;
    }

    private void walk(StructureNode node, Set<String> seenIds, Map<Integer, String> seenPositions, List<StructureIssue> issues) {
        if (!seenIds.add(node.id())) {
            issues.add(new StructureIssue("DUPLICATE_NODE", "Duplicate node id: " + node.id(), "$", node.id(), true));
        }
        if (node instanceof LessonNode lesson) {
            String previous = seenPositions.putIfAbsent(lesson.bitPosition(), lesson.id());
            if (previous != null) {
                issues.add(new StructureIssue("DUPLICATE_BIT_POSITION",
                        "Lessons " + previous + " and " + lesson.id() + " share bit " + lesson.bitPosition(),
                        "$", lesson.id(), true));
            }
        } else if (node instanceof ContainerNode container) {
            container.children().forEach(child -> walk(child, seenIds, seenPositions, issues));
        }
    }
}
