package com.herzen.progress.structure;

import com.herzen.progress.domain.DomainModels.NodeType;

import java.util.*;

public class StructureModels {
    public interface StructureNode {
        String id();

        String title();

        NodeType type();

        int sortOrder();
    }

    /** Subject, track, unit or topic. Children are kept in ascending sort order. */
    public record ContainerNode(String id,
                                String title,
                                NodeType type,
                                boolean sequential,
                                int sortOrder,
                                List<StructureNode> children) implements StructureNode {
        public ContainerNode {
            children = List.copyOf(children);
        }
    }

    public record LessonNode(String id, String title, int bitPosition, int sortOrder) implements StructureNode {
        @Override
        public NodeType type() {
            return NodeType.LESSON;
        }
    }

    /**
     * Immutable, typed hierarchy of one subject version. Lessons are indexed in pre-order, which
     * is also the order used to pick the suggested next lesson.
     */
    public record StructureTree(String subjectId,
                                String version,
                                ContainerNode root,
                                Map<String, LessonNode> lessons,
                                Map<String, String> parentIds) {

        public static StructureTree of(String subjectId, String version, ContainerNode root) {
            Map<String, LessonNode> lessons = new LinkedHashMap<>();
            Map<String, String> parents = new HashMap<>();
            index(root, lessons, parents);
            return new StructureTree(subjectId, version, root,
                    Collections.unmodifiableMap(lessons), Collections.unmodifiableMap(parents));
        }

        private static void index(ContainerNode container, Map<String, LessonNode> lessons, Map<String, String> parents) {
            for (StructureNode child : container.children()) {
                parents.putIfAbsent(child.id(), container.id());
                if (child instanceof LessonNode lesson) {
                    lessons.putIfAbsent(lesson.id(), lesson);
                } else if (child instanceof ContainerNode nested) {
                    index(nested, lessons, parents);
                }
            }
        }

        public Optional<LessonNode> lesson(String lessonId) {
            return Optional.ofNullable(lessons.get(lessonId));
        }

        public Optional<String> parentId(String nodeId) {
            return Optional.ofNullable(parentIds.get(nodeId));
        }

        public int lessonCount() {
            return lessons.size();
        }
    }

    public record StructureIssue(String code, String message, String path, String nodeId, boolean fatal) {}

    public record SourceDocument(String subjectId, String version, String content) {}
}
