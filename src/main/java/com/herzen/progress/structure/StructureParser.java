package com.herzen.progress.structure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.progress.domain.DomainModels.NodeType;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.herzen.progress.structure.StructureModels.*;

@Component
public class StructureParser {
    private static final List<String> CHILD_KEYS = List.of("children", "tracks", "units", "topics", "lessons");

    private final ObjectMapper objectMapper;

    public StructureParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParseResult parse(String subjectId, String version, String content) {
        List<StructureIssue> issues = new ArrayList<>();
        if (content == null || content.isBlank()) {
            issues.add(new StructureIssue("EMPTY_DOCUMENT", "Structure document is empty", "$", subjectId, true));
            return new ParseResult(null, issues);
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            issues.add(new StructureIssue("INVALID_JSON", "Cannot parse structure: " + e.getOriginalMessage(), "$", subjectId, true));
            return new ParseResult(null, issues);
        }
        if (json == null || !json.isObject()) {
            issues.add(new StructureIssue("INVALID_ROOT", "Structure root must be an object", "$", subjectId, true));
            return new ParseResult(null, issues);
        }

        String declaredId = text(json, "id");
        if (declaredId != null && !declaredId.equals(subjectId)) {
            issues.add(new StructureIssue("SUBJECT_ID_MISMATCH",
                    "Document declares subject " + declaredId + ", loaded as " + subjectId, "$", declaredId, false));
        }

        ContainerNode root = parseContainer(json, subjectId, 0, null, "$", issues);
        return new ParseResult(StructureTree.of(subjectId, version, root), issues);
    }

    private ContainerNode parseContainer(JsonNode node, String id, int depth, String levelKey, String path, List<StructureIssue> issues) {
        NodeType type = explicitType(node);
        if (type == null || type == NodeType.LESSON) {
            type = levelType(levelKey, depth);
        }
        boolean sequential = bool(node, true, "sequential", "is_linear");
        int sortOrder = integer(node, 0, "sortOrder", "sort_order");

        List<StructureNode> children = new ArrayList<>();
        for (String key : CHILD_KEYS) {
            JsonNode array = node.get(key);
            if (array == null || array.isNull()) continue;
            if (!array.isArray()) {
                issues.add(new StructureIssue("INVALID_CHILDREN", "'" + key + "' must be an array", path + "." + key, id, false));
                continue;
            }
            for (int i = 0; i < array.size(); i++) {
                StructureNode child = parseChild(array.get(i), depth + 1, key, path + "." + key + "[" + i + "]", issues);
                if (child != null) children.add(child);
            }
        }
        children.sort(Comparator.comparingInt(StructureNode::sortOrder));

        return new ContainerNode(id, text(node, "title"), type, sequential, sortOrder, children);
    }

    private StructureNode parseChild(JsonNode node, int depth, String levelKey, String path, List<StructureIssue> issues) {
        if (node == null || !node.isObject()) {
            issues.add(new StructureIssue("INVALID_NODE", "Node must be an object", path, null, false));
            return null;
        }
        String id = text(node, "id");
        if (id == null) {
            issues.add(new StructureIssue("MISSING_ID", "Node without id excluded with its subtree", path, null, false));
            return null;
        }

        // everything listed under "lessons" is a leaf, with or without a position
        boolean lesson = "lessons".equals(levelKey)
                || explicitType(node) == NodeType.LESSON
                || has(node, "bitPosition", "bit_index");
        if (!lesson) {
            return parseContainer(node, id, depth, levelKey, path, issues);
        }

        JsonNode position = first(node, "bitPosition", "bit_index");
        if (position == null || !position.canConvertToInt() || !position.isIntegralNumber() || position.asInt() < 0) {
            issues.add(new StructureIssue("MISSING_BIT_POSITION", "Lesson without a valid bit position excluded", path, id, false));
            return null;
        }
        return new LessonNode(id, text(node, "title"), position.asInt(), integer(node, 0, "sortOrder", "sort_order"));
    }

    private NodeType levelType(String levelKey, int depth) {
        if (levelKey == null) return NodeType.forDepth(depth);
        return switch (levelKey) {
            case "tracks" -> NodeType.TRACK;
            case "units" -> NodeType.UNIT;
            case "topics" -> NodeType.TOPIC;
            default -> NodeType.forDepth(depth);
        };
    }

    private NodeType explicitType(JsonNode node) {
        String type = text(node, "type");
        if (type == null) return null;
        try {
            return NodeType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private boolean bool(JsonNode node, boolean fallback, String... fields) {
        JsonNode value = first(node, fields);
        if (value == null) return fallback;
        if (value.isBoolean()) return value.booleanValue();
        if (value.isNumber()) return value.asInt() != 0;
        return Boolean.parseBoolean(value.asText());
    }

    private int integer(JsonNode node, int fallback, String... fields) {
        JsonNode value = first(node, fields);
        return value == null || !value.canConvertToInt() ? fallback : value.asInt();
    }

    private boolean has(JsonNode node, String... fields) {
        return first(node, fields) != null;
    }

    private JsonNode first(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) return value;
        }
        return null;
    }

    public record ParseResult(StructureTree tree, List<StructureIssue> issues) {}
}
