package com.herzen.progress.unlock;

import com.herzen.progress.bitmap.CompletionBitmap;
import com.herzen.progress.structure.StructureModels.ContainerNode;
import com.herzen.progress.structure.StructureModels.LessonNode;
import com.herzen.progress.structure.StructureModels.StructureNode;
import com.herzen.progress.structure.StructureModels.StructureTree;
import com.herzen.progress.unlock.UnlockModels.NodeStatus;
import com.herzen.progress.unlock.UnlockModels.UnlockResult;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
public class UnlockCalculator {

    public UnlockResult compute(StructureTree tree, byte[] bitmap) {
        Map<String, Boolean> passed = new HashMap<>();
        int completed = markPassed(tree.root(), bitmap, passed);

        Map<String, NodeStatus> statuses = new HashMap<>();
        ContainerNode root = tree.root();
        statuses.put(root.id(), passed.get(root.id()) ? NodeStatus.PASSED : NodeStatus.UNLOCKED);
        resolveChildren(root, statuses.get(root.id()), passed, statuses);
        return new UnlockResult(Map.copyOf(statuses), completed);
    }

    /** Returns the number of lessons with their bit set below {@code node}. */
    private int markPassed(StructureNode node, byte[] bitmap, Map<String, Boolean> passed) {
        if (node instanceof LessonNode lesson) {
            boolean set = CompletionBitmap.isSet(bitmap, lesson.bitPosition());
            passed.put(lesson.id(), set);
            return set ? 1 : 0;
        }
        ContainerNode container = (ContainerNode) node;
        int completed = 0;
        boolean allPassed = true;
        for (StructureNode child : container.children()) {
            completed += markPassed(child, bitmap, passed);
            allPassed &= passed.get(child.id());
        }
        passed.put(container.id(), allPassed);
        return completed;
    }

    private void resolveChildren(ContainerNode parent,
                                 NodeStatus parentStatus,
                                 Map<String, Boolean> passed,
                                 Map<String, NodeStatus> statuses) {
        boolean earlierSiblingsPassed = true;
        for (StructureNode child : parent.children()) {
            boolean childPassed = passed.get(child.id());
            NodeStatus status;
            if (parentStatus == NodeStatus.LOCKED) {
                status = NodeStatus.LOCKED;
            } else if (parent.sequential() && !earlierSiblingsPassed) {
                status = NodeStatus.LOCKED;
            } else {
                status = childPassed ? NodeStatus.PASSED : NodeStatus.UNLOCKED;
            }
            statuses.put(child.id(), status);
            earlierSiblingsPassed &= childPassed;

            if (child instanceof ContainerNode container) {
                resolveChildren(container, status, passed, statuses);
            }
        }
    }
}
