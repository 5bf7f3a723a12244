package com.herzen.progress.unlock;

import java.util.Map;

public class UnlockModels {
    public enum NodeStatus { PASSED, UNLOCKED, LOCKED }

    /**
     * Final status of every node of one tree, plus the number of lessons whose bit is set
     * (which may exceed the number of Passed lessons when a sequential chain was reordered).
     */
    public record UnlockResult(Map<String, NodeStatus> statuses, int completedLessons) {
        public NodeStatus status(String nodeId) {
            return statuses.get(nodeId);
        }
    }
}
