package com.herzen.progress.domain;

public class DomainModels {
    /** Addresses one learner's progress in one subject; every cache operation touches exactly one key. */
    public record ProgressKey(String learnerId, String subjectId) {
        public ProgressKey {
            if (learnerId == null || learnerId.isBlank()) {
                throw ProgressEngineException.invalidRequest("learnerId is required");
            }
            if (subjectId == null || subjectId.isBlank()) {
                throw ProgressEngineException.invalidRequest("subjectId is required");
            }
        }

        @Override
        public String toString() {
            return "user_prog:" + learnerId + ":" + subjectId;
        }
    }

    public enum NodeType {
        SUBJECT, TRACK, UNIT, TOPIC, LESSON;

        public static NodeType forDepth(int depth) {
            return switch (depth) {
                case 0 -> SUBJECT;
                case 1 -> TRACK;
                case 2 -> UNIT;
                default -> TOPIC;
            };
        }
    }
}
