package com.herzen.progress.audit;

import java.time.Instant;

public record CompletionEvent(String learnerId,
                              String subjectId,
                              String lessonId,
                              String eventType,
                              int performanceScore,
                              int xpAwarded,
                              Instant ts) {
    public CompletionEvent {
        if (!LearningEventTypes.SUPPORTED.contains(eventType)) {
            throw new IllegalArgumentException("Unsupported event type: " + eventType);
        }
    }

    /** {@code record_break} for an improved replay, {@code lesson_replay} otherwise. */
    public static String typeFor(boolean firstCompletion, boolean newRecord) {
        if (firstCompletion) {
            return LearningEventTypes.LESSON_COMPLETE;
        }
        return newRecord ? LearningEventTypes.RECORD_BREAK : LearningEventTypes.LESSON_REPLAY;
    }
}
