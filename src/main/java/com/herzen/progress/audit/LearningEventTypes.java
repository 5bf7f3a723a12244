package com.herzen.progress.audit;

import java.util.Set;

public final class LearningEventTypes {
    public static final String LESSON_COMPLETE = "lesson_complete";
    public static final String LESSON_REPLAY = "lesson_replay";
    public static final String RECORD_BREAK = "record_break";

    public static final Set<String> SUPPORTED = Set.of(
            LESSON_COMPLETE,
            LESSON_REPLAY,
            RECORD_BREAK
    );

    private LearningEventTypes() {}
}
