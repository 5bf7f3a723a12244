package com.herzen.progress;

import com.herzen.progress.audit.CompletionEvent;
import com.herzen.progress.audit.LearningEventTypes;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CompletionEventTest {

    @Test
    void classifiesCompletions() {
        assertEquals(LearningEventTypes.LESSON_COMPLETE, CompletionEvent.typeFor(true, true));
        assertEquals(LearningEventTypes.RECORD_BREAK, CompletionEvent.typeFor(false, true));
        assertEquals(LearningEventTypes.LESSON_REPLAY, CompletionEvent.typeFor(false, false));
    }

    @Test
    void rejectsUnknownEventTypes() {
        assertThrows(IllegalArgumentException.class,
                () -> new CompletionEvent("u", "s", "l", "chapter_open", 3, 0, Instant.now()));
    }
}
