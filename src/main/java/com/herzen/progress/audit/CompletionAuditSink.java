package com.herzen.progress.audit;

/** Receives completion events. Implementations must not fail the completion that produced them. */
public interface CompletionAuditSink {
    void record(CompletionEvent event);
}
