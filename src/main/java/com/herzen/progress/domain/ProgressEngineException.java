package com.herzen.progress.domain;

public class ProgressEngineException extends RuntimeException {

    public enum ErrorKind {
        LESSON_NOT_FOUND(false),
        SUBJECT_NOT_FOUND(false),
        INVALID_STRUCTURE(false),
        INVALID_REQUEST(false),
        CACHE_UNAVAILABLE(true),
        SYNC_FAILURE(true);

        private final boolean retryable;

        ErrorKind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean retryable() {
            return retryable;
        }
    }

    private final ErrorKind kind;

    public ProgressEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProgressEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean retryable() {
        return kind.retryable();
    }

    public static ProgressEngineException lessonNotFound(String subjectId, String lessonId) {
        if (subjectId == null) {
            return new ProgressEngineException(ErrorKind.LESSON_NOT_FOUND, "Lesson " + lessonId + " is not registered in any subject");
        }
        return new ProgressEngineException(ErrorKind.LESSON_NOT_FOUND,
                "Lesson " + lessonId + " not found in subject " + subjectId);
    }

    public static ProgressEngineException subjectNotFound(String subjectId) {
        return new ProgressEngineException(ErrorKind.SUBJECT_NOT_FOUND, "No structure available for subject " + subjectId);
    }

    public static ProgressEngineException invalidStructure(String subjectId, String detail) {
        return new ProgressEngineException(ErrorKind.INVALID_STRUCTURE, "Invalid structure for subject " + subjectId + ": " + detail);
    }

    public static ProgressEngineException invalidRequest(String message) {
        return new ProgressEngineException(ErrorKind.INVALID_REQUEST, message);
    }

    public static ProgressEngineException cacheUnavailable(String message, Throwable cause) {
        return new ProgressEngineException(ErrorKind.CACHE_UNAVAILABLE, message, cause);
    }

    public static ProgressEngineException syncFailure(String message, Throwable cause) {
        return new ProgressEngineException(ErrorKind.SYNC_FAILURE, message, cause);
    }
}
