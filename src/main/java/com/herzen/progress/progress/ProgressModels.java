package com.herzen.progress.progress;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.herzen.progress.domain.DomainModels.NodeType;
import com.herzen.progress.unlock.UnlockModels.NodeStatus;

import java.util.List;

public class ProgressModels {
    public record ProgressView(String subjectId,
                               String structureVersion,
                               double completionPercentage,
                               String suggestedNextLessonId,
                               int totalLessons,
                               int passedLessons,
                               long totalXpEarned,
                               ProgressNode tree) {}

    /** {@code bestScore} is only present on Passed lessons. */
    public record ProgressNode(String id,
                               NodeType type,
                               String title,
                               NodeStatus status,
                               Integer bestScore,
                               List<ProgressNode> children) {}

    public record CompletionResult(boolean success,
                                   String subjectId,
                                   String lessonId,
                                   int xpAwarded,
                                   long newTotalXp,
                                   @JsonProperty("isFirstCompletion") boolean isFirstCompletion,
                                   @JsonProperty("isNewRecord") boolean isNewRecord) {}
}
