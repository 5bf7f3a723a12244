package com.herzen.progress.reward;

/** Accumulates XP earned by a learner. */
public interface XpWallet {
    /** Adds {@code xp} to the learner's total and to their subject total; returns the new total. */
    long credit(String learnerId, String subjectId, int xp);

    long totalXp(String learnerId);

    long subjectXp(String learnerId, String subjectId);
}
