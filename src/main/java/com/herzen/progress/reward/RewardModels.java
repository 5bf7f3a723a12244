package com.herzen.progress.reward;

public class RewardModels {
    /** XP for one completion and the best score to keep afterwards. */
    public record Reward(int xp, int newBestScore, boolean firstCompletion, boolean newRecord) {
        public boolean replay() {
            return !firstCompletion;
        }
    }
}
