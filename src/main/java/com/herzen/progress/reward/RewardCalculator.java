package com.herzen.progress.reward;

import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.reward.RewardModels.Reward;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

@Component
public class RewardCalculator {
    private final int baseXp;
    private final int perPointBonus;
    private final int maxScore;

    public RewardCalculator(@Value("${progress.reward.base-xp:10}") int baseXp,
                            @Value("${progress.reward.per-point-bonus:10}") int perPointBonus,
                            @Value("${progress.reward.max-score:5}") int maxScore) {
        this.baseXp = baseXp;
        this.perPointBonus = perPointBonus;
        this.maxScore = maxScore;
    }

    public void checkScore(int performanceScore) {
        if (performanceScore < 0 || performanceScore > maxScore) {
            throw ProgressEngineException.invalidRequest(
                    "performanceScore must be between 0 and " + maxScore + ", got " + performanceScore);
        }
    }

    public Reward calculate(OptionalInt previousBest, int performanceScore) {
        checkScore(performanceScore);
        if (previousBest.isEmpty()) {
            return new Reward(baseXp + performanceScore * perPointBonus, performanceScore, true, true);
        }
        int best = previousBest.getAsInt();
        if (performanceScore > best) {
            return new Reward((performanceScore - best) * perPointBonus, performanceScore, false, true);
        }
        return new Reward(0, best, false, false);
    }

    public int maxScore() {
        return maxScore;
    }
}
