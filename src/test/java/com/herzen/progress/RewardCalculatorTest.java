package com.herzen.progress;

import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.reward.RewardCalculator;
import com.herzen.progress.reward.RewardModels.Reward;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class RewardCalculatorTest {
    private final RewardCalculator calculator = new RewardCalculator(10, 10, 5);

    @Test
    void firstCompletionPaysBaseAndScoreBonus() {
        Reward reward = calculator.calculate(OptionalInt.empty(), 4);
        assertEquals(50, reward.xp());
        assertEquals(4, reward.newBestScore());
        assertTrue(reward.firstCompletion());
        assertTrue(reward.newRecord());
    }

    @Test
    void replayBelowOrAtBestPaysNothing() {
        Reward lower = calculator.calculate(OptionalInt.of(4), 2);
        assertEquals(0, lower.xp());
        assertEquals(4, lower.newBestScore());
        assertFalse(lower.newRecord());
        assertTrue(lower.replay());

        Reward equal = calculator.calculate(OptionalInt.of(4), 4);
        assertEquals(0, equal.xp());
        assertFalse(equal.newRecord());
    }

    @Test
    void replayAboveBestPaysOnlyTheDifference() {
        Reward reward = calculator.calculate(OptionalInt.of(3), 5);
        assertEquals(20, reward.xp());
        assertEquals(5, reward.newBestScore());
        assertTrue(reward.newRecord());
        assertFalse(reward.firstCompletion());
    }

    @Test
    void replayBonusNeverExceedsTheFirstCompletionBonus() {
        int total = calculator.calculate(OptionalInt.empty(), 1).xp();
        total += calculator.calculate(OptionalInt.of(1), 3).xp();
        total += calculator.calculate(OptionalInt.of(3), 2).xp();
        total += calculator.calculate(OptionalInt.of(3), 5).xp();
        assertEquals(calculator.calculate(OptionalInt.empty(), 5).xp(), total);
    }

    @Test
    void rejectsScoresOutsideTheConfiguredRange() {
        ProgressEngineException high = assertThrows(ProgressEngineException.class,
                () -> calculator.calculate(OptionalInt.empty(), 6));
        assertEquals(ProgressEngineException.ErrorKind.INVALID_REQUEST, high.kind());
        assertFalse(high.retryable());
        assertThrows(ProgressEngineException.class, () -> calculator.checkScore(-1));
    }

    @Test
    void honorsConfiguredValues() {
        RewardCalculator custom = new RewardCalculator(100, 1, 10);
        assertEquals(110, custom.calculate(OptionalInt.empty(), 10).xp());
        assertEquals(10, custom.maxScore());
    }
}
