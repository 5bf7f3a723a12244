package com.herzen.progress.progress;

import com.herzen.progress.audit.CompletionAuditSink;
import com.herzen.progress.audit.CompletionEvent;
import com.herzen.progress.bitmap.BitmapStore;
import com.herzen.progress.domain.DomainModels.ProgressKey;
import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.progress.ProgressModels.CompletionResult;
import com.herzen.progress.progress.ProgressModels.ProgressNode;
import com.herzen.progress.progress.ProgressModels.ProgressView;
import com.herzen.progress.reward.RewardCalculator;
import com.herzen.progress.reward.RewardModels.Reward;
import com.herzen.progress.reward.XpWallet;
import com.herzen.progress.structure.BitPositionAllocator;
import com.herzen.progress.structure.StructureLoader;
import com.herzen.progress.structure.StructureModels.ContainerNode;
import com.herzen.progress.structure.StructureModels.LessonNode;
import com.herzen.progress.structure.StructureModels.StructureNode;
import com.herzen.progress.structure.StructureModels.StructureTree;
import com.herzen.progress.unlock.UnlockCalculator;
import com.herzen.progress.unlock.UnlockModels.NodeStatus;
import com.herzen.progress.unlock.UnlockModels.UnlockResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

@Service
public class ProgressComputer {
    private static final Logger log = LoggerFactory.getLogger(ProgressComputer.class);

    private final StructureLoader structureLoader;
    private final BitmapStore bitmapStore;
    private final UnlockCalculator unlockCalculator;
    private final RewardCalculator rewardCalculator;
    private final XpWallet wallet;
    private final CompletionAuditSink auditSink;
    private final BitPositionAllocator allocator;

    public ProgressComputer(StructureLoader structureLoader,
                            BitmapStore bitmapStore,
                            UnlockCalculator unlockCalculator,
                            RewardCalculator rewardCalculator,
                            XpWallet wallet,
                            CompletionAuditSink auditSink,
                            BitPositionAllocator allocator) {
        this.structureLoader = structureLoader;
        this.bitmapStore = bitmapStore;
        this.unlockCalculator = unlockCalculator;
        this.rewardCalculator = rewardCalculator;
        this.wallet = wallet;
        this.auditSink = auditSink;
        this.allocator = allocator;
    }

    public ProgressView getProgress(String learnerId, String subjectId) {
        ProgressKey key = new ProgressKey(learnerId, subjectId);
        StructureTree tree = structureLoader.load(subjectId);
        byte[] bitmap = bitmapStore.getBitmap(key);
        UnlockResult unlock = unlockCalculator.compute(tree, bitmap);
        Map<String, Integer> bestScores = bitmapStore.bestScores(key);

        int total = tree.lessonCount();
        int passed = 0;
        String suggested = null;
        for (LessonNode lesson : tree.lessons().values()) {
            NodeStatus status = unlock.status(lesson.id());
            if (status == NodeStatus.PASSED) {
                passed++;
            } else if (status == NodeStatus.UNLOCKED && suggested == null) {
                suggested = lesson.id();
            }
        }
        double percentage = total == 0 ? 100.0 : Math.round(passed * 10000.0 / total) / 100.0;

        return new ProgressView(
                subjectId,
                tree.version(),
                percentage,
                suggested,
                total,
                passed,
                wallet.subjectXp(learnerId, subjectId),
                toView(tree.root(), unlock, bestScores));
    }

    public CompletionResult completeLesson(String learnerId, String subjectId, String lessonId, int performanceScore) {
        rewardCalculator.checkScore(performanceScore);
        if (lessonId == null || lessonId.isBlank()) {
            throw ProgressEngineException.invalidRequest("lessonId is required");
        }
        String resolvedSubject = subjectId;
        if (resolvedSubject == null || resolvedSubject.isBlank()) {
            resolvedSubject = allocator.subjectOfLesson(lessonId)
                    .orElseThrow(() -> ProgressEngineException.lessonNotFound(null, lessonId));
        }
        ProgressKey key = new ProgressKey(learnerId, resolvedSubject);
        StructureTree tree = structureLoader.load(resolvedSubject);
        String subject = resolvedSubject;
        LessonNode lesson = tree.lesson(lessonId)
                .orElseThrow(() -> ProgressEngineException.lessonNotFound(subject, lessonId));

        boolean wasAlreadySet = bitmapStore.setBit(key, lesson.bitPosition());
        OptionalInt previousBest = bitmapStore.raiseBestScore(key, lessonId, performanceScore);
        Reward reward = rewardCalculator.calculate(previousBest, performanceScore);

        long newTotal;
        if (reward.xp() > 0) {
            try {
                newTotal = wallet.credit(learnerId, subject, reward.xp());
            } catch (RuntimeException e) {
                try {
                    bitmapStore.restoreBestScore(key, lessonId, performanceScore, previousBest);
                } catch (RuntimeException restoreFailure) {
                    e.addSuppressed(restoreFailure);
                }
                throw e;
            }
        } else {
            newTotal = wallet.totalXp(learnerId);
        }

        // follows the best-score record, which also gates the base award
        boolean firstCompletion = reward.firstCompletion();
        auditSink.record(new CompletionEvent(
                learnerId, subject, lessonId,
                CompletionEvent.typeFor(firstCompletion, reward.newRecord()),
                performanceScore, reward.xp(), Instant.now()));
        log.info("Learner {} completed lesson {} in {} (score {}, first {}, bit already set {}, xp {})",
                learnerId, lessonId, subject, performanceScore, firstCompletion, wasAlreadySet, reward.xp());

        return new CompletionResult(true, subject, lessonId, reward.xp(), newTotal, firstCompletion, reward.newRecord());
    }

    private ProgressNode toView(StructureNode node, UnlockResult unlock, Map<String, Integer> bestScores) {
        NodeStatus status = unlock.status(node.id());
        if (node instanceof LessonNode lesson) {
            Integer best = status == NodeStatus.PASSED ? bestScores.get(lesson.id()) : null;
            return new ProgressNode(lesson.id(), lesson.type(), lesson.title(), status, best, List.of());
        }
        ContainerNode container = (ContainerNode) node;
        List<ProgressNode> children = new ArrayList<>(container.children().size());
        for (StructureNode child : container.children()) {
            children.add(toView(child, unlock, bestScores));
        }
        return new ProgressNode(container.id(), container.type(), container.title(), status, null, children);
    }
}
