package com.herzen.progress.api;

import com.herzen.progress.domain.ProgressEngineException;
import com.herzen.progress.progress.ProgressComputer;
import com.herzen.progress.progress.ProgressModels;
import com.herzen.progress.sync.SnapshotSyncer;
import com.herzen.progress.sync.SyncModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/progress")
public class ProgressController {
    private final ProgressComputer progressComputer;
    private final SnapshotSyncer syncer;

    public ProgressController(ProgressComputer progressComputer, SnapshotSyncer syncer) {
        this.progressComputer = progressComputer;
        this.syncer = syncer;
    }

    @GetMapping("/{subjectId}")
    public ResponseEntity<ProgressModels.ProgressView> progress(@PathVariable String subjectId,
                                                                @RequestParam String learnerId) {
        return ResponseEntity.ok(progressComputer.getProgress(learnerId, subjectId));
    }

    @PostMapping("/complete")
    public ResponseEntity<ProgressModels.CompletionResult> complete(@RequestBody CompleteRequest request) {
        if (request.performanceScore() == null) {
            throw ProgressEngineException.invalidRequest("performanceScore is required");
        }
        return ResponseEntity.ok(progressComputer.completeLesson(
                request.learnerId(), request.subjectId(), request.lessonId(), request.performanceScore()));
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncModels.SyncSummary> sync() {
        return ResponseEntity.ok(syncer.syncPending());
    }

    public record CompleteRequest(String learnerId, String subjectId, String lessonId, Integer performanceScore) {}
}
