package com.herzen.progress.api;

import com.herzen.progress.structure.BitPositionAllocator;
import com.herzen.progress.structure.StructureImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/subjects")
public class StructureController {
    private final StructureImportService importService;
    private final BitPositionAllocator allocator;

    public StructureController(StructureImportService importService, BitPositionAllocator allocator) {
        this.importService = importService;
        this.allocator = allocator;
    }

    @PostMapping("/{subjectId}/structure")
    public ResponseEntity<StructureImportService.ImportResult> publish(@PathVariable String subjectId,
                                                                       @RequestParam(defaultValue = "false") boolean dryRun,
                                                                       @RequestBody String content) {
        StructureImportService.ImportResult result = importService.publish(subjectId, content, dryRun);
        return result.valid() ? ResponseEntity.ok(result) : ResponseEntity.unprocessableEntity().body(result);
    }

    @PostMapping("/{subjectId}/lessons/{lessonId}/position")
    public ResponseEntity<PositionResponse> allocatePosition(@PathVariable String subjectId,
                                                             @PathVariable String lessonId) {
        return ResponseEntity.ok(new PositionResponse(subjectId, lessonId, allocator.allocate(subjectId, lessonId)));
    }

    public record PositionResponse(String subjectId, String lessonId, int bitPosition) {}
}
