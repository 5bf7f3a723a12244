package com.herzen.progress.structure;

import com.herzen.progress.structure.StructureModels.SourceDocument;

import java.util.Optional;

/** Where published subject structures come from. */
public interface StructureSource {

    Optional<SourceDocument> fetch(String subjectId);

    /** Current version (etag) of the subject's structure, cheap enough to poll. */
    Optional<String> currentVersion(String subjectId);
}
